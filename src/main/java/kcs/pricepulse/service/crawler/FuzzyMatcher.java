package kcs.pricepulse.service.crawler;

import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class FuzzyMatcher {

    public static final int DEFAULT_THRESHOLD = 80;

    public Optional<MatchedListing> bestMatch(String query, List<ListingCandidate> candidates) {
        return bestMatch(query, candidates, DEFAULT_THRESHOLD);
    }

    /**
     * Highest scoring candidate if its score reaches {@code threshold}. Ties go to the
     * candidate that comes first.
     */
    public Optional<MatchedListing> bestMatch(String query, List<ListingCandidate> candidates, int threshold) {
        ListingCandidate best = null;
        double bestScore = -1;
        for (ListingCandidate candidate : candidates) {
            double score = TokenSetRatio.score(query, candidate.name());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < threshold) {
            return Optional.empty();
        }
        return Optional.of(MatchedListing.of(best, bestScore));
    }
}
