package kcs.pricepulse.service.crawler;

/** A search result accepted by the fuzzy matcher, with its 0-100 similarity score. */
public record MatchedListing(String platform, String name, long price, String url, double score) {

    public static MatchedListing of(ListingCandidate candidate, double score) {
        return new MatchedListing(candidate.platform(), candidate.name(), candidate.price(), candidate.url(), score);
    }
}
