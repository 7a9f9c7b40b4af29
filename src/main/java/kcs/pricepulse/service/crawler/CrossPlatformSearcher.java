package kcs.pricepulse.service.crawler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import kcs.pricepulse.config.PlatformSelectors;
import kcs.pricepulse.config.ScraperProperties;
import kcs.pricepulse.config.SearchSelectors;
import kcs.pricepulse.service.crawler.browser.Browser;
import kcs.pricepulse.service.crawler.browser.BrowserSession;
import kcs.pricepulse.service.crawler.browser.SnapshotRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Runs a query against competing platforms' search pages. Each platform is searched on its
 * own; a failure there is logged and yields an empty list for that platform only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrossPlatformSearcher {

    private final Browser browser;
    private final PlatformExtractor extractor;
    private final SnapshotRecorder snapshotRecorder;
    private final ScraperProperties properties;

    public Map<String, List<ListingCandidate>> searchAll(String query, List<PlatformSelectors> platforms) {
        Map<String, List<ListingCandidate>> results = new LinkedHashMap<>();
        for (PlatformSelectors platform : platforms) {
            results.put(platform.getKey(), search(platform, query));
        }
        return results;
    }

    public List<ListingCandidate> search(PlatformSelectors platform, String query) {
        if (!platform.isSearchable()) {
            return List.of();
        }
        try (BrowserSession session = browser.openSession()) {
            return searchIn(session, platform, query);
        } catch (RuntimeException e) {
            log.error("search failed [{}] '{}': {}", platform.getKey(), query, e.getMessage());
            return List.of();
        }
    }

    private List<ListingCandidate> searchIn(BrowserSession session, PlatformSelectors platform, String query) {
        SearchSelectors search = platform.getSearch();
        try {
            Document page = session.open(search.searchUrl(query), search.getResultSelector());
            List<ListingCandidate> candidates = new ArrayList<>();
            page.select(search.getResultSelector()).stream()
                    .limit(properties.getSearchResultLimit())
                    .forEach((Element entry) -> extractor.extractListing(entry, platform).ifPresent(candidates::add));
            log.info("search [{}] '{}': {} candidate(s)", platform.getKey(), query, candidates.size());
            return candidates;
        } catch (RuntimeException e) {
            snapshotRecorder.capture(session, platform.getKey() + "_search");
            throw e;
        }
    }
}
