package kcs.pricepulse.service.crawler;

import kcs.pricepulse.config.PlatformSelectors;
import kcs.pricepulse.service.crawler.browser.Browser;
import kcs.pricepulse.service.crawler.browser.BrowserSession;
import kcs.pricepulse.service.crawler.browser.SnapshotRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProductScraper {

    private final SelectorTable selectorTable;
    private final Browser browser;
    private final PlatformExtractor extractor;
    private final SnapshotRecorder snapshotRecorder;

    /**
     * Loads the product page and extracts it.
     *
     * @throws kcs.pricepulse.exception.ScrapeException when the platform is unsupported, the
     *                                                   page does not load or a required field is missing
     */
    public ScrapedProduct scrape(String url) {
        PlatformSelectors platform = selectorTable.resolve(url);
        log.info("scraping [{}] {}", platform.getKey(), url);
        try (BrowserSession session = browser.openSession()) {
            try {
                Document page = session.open(url, platform.getReadySelector());
                return extractor.extract(page, platform);
            } catch (RuntimeException e) {
                snapshotRecorder.capture(session, platform.getKey());
                log.error("scrape failed [{}] {}: {}", platform.getKey(), url, e.getMessage());
                throw e;
            }
        }
    }
}
