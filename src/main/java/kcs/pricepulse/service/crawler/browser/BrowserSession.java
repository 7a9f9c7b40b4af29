package kcs.pricepulse.service.crawler.browser;

import java.io.IOException;
import java.nio.file.Path;
import org.jsoup.nodes.Document;

/**
 * One leased browser. Navigation blocks until the page is loaded and {@code waitForSelector}
 * is present, then the rendered DOM is handed back as a jsoup {@link Document}.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * @param url             page to load
     * @param waitForSelector CSS selector that must appear, or {@code null} to wait for document ready only
     * @throws kcs.pricepulse.exception.UpstreamBlockedException on timeout or navigation failure
     */
    Document open(String url, String waitForSelector);

    /**
     * Writes diagnostics for the current page next to {@code basePath} (screenshot and page source).
     */
    void saveSnapshot(Path basePath) throws IOException;

    @Override
    void close();
}
