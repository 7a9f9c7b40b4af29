package kcs.pricepulse.service.crawler.browser;

/**
 * Source of browser sessions. Every session must be closed, which returns the underlying
 * browser to its pool.
 */
public interface Browser {

    BrowserSession openSession();
}
