package kcs.pricepulse.service.crawler.browser;

import java.time.Duration;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SeleniumBrowser implements Browser {

    private final BrowserPool pool;
    private final Duration elementWaitTimeout;

    @Override
    public BrowserSession openSession() {
        return new SeleniumBrowserSession(pool, pool.acquire(), elementWaitTimeout);
    }
}
