package kcs.pricepulse.service.crawler.browser;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import kcs.pricepulse.exception.UpstreamBlockedException;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

/**
 * Bounded pool of {@link WebDriver} instances shared by concurrent scrape tasks.
 * Drivers are created lazily; a driver released as unhealthy is quit and replaced on demand.
 */
@Slf4j
public class BrowserPool implements AutoCloseable {

    private final Supplier<WebDriver> driverFactory;
    private final int size;
    private final Duration acquireTimeout;
    private final Duration shutdownTimeout;

    private final Semaphore permits;
    private final BlockingQueue<WebDriver> idle = new LinkedBlockingQueue<>();
    private final Set<WebDriver> created = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public BrowserPool(Supplier<WebDriver> driverFactory, int size, Duration acquireTimeout, Duration shutdownTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be at least 1");
        }
        this.driverFactory = driverFactory;
        this.size = size;
        this.acquireTimeout = acquireTimeout;
        this.shutdownTimeout = shutdownTimeout;
        this.permits = new Semaphore(size, true);
    }

    public WebDriver acquire() {
        if (closed) {
            throw new IllegalStateException("browser pool is closed");
        }
        try {
            if (!permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw UpstreamBlockedException.noBrowserAvailable(acquireTimeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for a browser", e);
        }
        WebDriver driver = idle.poll();
        if (driver != null) {
            return driver;
        }
        try {
            driver = driverFactory.get();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        created.add(driver);
        log.debug("browser created ({} of {})", created.size(), size);
        return driver;
    }

    public void release(WebDriver driver, boolean healthy) {
        try {
            if (closed || !healthy) {
                quit(driver);
            } else {
                idle.offer(driver);
            }
        } finally {
            permits.release();
        }
    }

    public int available() {
        return permits.availablePermits();
    }

    /**
     * Stops handing out browsers, waits up to the shutdown timeout for leased ones to come back,
     * then quits everything that is still open.
     */
    @Override
    public void close() {
        closed = true;
        boolean drained = false;
        try {
            drained = permits.tryAcquire(size, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!drained) {
            log.warn("browser pool closing with scrapes still in flight; forcing quit");
        }
        created.forEach(this::quit);
        idle.clear();
        log.info("browser pool closed");
    }

    private void quit(WebDriver driver) {
        created.remove(driver);
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("driver quit failed: {}", e.getMessage());
        }
    }
}
