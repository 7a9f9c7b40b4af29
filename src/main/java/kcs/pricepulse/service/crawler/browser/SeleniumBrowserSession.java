package kcs.pricepulse.service.crawler.browser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import kcs.pricepulse.exception.UpstreamBlockedException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

@Slf4j
class SeleniumBrowserSession implements BrowserSession {

    private final BrowserPool pool;
    private final WebDriver driver;
    private final Duration elementWaitTimeout;
    private boolean healthy = true;
    private boolean closed;

    SeleniumBrowserSession(BrowserPool pool, WebDriver driver, Duration elementWaitTimeout) {
        this.pool = pool;
        this.driver = driver;
        this.elementWaitTimeout = elementWaitTimeout;
    }

    @Override
    public Document open(String url, String waitForSelector) {
        try {
            driver.get(url);
            WebDriverWait wait = new WebDriverWait(driver, elementWaitTimeout);
            wait.until(d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
            if (waitForSelector != null && !waitForSelector.isBlank()) {
                wait.until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(waitForSelector)));
            }
            return Jsoup.parse(driver.getPageSource(), driver.getCurrentUrl());
        } catch (TimeoutException e) {
            throw UpstreamBlockedException.timeout(url, waitForSelector == null ? "document ready" : waitForSelector, e);
        } catch (WebDriverException e) {
            healthy = false;
            throw UpstreamBlockedException.navigationFailed(url, e);
        }
    }

    @Override
    public void saveSnapshot(Path basePath) throws IOException {
        Path html = basePath.resolveSibling(basePath.getFileName() + ".html");
        Files.writeString(html, driver.getPageSource(), StandardCharsets.UTF_8);
        if (driver instanceof TakesScreenshot screenshotter) {
            Path png = basePath.resolveSibling(basePath.getFileName() + ".png");
            Files.copy(screenshotter.getScreenshotAs(OutputType.FILE).toPath(), png, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.release(driver, healthy);
    }
}
