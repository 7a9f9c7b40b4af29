package kcs.pricepulse.config;

import io.github.bonigarcia.wdm.WebDriverManager;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import kcs.pricepulse.service.crawler.browser.Browser;
import kcs.pricepulse.service.crawler.browser.BrowserPool;
import kcs.pricepulse.service.crawler.browser.SeleniumBrowser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebDriverConfig {

    private final ScraperProperties properties;

    // driver binary is resolved on first use, not at startup
    private volatile boolean driverResolved;

    @Bean(destroyMethod = "close")
    public BrowserPool browserPool() {
        ScraperProperties.Browser browser = properties.getBrowser();
        return new BrowserPool(this::newChromeDriver, browser.getPoolSize(),
                browser.getAcquireTimeout(), browser.getShutdownTimeout());
    }

    @Bean
    public Browser browser(BrowserPool browserPool) {
        return new SeleniumBrowser(browserPool, properties.getBrowser().getElementWaitTimeout());
    }

    private WebDriver newChromeDriver() {
        if (!driverResolved) {
            WebDriverManager.chromedriver().setup();
            driverResolved = true;
        }
        ScraperProperties.Browser browser = properties.getBrowser();
        ChromeOptions options = new ChromeOptions();
        if (browser.isHeadless()) {
            options.addArguments("--headless=new");
        }
        String userAgent = pickUserAgent(browser.getUserAgents());
        options.addArguments("--disable-gpu", "--no-sandbox",
                "--window-size=" + browser.getWindowSize(), "--disable-dev-shm-usage",
                "--disable-blink-features=AutomationControlled",
                "--lang=" + browser.getLanguage(), "--user-agent=" + userAgent);
        ChromeDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(browser.getNavigationTimeout());
        log.debug("chrome started, user-agent={}", userAgent);
        return driver;
    }

    private static String pickUserAgent(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) {
            return "Mozilla/5.0";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
