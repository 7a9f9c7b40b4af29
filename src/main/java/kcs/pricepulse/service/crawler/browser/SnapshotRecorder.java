package kcs.pricepulse.service.crawler.browser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import kcs.pricepulse.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriverException;
import org.springframework.stereotype.Component;

/**
 * Best-effort page capture for failed scrapes. Never throws: the scrape error is what the
 * caller needs to see.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRecorder {

    private final ScraperProperties properties;
    private final Clock clock;

    public void capture(BrowserSession session, String label) {
        if (!properties.getSnapshot().isEnabled()) {
            return;
        }
        try {
            Path dir = Path.of(properties.getSnapshot().getDirectory());
            Files.createDirectories(dir);
            Path base = dir.resolve(label + "_error_" + clock.instant().getEpochSecond());
            session.saveSnapshot(base);
            log.info("saved diagnostic snapshot {}", base);
        } catch (IOException | WebDriverException e) {
            log.warn("could not save snapshot for {}: {}", label, e.getMessage());
        }
    }
}
