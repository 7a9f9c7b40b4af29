package kcs.pricepulse.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code scraper} section of {@code application.yml}: browser pool, timeouts,
 * diagnostics, matching knobs and the per-platform selector table.
 * <pre>{@code
 * scraper:
 *   browser:
 *     pool-size: 2
 *   platforms:
 *     amazon:
 *       hosts: [amazon.in]
 *       name:
 *         selectors: ["#productTitle"]
 * }</pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    private Browser browser = new Browser();

    private Snapshot snapshot = new Snapshot();

    /** Result entries read per platform search. */
    private int searchResultLimit = 3;

    /** Minimum token-set score (0-100) for a cross-platform match. */
    private int matchThreshold = 80;

    /** Platform key to selectors, insertion ordered. */
    private Map<String, PlatformSelectors> platforms = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Browser {

        private int poolSize = 2;

        private boolean headless = true;

        private String windowSize = "1280,2200";

        private String language = "en-US";

        private Duration navigationTimeout = Duration.ofSeconds(60);

        private Duration elementWaitTimeout = Duration.ofSeconds(30);

        /** How long a scrape waits for a free browser. */
        private Duration acquireTimeout = Duration.ofSeconds(90);

        /** Grace period for in-flight scrapes on shutdown before browsers are force-quit. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /** One is picked at random per browser instance. */
        private List<String> userAgents = new ArrayList<>(List.of("Mozilla/5.0"));
    }

    @Getter
    @Setter
    public static class Snapshot {

        private boolean enabled = true;

        private String directory = "snapshots";
    }
}
