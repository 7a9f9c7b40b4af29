package kcs.pricepulse.service.crawler;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import kcs.pricepulse.config.PlatformSelectors;
import kcs.pricepulse.config.ScraperProperties;
import kcs.pricepulse.exception.UnsupportedPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read-only view over the configured platforms: URL to platform resolution and the list of
 * platforms a product can be compared against.
 */
@Slf4j
@Component
public class SelectorTable {

    private final Map<String, PlatformSelectors> platforms = new LinkedHashMap<>();

    public SelectorTable(ScraperProperties properties) {
        properties.getPlatforms().forEach((key, platform) -> {
            platform.setKey(key);
            if (platform.getName().isEmpty() || platform.getPrice().isEmpty()) {
                throw new IllegalStateException("platform '" + key + "' needs name and price selectors");
            }
            platforms.put(key, platform);
        });
        log.info("selector table loaded: {}", platforms.keySet());
    }

    public PlatformSelectors resolve(String url) {
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            throw UnsupportedPlatformException.of(url);
        }
        if (host == null) {
            throw UnsupportedPlatformException.of(url);
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (PlatformSelectors platform : platforms.values()) {
            for (String candidate : platform.getHosts()) {
                String h = candidate.toLowerCase(Locale.ROOT);
                if (normalized.equals(h) || normalized.endsWith("." + h)) {
                    return platform;
                }
            }
        }
        throw UnsupportedPlatformException.of(url);
    }

    public PlatformSelectors get(String key) {
        PlatformSelectors platform = platforms.get(key);
        if (platform == null) {
            throw UnsupportedPlatformException.unknownKey(key);
        }
        return platform;
    }

    /** Searchable platforms other than {@code platformKey}, in configuration order. */
    public List<PlatformSelectors> competitorsOf(String platformKey) {
        List<PlatformSelectors> competitors = new ArrayList<>();
        for (PlatformSelectors platform : platforms.values()) {
            if (!platform.getKey().equals(platformKey) && platform.isSearchable()) {
                competitors.add(platform);
            }
        }
        return competitors;
    }

    public Collection<PlatformSelectors> all() {
        return Collections.unmodifiableCollection(platforms.values());
    }
}
