package kcs.pricepulse.service.crawler;

import java.util.Optional;
import java.util.regex.Pattern;
import kcs.pricepulse.config.FieldSelectors;
import kcs.pricepulse.config.PlatformSelectors;
import kcs.pricepulse.config.SearchSelectors;
import kcs.pricepulse.exception.MissingFieldException;
import kcs.pricepulse.exception.PriceParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

/**
 * Reads product fields out of a rendered page using the platform's selector table.
 * Name and price are required; image, brand and model degrade to null.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformExtractor {

    private static final Pattern BRAND_BOILERPLATE = Pattern.compile("Visit the|\\bStore\\b|^\\s*Brand:");

    private final PriceNormalizer priceNormalizer;

    public ScrapedProduct extract(Document page, PlatformSelectors platform) {
        String name = firstValue(page, platform.getName())
                .orElseThrow(() -> MissingFieldException.of(platform.label(), "name"));
        String priceText = firstValue(page, platform.getPrice())
                .orElseThrow(() -> MissingFieldException.of(platform.label(), "price"));
        long price = priceNormalizer.toMinorUnits(priceText);

        String imageUrl = firstValue(page, platform.getImage()).orElse(null);
        String brand = firstValue(page, platform.getBrand())
                .map(PlatformExtractor::cleanBrand)
                .filter(b -> !b.isEmpty())
                .orElse(null);
        String model = ModelCode.extract(name).orElse(null);

        log.debug("extracted [{}] name={}, price={}, brand={}, model={}", platform.getKey(), name, price, brand, model);
        return new ScrapedProduct(platform.getKey(), name, price, imageUrl, brand, model);
    }

    /**
     * Lightweight read of one search result entry. Entries missing a name, price or link,
     * or carrying an unparseable price, are skipped.
     */
    public Optional<ListingCandidate> extractListing(Element entry, PlatformSelectors platform) {
        SearchSelectors search = platform.getSearch();
        Optional<String> name = firstValue(entry, search.getName());
        Optional<String> priceText = firstValue(entry, search.getPrice());
        Optional<String> url = linkOf(entry, search.getLink());
        if (name.isEmpty() || priceText.isEmpty() || url.isEmpty()) {
            log.debug("skip {} result: name={}, price={}, url={}", platform.getKey(), name, priceText, url);
            return Optional.empty();
        }
        try {
            long price = priceNormalizer.toMinorUnits(priceText.get());
            return Optional.of(new ListingCandidate(platform.getKey(), name.get(), price, url.get()));
        } catch (PriceParseException e) {
            log.debug("skip {} result '{}': {}", platform.getKey(), name.get(), e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> firstValue(Element root, FieldSelectors field) {
        if (field == null || field.isEmpty()) {
            return Optional.empty();
        }
        for (String selector : field.getSelectors()) {
            Optional<String> value = valueOf(root, selector, field.getAttribute());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> valueOf(Element root, String selector, String attribute) {
        try {
            for (Element el : root.select(selector)) {
                String value = attribute == null ? el.text() : attributeOf(el, attribute);
                if (value != null && !value.isBlank()) {
                    return Optional.of(value.trim());
                }
            }
        } catch (Selector.SelectorParseException e) {
            log.warn("invalid selector '{}': {}", selector, e.getMessage());
        }
        return Optional.empty();
    }

    private static String attributeOf(Element el, String attribute) {
        if (!el.hasAttr(attribute)) {
            return null;
        }
        String absolute = el.absUrl(attribute);
        return absolute.isEmpty() ? el.attr(attribute) : absolute;
    }

    private static Optional<String> linkOf(Element entry, FieldSelectors link) {
        if (entry.hasAttr("href")) {
            String href = attributeOf(entry, "href");
            if (href != null && !href.isBlank()) {
                return Optional.of(href.trim());
            }
        }
        return firstValue(entry, link);
    }

    static String cleanBrand(String raw) {
        return BRAND_BOILERPLATE.matcher(raw).replaceAll("").replaceAll("\\s+", " ").trim();
    }
}
