package kcs.pricepulse.service.crawler;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonical search string for a product. It is sent to the other platforms' search pages
 * and is also the left-hand side of fuzzy matching.
 */
@Component
public class QueryBuilder {

    private static final Pattern CORE_TITLE_END = Pattern.compile("[(|\\-,]");

    public String build(String productName, String brand) {
        String safeBrand = brand == null ? "" : brand.trim();
        Optional<String> model = ModelCode.extract(productName);
        if (model.isPresent()) {
            return (safeBrand + " " + model.get()).trim();
        }
        String core = coreTitle(productName);
        if (core.toLowerCase(Locale.ROOT).contains(safeBrand.toLowerCase(Locale.ROOT))) {
            return core;
        }
        return (safeBrand + " " + core).trim();
    }

    /** Title up to the first '(', '|', '-' or ','. */
    static String coreTitle(String productName) {
        if (productName == null) {
            return "";
        }
        return CORE_TITLE_END.split(productName, 2)[0].trim();
    }
}
