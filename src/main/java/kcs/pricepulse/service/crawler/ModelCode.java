package kcs.pricepulse.service.crawler;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manufacturer model codes inside product titles: an uppercase alphanumeric token of at
 * least five characters. Hyphen-joined segments ("X123-Y") form one token and are returned
 * without hyphens ("X123Y"). A trailing segment that is not uppercase ("WH1000XM5-Black")
 * is left out of the token.
 */
public final class ModelCode {

    private static final int MIN_LENGTH = 5;

    private static final Pattern TOKEN =
            Pattern.compile("(?<![A-Za-z0-9-])([A-Z0-9]+(?:-[A-Z0-9]+)*)(?![A-Za-z0-9])");

    private ModelCode() {
    }

    public static Optional<String> extract(String productName) {
        if (productName == null) {
            return Optional.empty();
        }
        Matcher m = TOKEN.matcher(productName);
        while (m.find()) {
            String code = m.group(1).replace("-", "");
            if (code.length() >= MIN_LENGTH) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
