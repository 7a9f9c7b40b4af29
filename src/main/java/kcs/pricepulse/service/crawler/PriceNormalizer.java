package kcs.pricepulse.service.crawler;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import kcs.pricepulse.exception.PriceParseException;
import org.springframework.stereotype.Component;

/**
 * Turns scraped price text into integer minor units (paise, cents).
 * "₹1,299.50" becomes 129950. Only the first number in the text counts.
 */
@Component
public class PriceNormalizer {

    // longest first: "Rs." before "Rs", the mis-decoded rupee sign before the real one
    private static final List<String> CURRENCY_MARKERS =
            List.of("â‚¹", "₹", "Rs.", "Rs", "INR", "US$", "$", "€", "£");

    private static final Pattern THOUSANDS = Pattern.compile("(?<=\\d)[,\\u00A0\\u202F](?=\\d{3})");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    public long toMinorUnits(String priceText) {
        if (priceText == null) {
            throw PriceParseException.of("null");
        }
        String cleaned = priceText;
        for (String marker : CURRENCY_MARKERS) {
            cleaned = cleaned.replace(marker, " ");
        }
        cleaned = THOUSANDS.matcher(cleaned).replaceAll("").replace(",", "");

        Matcher m = NUMBER.matcher(cleaned);
        if (!m.find()) {
            throw PriceParseException.of(priceText);
        }
        try {
            return new BigDecimal(m.group())
                    .movePointRight(2)
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw PriceParseException.of(priceText, e);
        }
    }
}
