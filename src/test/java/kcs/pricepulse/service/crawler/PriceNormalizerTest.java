package kcs.pricepulse.service.crawler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import kcs.pricepulse.exception.PriceParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PriceNormalizerTest {

    private final PriceNormalizer normalizer = new PriceNormalizer();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "₹1,299.50      | 129950",
            "â‚¹ 499        | 49900",
            "Rs. 2,499      | 249900",
            "INR 1,00,000   | 10000000",
            "$19.99         | 1999",
            "€ 5            | 500",
            "1,299.         | 129900",
            "12.345         | 1235",
            "₹ 499  ₹ 599   | 49900"
    })
    void shouldConvertPriceTextToMinorUnits(String text, long expected) {
        assertThat(normalizer.toMinorUnits(text)).isEqualTo(expected);
    }

    @Test
    void shouldDropNonBreakingThousandsSeparator() {
        assertThat(normalizer.toMinorUnits("1\u00A0299")).isEqualTo(129900);
    }

    @Test
    void shouldFailWhenNoNumberPresent() {
        assertThatThrownBy(() -> normalizer.toMinorUnits("Currently unavailable"))
                .isInstanceOf(PriceParseException.class)
                .hasMessageContaining("Currently unavailable");
    }

    @Test
    void shouldFailOnNull() {
        assertThatThrownBy(() -> normalizer.toMinorUnits(null)).isInstanceOf(PriceParseException.class);
    }
}
