package kcs.pricepulse.service.crawler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import kcs.pricepulse.exception.MissingFieldException;
import kcs.pricepulse.exception.PriceParseException;
import kcs.pricepulse.fixtures.Pages;
import kcs.pricepulse.fixtures.SelectorFixtures;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class PlatformExtractorTest {

    private final SelectorTable table = SelectorFixtures.selectorTable();
    private final PlatformExtractor extractor = new PlatformExtractor(new PriceNormalizer());

    @Test
    void shouldExtractAllFieldsFromProductPage() {
        var page = Pages.document("amazon-product.html", Pages.AMAZON_PRODUCT_URL);

        var product = extractor.extract(page, table.get("amazon"));

        assertThat(product.platform()).isEqualTo("amazon");
        assertThat(product.name()).isEqualTo("Acme Widget Pro X123-Y (Black, 128GB)");
        assertThat(product.price()).isEqualTo(129900);
        assertThat(product.imageUrl()).isEqualTo("https://www.amazon.in/images/I/61widget.jpg");
        assertThat(product.brand()).isEqualTo("Acme");
        assertThat(product.model()).isEqualTo("X123Y");
    }

    @Test
    void shouldFallBackToLaterSelectors() {
        var page = Pages.document("flipkart-product.html", Pages.FLIPKART_PRODUCT_URL);

        var product = extractor.extract(page, table.get("flipkart"));

        assertThat(product.name()).isEqualTo("Acme Widget Pro X123Y (Black, 128 GB)");
        assertThat(product.price()).isEqualTo(124900);
        assertThat(product.imageUrl()).isNull();
        assertThat(product.brand()).isNull();
        assertThat(product.model()).isEqualTo("X123Y");
    }

    @Test
    void shouldFailWhenRequiredPriceIsMissing() {
        var page = Pages.document("amazon-no-price.html", Pages.AMAZON_PRODUCT_URL);

        assertThatThrownBy(() -> extractor.extract(page, table.get("amazon")))
                .isInstanceOf(MissingFieldException.class)
                .hasFieldOrPropertyWithValue("field", "price");
    }

    @Test
    void shouldFailWhenPriceTextIsNotANumber() {
        var page = Pages.document("flipkart-bad-price.html", Pages.FLIPKART_PRODUCT_URL);

        assertThatThrownBy(() -> extractor.extract(page, table.get("flipkart")))
                .isInstanceOf(PriceParseException.class);
    }

    @Test
    void shouldTreatBlankTextAsMissing() {
        var page = Jsoup.parse("<span id='productTitle'>  </span><h1>x</h1>"
                + "<span class='a-price-whole'>499</span>", Pages.AMAZON_PRODUCT_URL);

        assertThatThrownBy(() -> extractor.extract(page, table.get("amazon")))
                .isInstanceOf(MissingFieldException.class)
                .hasFieldOrPropertyWithValue("field", "name");
    }

    @Test
    void shouldReadListingFromSearchEntry() {
        var page = Pages.document("flipkart-search.html", "https://www.flipkart.com/search?q=Acme%20X123Y");
        var flipkart = table.get("flipkart");
        var entries = page.select(flipkart.getSearch().getResultSelector());

        var first = extractor.extractListing(entries.get(0), flipkart);
        var withoutPrice = extractor.extractListing(entries.get(2), flipkart);

        assertThat(first).hasValueSatisfying(c -> {
            assertThat(c.name()).isEqualTo("Acme Widget Pro X123Y (Black, 128 GB)");
            assertThat(c.price()).isEqualTo(124900);
            assertThat(c.url()).isEqualTo("https://www.flipkart.com/acme-widget-pro-x123y-black-128-gb/p/itm001?pid=ACMX123Y");
        });
        assertThat(withoutPrice).isEmpty();
    }

    @Test
    void shouldStripBrandBoilerplate() {
        assertThat(PlatformExtractor.cleanBrand("Visit the Acme Store")).isEqualTo("Acme");
        assertThat(PlatformExtractor.cleanBrand("Brand: Acme")).isEqualTo("Acme");
        assertThat(PlatformExtractor.cleanBrand("Storebound")).isEqualTo("Storebound");
    }
}
