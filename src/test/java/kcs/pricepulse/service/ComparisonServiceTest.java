package kcs.pricepulse.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_URL;
import static kcs.pricepulse.fixtures.TrackerFixtures.now;
import static kcs.pricepulse.fixtures.TrackerFixtures.scrapedProduct;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import kcs.pricepulse.entity.ComparisonResult;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.fixtures.TrackerFixtures;
import kcs.pricepulse.repository.ComparisonResultRepository;
import kcs.pricepulse.repository.JpaTestConfig;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.MatchedListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaTestConfig.class, ComparisonService.class})
class ComparisonServiceTest {

    @Autowired
    private ComparisonService comparisonService;

    @Autowired
    private TrackedProductRepository productRepository;

    @Autowired
    private ComparisonResultRepository comparisonRepository;

    private TrackedProduct product;

    @BeforeEach
    void setUp() {
        product = productRepository.save(TrackedProduct.create(SOME_URL, scrapedProduct(10000), now()));
    }

    @Test
    void shouldReplaceWholeComparisonSet() {
        // given
        comparisonService.replaceComparisons(product.getId(), List.of(
                match("flipkart", 9900), match("meesho", 9700)));

        // when
        comparisonService.replaceComparisons(product.getId(), List.of(match("flipkart", 9500)));

        // then
        var current = comparisonService.findComparisons(product.getId());
        assertThat(current).extracting(ComparisonResult::getPlatform).containsExactly("flipkart");
        assertThat(current).extracting(ComparisonResult::getFoundPrice).containsExactly(9500L);
        assertThat(current.get(0).getLastChecked()).isEqualTo(now());
    }

    @Test
    void shouldRefreshLastCheckedWhenRerunFindsSameListings() {
        // given
        var matches = List.of(match("flipkart", 9900), match("meesho", 9700));
        var firstRun = new ComparisonService(productRepository, comparisonRepository, TrackerFixtures.fixedClock());
        var laterRun = new ComparisonService(productRepository, comparisonRepository,
                Clock.fixed(TrackerFixtures.NOW.plus(Duration.ofHours(6)), ZoneOffset.UTC));
        firstRun.replaceComparisons(product.getId(), matches);
        var before = comparisonService.findComparisons(product.getId());
        var checkedBefore = before.get(0).getLastChecked();

        // when
        laterRun.replaceComparisons(product.getId(), matches);

        // then
        var after = comparisonService.findComparisons(product.getId());
        assertThat(after).extracting(ComparisonResult::getPlatform, ComparisonResult::getFoundName,
                        ComparisonResult::getFoundPrice, ComparisonResult::getFoundUrl)
                .containsExactlyElementsOf(before.stream()
                        .map(c -> tuple(c.getPlatform(), c.getFoundName(),
                                c.getFoundPrice(), c.getFoundUrl()))
                        .toList());
        assertThat(after).allSatisfy(c -> assertThat(c.getLastChecked()).isAfter(checkedBefore));
        assertThat(after).extracting(ComparisonResult::getLastChecked).containsOnly(now().plusHours(6));
    }

    @Test
    void shouldEmptySetWhenNothingMatched() {
        comparisonService.replaceComparisons(product.getId(), List.of(match("flipkart", 9900)));

        comparisonService.replaceComparisons(product.getId(), List.of());

        assertThat(comparisonService.findComparisons(product.getId())).isEmpty();
    }

    @Test
    void shouldOrderByFoundPrice() {
        comparisonService.replaceComparisons(product.getId(), List.of(
                match("flipkart", 9900), match("meesho", 9700)));

        assertThat(comparisonService.findComparisons(product.getId()))
                .extracting(ComparisonResult::getPlatform)
                .containsExactly("meesho", "flipkart");
    }

    private static MatchedListing match(String platform, long price) {
        return new MatchedListing(platform, "Acme Widget Pro X123Y", price,
                "https://www." + platform + ".com/p/" + price, 100.0);
    }
}
