package kcs.pricepulse.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_URL;
import static kcs.pricepulse.fixtures.TrackerFixtures.now;
import static kcs.pricepulse.fixtures.TrackerFixtures.scrapedProduct;

import kcs.pricepulse.entity.PricePoint;
import kcs.pricepulse.entity.TrackedProduct;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

@DataJpaTest
@Import(JpaTestConfig.class)
class PricePointRepositoryTest {

    @Autowired
    private TrackedProductRepository productRepository;

    @Autowired
    private PricePointRepository pricePointRepository;

    private TrackedProduct product;

    @BeforeEach
    void setUp() {
        product = productRepository.save(TrackedProduct.create(SOME_URL, scrapedProduct(10000), now()));
        pricePointRepository.save(PricePoint.record(product, 10000, now().minusDays(2)));
        pricePointRepository.save(PricePoint.record(product, 9500, now().minusDays(1)));
        pricePointRepository.save(PricePoint.record(product, 9000, now()));
    }

    @Test
    void shouldReturnHistoryNewestFirst() {
        var page = pricePointRepository.findByProduct_IdOrderByRecordedAtDescIdDesc(product.getId(), PageRequest.of(0, 2));

        assertThat(page.getContent()).extracting(PricePoint::getPrice).containsExactly(9000L, 9500L);
        assertThat(page.getTotalElements()).isEqualTo(3);
    }

    @Test
    void shouldDeleteOnlyPointsOlderThanThreshold() {
        var deleted = pricePointRepository.deleteByRecordedAtBefore(now().minusHours(12));

        assertThat(deleted).isEqualTo(2);
        assertThat(pricePointRepository.countByProduct_Id(product.getId())).isEqualTo(1);
    }

    @Test
    void shouldDeleteAllPointsOfProduct() {
        assertThat(pricePointRepository.deleteByProductId(product.getId())).isEqualTo(3);
        assertThat(pricePointRepository.countByProduct_Id(product.getId())).isZero();
    }
}
