package kcs.pricepulse.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_PRODUCT_ID;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_URL;
import static kcs.pricepulse.fixtures.TrackerFixtures.product;
import static kcs.pricepulse.fixtures.TrackerFixtures.scrapedProduct;

import kcs.pricepulse.exception.DuplicateProductException;
import kcs.pricepulse.exception.MissingFieldException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.ProductScraper;
import kcs.pricepulse.service.scheduler.JobKey;
import kcs.pricepulse.service.scheduler.JobScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class TrackingServiceTest {

    @Mock
    private TrackedProductRepository productRepository;

    @Mock
    private ProductScraper productScraper;

    @Mock
    private PriceHistoryService priceHistoryService;

    @Mock
    private ComparisonService comparisonService;

    @Mock
    private JobScheduler jobScheduler;

    @InjectMocks
    private TrackingService trackingService;

    @Test
    void shouldTrackScheduleAndStartFirstComparison() {
        // given
        var scraped = scrapedProduct(10000);
        var product = product(SOME_PRODUCT_ID, 10000);
        given(productRepository.existsByUrl(SOME_URL)).willReturn(false);
        given(productScraper.scrape(SOME_URL)).willReturn(scraped);
        given(priceHistoryService.registerProduct(SOME_URL, scraped)).willReturn(product);

        // when
        var result = trackingService.track("  " + SOME_URL + " ");

        // then
        assertThat(result).isSameAs(product);
        then(jobScheduler).should().scheduleProduct(SOME_PRODUCT_ID);
        then(jobScheduler).should().runNow(JobKey.comparison(SOME_PRODUCT_ID));
    }

    @Test
    void shouldRejectAlreadyTrackedUrlWithoutScraping() {
        given(productRepository.existsByUrl(SOME_URL)).willReturn(true);

        assertThatThrownBy(() -> trackingService.track(SOME_URL)).isInstanceOf(DuplicateProductException.class);

        then(productScraper).shouldHaveNoInteractions();
    }

    @Test
    void shouldSurfaceScrapeFailureAndStoreNothing() {
        given(productRepository.existsByUrl(SOME_URL)).willReturn(false);
        given(productScraper.scrape(SOME_URL)).willThrow(MissingFieldException.of("Amazon", "name"));

        assertThatThrownBy(() -> trackingService.track(SOME_URL)).isInstanceOf(MissingFieldException.class);

        then(priceHistoryService).shouldHaveNoInteractions();
        then(jobScheduler).shouldHaveNoInteractions();
    }

    @Test
    void shouldMapConcurrentInsertToDuplicate() {
        var scraped = scrapedProduct(10000);
        given(productRepository.existsByUrl(SOME_URL)).willReturn(false);
        given(productScraper.scrape(SOME_URL)).willReturn(scraped);
        given(priceHistoryService.registerProduct(SOME_URL, scraped))
                .willThrow(new DataIntegrityViolationException("uk_product_url"));

        assertThatThrownBy(() -> trackingService.track(SOME_URL)).isInstanceOf(DuplicateProductException.class);

        then(jobScheduler).shouldHaveNoInteractions();
    }

    @Test
    void shouldRemoveJobsAndDataOnDelete() {
        given(productRepository.existsById(SOME_PRODUCT_ID)).willReturn(true);

        trackingService.deleteProduct(SOME_PRODUCT_ID);

        then(jobScheduler).should().removeProduct(SOME_PRODUCT_ID);
        then(priceHistoryService).should().deleteProduct(SOME_PRODUCT_ID);
    }

    @Test
    void shouldFailToDeleteUnknownProduct() {
        given(productRepository.existsById(SOME_PRODUCT_ID)).willReturn(false);

        assertThatThrownBy(() -> trackingService.deleteProduct(SOME_PRODUCT_ID))
                .isInstanceOf(ProductNotFoundException.class);

        then(jobScheduler).should(never()).removeProduct(anyLong());
    }

    @Test
    void shouldReportOnlyJobsThatStartedOnRescan() {
        // given
        given(productRepository.existsById(SOME_PRODUCT_ID)).willReturn(true);
        given(jobScheduler.runNow(JobKey.price(SOME_PRODUCT_ID))).willReturn(true);
        given(jobScheduler.runNow(JobKey.comparison(SOME_PRODUCT_ID))).willReturn(false);

        // when
        var started = trackingService.triggerRescan(SOME_PRODUCT_ID);

        // then
        assertThat(started).containsExactly("scrape_price_1");
    }

    @Test
    void shouldFailToRescanUnknownProduct() {
        given(productRepository.existsById(SOME_PRODUCT_ID)).willReturn(false);

        assertThatThrownBy(() -> trackingService.triggerRescan(SOME_PRODUCT_ID))
                .isInstanceOf(ProductNotFoundException.class);

        then(jobScheduler).should(never()).runNow(any());
        then(productScraper).should(never()).scrape(anyString());
    }
}
