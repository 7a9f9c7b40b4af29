package kcs.pricepulse.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_PRODUCT_ID;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_URL;
import static kcs.pricepulse.fixtures.TrackerFixtures.SOME_USER_ID;
import static kcs.pricepulse.fixtures.TrackerFixtures.alert;
import static kcs.pricepulse.fixtures.TrackerFixtures.product;
import static kcs.pricepulse.fixtures.TrackerFixtures.scrapedProduct;

import java.util.List;
import java.util.Optional;
import kcs.pricepulse.exception.MissingFieldException;
import kcs.pricepulse.exception.NotificationFailureException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.ProductScraper;
import kcs.pricepulse.service.notification.PriceDropMessage;
import kcs.pricepulse.service.notification.PriceDropNotifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PriceUpdateReconcilerTest {

    @Mock
    private TrackedProductRepository productRepository;

    @Mock
    private ProductScraper productScraper;

    @Mock
    private PriceHistoryService priceHistoryService;

    @Mock
    private PriceDropNotifier notifier;

    @InjectMocks
    private PriceUpdateReconciler reconciler;

    @Test
    void shouldRecordPriceAndNotifyTriggeredAlerts() {
        // given
        var product = product(SOME_PRODUCT_ID, 10000);
        var message = PriceDropMessage.of(alert(5L, SOME_USER_ID, product, 9000), product, 10000);
        given(productRepository.findById(SOME_PRODUCT_ID)).willReturn(Optional.of(product));
        given(productScraper.scrape(SOME_URL)).willReturn(scrapedProduct(8500));
        given(priceHistoryService.recordObservation(SOME_PRODUCT_ID, 8500)).willReturn(List.of(message));

        // when
        reconciler.updatePrice(SOME_PRODUCT_ID);

        // then
        then(notifier).should().send(message);
    }

    @Test
    void shouldSkipMissingProduct() {
        given(productRepository.findById(SOME_PRODUCT_ID)).willReturn(Optional.empty());

        reconciler.updatePrice(SOME_PRODUCT_ID);

        then(productScraper).shouldHaveNoInteractions();
        then(priceHistoryService).shouldHaveNoInteractions();
    }

    @Test
    void shouldWriteNothingWhenScrapeFails() {
        // given
        given(productRepository.findById(SOME_PRODUCT_ID)).willReturn(Optional.of(product(SOME_PRODUCT_ID, 10000)));
        given(productScraper.scrape(SOME_URL)).willThrow(MissingFieldException.of("Amazon", "price"));

        // when
        reconciler.updatePrice(SOME_PRODUCT_ID);

        // then
        then(priceHistoryService).should(never()).recordObservation(any(), anyLong());
        then(notifier).shouldHaveNoInteractions();
    }

    @Test
    void shouldKeepNotifyingAfterOneDeliveryFails() {
        // given
        var product = product(SOME_PRODUCT_ID, 10000);
        var first = PriceDropMessage.of(alert(5L, SOME_USER_ID, product, 9000), product, 10000);
        var second = PriceDropMessage.of(alert(6L, SOME_USER_ID, product, 9500), product, 10000);
        given(productRepository.findById(SOME_PRODUCT_ID)).willReturn(Optional.of(product));
        given(productScraper.scrape(SOME_URL)).willReturn(scrapedProduct(8500));
        given(priceHistoryService.recordObservation(SOME_PRODUCT_ID, 8500)).willReturn(List.of(first, second));
        willThrow(NotificationFailureException.of("shopper@example.com", new RuntimeException("smtp down")))
                .given(notifier).send(first);

        // when
        reconciler.updatePrice(SOME_PRODUCT_ID);

        // then
        then(notifier).should().send(second);
    }

    @Test
    void shouldStopWhenProductDeletedMidRun() {
        // given
        given(productRepository.findById(SOME_PRODUCT_ID)).willReturn(Optional.of(product(SOME_PRODUCT_ID, 10000)));
        given(productScraper.scrape(SOME_URL)).willReturn(scrapedProduct(8500));
        given(priceHistoryService.recordObservation(SOME_PRODUCT_ID, 8500))
                .willThrow(ProductNotFoundException.of(SOME_PRODUCT_ID));

        // when
        reconciler.updatePrice(SOME_PRODUCT_ID);

        // then
        then(notifier).shouldHaveNoInteractions();
    }
}
