package kcs.pricepulse.service;

import java.util.List;
import java.util.Optional;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.NotificationFailureException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.exception.ScrapeException;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.ProductScraper;
import kcs.pricepulse.service.crawler.ScrapedProduct;
import kcs.pricepulse.service.notification.PriceDropMessage;
import kcs.pricepulse.service.notification.PriceDropNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Periodic price refresh of one product. The scrape runs outside any transaction; the write
 * is a single {@link PriceHistoryService#recordObservation} commit; notifications go out
 * only after that commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceUpdateReconciler {

    private final TrackedProductRepository productRepository;
    private final ProductScraper productScraper;
    private final PriceHistoryService priceHistoryService;
    private final PriceDropNotifier notifier;

    public void updatePrice(Long productId) {
        Optional<TrackedProduct> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            log.warn("Product {} not found, skipping price update", productId);
            return;
        }
        TrackedProduct product = found.get();

        ScrapedProduct scraped;
        try {
            scraped = productScraper.scrape(product.getUrl());
        } catch (ScrapeException e) {
            log.error("Price update failed for product {}: {}", productId, e.getMessage());
            return;
        }

        List<PriceDropMessage> drops;
        try {
            drops = priceHistoryService.recordObservation(productId, scraped.price());
        } catch (ProductNotFoundException e) {
            log.warn("Product {} was deleted during its price update", productId);
            return;
        }
        log.info("Updated price for product {}: {} -> {}", productId, product.getCurrentPrice(), scraped.price());

        drops.forEach(this::notifyQuietly);
    }

    private void notifyQuietly(PriceDropMessage message) {
        try {
            notifier.send(message);
        } catch (NotificationFailureException e) {
            log.error("Alert {} triggered but notification failed: {}", message.alertId(), e.getMessage());
        }
    }
}
