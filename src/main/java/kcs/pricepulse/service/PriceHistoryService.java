package kcs.pricepulse.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import kcs.pricepulse.entity.PriceAlert;
import kcs.pricepulse.entity.PricePoint;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.ComparisonResultRepository;
import kcs.pricepulse.repository.PriceAlertRepository;
import kcs.pricepulse.repository.PricePointRepository;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.ScrapedProduct;
import kcs.pricepulse.service.notification.PriceDropMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional writes around products and their price history. Every public write here is
 * one transaction; callers scrape before calling and notify after it returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryService {

    private final TrackedProductRepository productRepository;
    private final PricePointRepository pricePointRepository;
    private final PriceAlertRepository alertRepository;
    private final ComparisonResultRepository comparisonRepository;
    private final Clock clock;

    @Transactional
    public TrackedProduct registerProduct(String url, ScrapedProduct scraped) {
        LocalDateTime now = LocalDateTime.now(clock);
        TrackedProduct product = productRepository.saveAndFlush(TrackedProduct.create(url, scraped, now));
        pricePointRepository.save(PricePoint.record(product, scraped.price(), now));
        log.info("registerProduct: id={}, platform={}, price={}", product.getId(), product.getPlatform(), scraped.price());
        return product;
    }

    /**
     * Stores a fresh price: current price, a new history point and every alert it satisfies,
     * all in one commit.
     *
     * @return one message per alert triggered by this call
     */
    @Transactional
    public List<PriceDropMessage> recordObservation(Long productId, long price) {
        TrackedProduct product = productRepository.findById(productId)
                .orElseThrow(() -> ProductNotFoundException.of(productId));
        LocalDateTime now = LocalDateTime.now(clock);
        long previous = product.getCurrentPrice();

        product.updatePrice(price, now);
        pricePointRepository.save(PricePoint.record(product, price, now));

        List<PriceDropMessage> triggered = new ArrayList<>();
        for (PriceAlert alert : alertRepository.findTriggerable(productId, price)) {
            if (alert.trigger(now)) {
                triggered.add(PriceDropMessage.of(alert, product, previous));
            }
        }
        log.info("recordObservation: productId={}, previous={}, price={}, triggered={}",
                productId, previous, price, triggered.size());
        return triggered;
    }

    @Transactional(readOnly = true)
    public Page<PricePoint> history(Long productId, Pageable pageable) {
        if (!productRepository.existsById(productId)) {
            throw ProductNotFoundException.of(productId);
        }
        return pricePointRepository.findByProduct_IdOrderByRecordedAtDescIdDesc(productId, pageable);
    }

    /** Removes the product with its history, alerts and comparison results. */
    @Transactional
    public void deleteProduct(Long productId) {
        TrackedProduct product = productRepository.findById(productId)
                .orElseThrow(() -> ProductNotFoundException.of(productId));
        int comparisons = comparisonRepository.deleteByProductId(productId);
        int alerts = alertRepository.deleteByProductId(productId);
        int points = pricePointRepository.deleteByProductId(productId);
        productRepository.delete(product);
        log.info("deleteProduct: id={}, pricePoints={}, alerts={}, comparisons={}", productId, points, alerts, comparisons);
    }

    @Transactional
    public int purgeOldPricePoints(int retentionDays) {
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(retentionDays);
        int deleted = pricePointRepository.deleteByRecordedAtBefore(threshold);
        log.info("purgeOldPricePoints: retentionDays={}, threshold={}, deleted={}", retentionDays, threshold, deleted);
        return deleted;
    }
}
