package kcs.pricepulse.service;

import java.util.ArrayList;
import java.util.List;
import kcs.pricepulse.entity.ComparisonResult;
import kcs.pricepulse.entity.PricePoint;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.DuplicateProductException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.ProductScraper;
import kcs.pricepulse.service.crawler.ScrapedProduct;
import kcs.pricepulse.service.scheduler.JobKey;
import kcs.pricepulse.service.scheduler.JobScheduler;
import kcs.pricepulse.service.scheduler.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrackingService {

    private final TrackedProductRepository productRepository;
    private final ProductScraper productScraper;
    private final PriceHistoryService priceHistoryService;
    private final ComparisonService comparisonService;
    private final JobScheduler jobScheduler;

    /**
     * Scrapes the page, stores the product with its first price point and schedules its
     * jobs. The first comparison run is started in the background.
     *
     * @throws DuplicateProductException if the URL is already tracked
     * @throws kcs.pricepulse.exception.ScrapeException if the page cannot be scraped
     */
    public TrackedProduct track(String url) {
        String normalized = url.trim();
        if (productRepository.existsByUrl(normalized)) {
            throw DuplicateProductException.of(normalized);
        }

        ScrapedProduct scraped = productScraper.scrape(normalized);

        TrackedProduct product;
        try {
            product = priceHistoryService.registerProduct(normalized, scraped);
        } catch (DataIntegrityViolationException e) {
            // tracked concurrently while we were scraping
            throw DuplicateProductException.of(normalized);
        }

        jobScheduler.scheduleProduct(product.getId());
        jobScheduler.runNow(JobKey.comparison(product.getId()));
        log.info("Started tracking product {} on {}: {}", product.getId(), product.getPlatform(), product.getName());
        return product;
    }

    @Transactional(readOnly = true)
    public TrackedProduct getProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> ProductNotFoundException.of(productId));
    }

    @Transactional(readOnly = true)
    public Page<TrackedProduct> listProducts(Pageable pageable) {
        return productRepository.findAll(pageable);
    }

    public Page<PricePoint> getHistory(Long productId, Pageable pageable) {
        return priceHistoryService.history(productId, pageable);
    }

    public List<ComparisonResult> getComparison(Long productId) {
        return comparisonService.findComparisons(productId);
    }

    public void deleteProduct(Long productId) {
        if (!productRepository.existsById(productId)) {
            throw ProductNotFoundException.of(productId);
        }
        jobScheduler.removeProduct(productId);
        priceHistoryService.deleteProduct(productId);
        log.info("Stopped tracking product {}", productId);
    }

    /**
     * Queues an immediate price check and comparison. Runs already in flight are not doubled.
     *
     * @return ids of the jobs that were started
     */
    public List<String> triggerRescan(Long productId) {
        if (!productRepository.existsById(productId)) {
            throw ProductNotFoundException.of(productId);
        }
        List<String> started = new ArrayList<>();
        for (JobKey key : List.of(JobKey.price(productId), JobKey.comparison(productId))) {
            if (jobScheduler.runNow(key)) {
                started.add(key.id());
            }
        }
        return started;
    }

    public SchedulerStatus schedulerStatus() {
        return jobScheduler.status();
    }
}
