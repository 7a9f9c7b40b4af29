package kcs.pricepulse.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import kcs.pricepulse.config.PlatformSelectors;
import kcs.pricepulse.config.ScraperProperties;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.CrossPlatformSearcher;
import kcs.pricepulse.service.crawler.FuzzyMatcher;
import kcs.pricepulse.service.crawler.ListingCandidate;
import kcs.pricepulse.service.crawler.MatchedListing;
import kcs.pricepulse.service.crawler.QueryBuilder;
import kcs.pricepulse.service.crawler.SelectorTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the product on every competing platform and replaces its comparison set.
 * Nothing is written until all searches are done, so a failure leaves the previous set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComparisonReconciler {

    private final TrackedProductRepository productRepository;
    private final SelectorTable selectorTable;
    private final QueryBuilder queryBuilder;
    private final CrossPlatformSearcher searcher;
    private final FuzzyMatcher matcher;
    private final ComparisonService comparisonService;
    private final ScraperProperties properties;

    public void updateComparison(Long productId) {
        Optional<TrackedProduct> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            log.warn("Product {} not found, skipping comparison", productId);
            return;
        }
        TrackedProduct product = found.get();

        String query = queryBuilder.build(product.getName(), product.getBrand());
        List<PlatformSelectors> competitors = selectorTable.competitorsOf(product.getPlatform());
        Map<String, List<ListingCandidate>> results = searcher.searchAll(query, competitors);

        List<MatchedListing> matches = new ArrayList<>();
        results.forEach((platform, candidates) -> matcher
                .bestMatch(query, candidates, properties.getMatchThreshold())
                .ifPresent(matches::add));

        try {
            comparisonService.replaceComparisons(productId, matches);
        } catch (ProductNotFoundException e) {
            log.warn("Product {} was deleted during its comparison", productId);
            return;
        }
        log.info("Updated comparison for product {} ('{}'): {} match(es) on {} platform(s)",
                productId, query, matches.size(), competitors.size());
    }
}
