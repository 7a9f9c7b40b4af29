package kcs.pricepulse.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import kcs.pricepulse.entity.ComparisonResult;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.ComparisonResultRepository;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.crawler.MatchedListing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ComparisonService {

    private final TrackedProductRepository productRepository;
    private final ComparisonResultRepository comparisonRepository;
    private final Clock clock;

    /** Swaps the product's whole comparison set for {@code matches}; readers see old or new, never a mix. */
    @Transactional
    public List<ComparisonResult> replaceComparisons(Long productId, List<MatchedListing> matches) {
        TrackedProduct product = productRepository.findById(productId)
                .orElseThrow(() -> ProductNotFoundException.of(productId));
        LocalDateTime now = LocalDateTime.now(clock);
        int removed = comparisonRepository.deleteByProductId(productId);
        List<ComparisonResult> saved = comparisonRepository.saveAll(
                matches.stream().map(m -> ComparisonResult.of(product, m, now)).toList());
        log.info("replaceComparisons: productId={}, removed={}, inserted={}", productId, removed, saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ComparisonResult> findComparisons(Long productId) {
        if (!productRepository.existsById(productId)) {
            throw ProductNotFoundException.of(productId);
        }
        return comparisonRepository.findByProduct_IdOrderByFoundPriceAsc(productId);
    }
}
