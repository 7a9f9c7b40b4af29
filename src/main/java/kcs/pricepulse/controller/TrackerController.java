package kcs.pricepulse.controller;

import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import kcs.pricepulse.service.TrackingService;
import kcs.pricepulse.service.scheduler.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class TrackerController {

    private static final int MAX_PAGE_SIZE = 500;

    private final TrackingService trackingService;

    @PostMapping("/products/track")
    public ResponseEntity<ProductResponse> track(@Valid @RequestBody TrackProductRequest request) {
        var product = trackingService.track(request.url());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @GetMapping("/products")
    public List<ProductResponse> listProducts(@RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "100") int size) {
        var pageable = PageRequest.of(Math.max(page, 0), clamp(size), Sort.by(Sort.Direction.DESC, "id"));
        return trackingService.listProducts(pageable).map(ProductResponse::from).getContent();
    }

    @GetMapping("/products/{productId}")
    public ProductResponse getProduct(@PathVariable Long productId) {
        return ProductResponse.from(trackingService.getProduct(productId));
    }

    // newest first
    @GetMapping("/products/{productId}/history")
    public List<PricePointResponse> getHistory(@PathVariable Long productId,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "100") int size) {
        var pageable = PageRequest.of(Math.max(page, 0), clamp(size));
        return trackingService.getHistory(productId, pageable).map(PricePointResponse::from).getContent();
    }

    @GetMapping("/products/{productId}/comparison")
    public List<ComparisonResponse> getComparison(@PathVariable Long productId) {
        return trackingService.getComparison(productId).stream().map(ComparisonResponse::from).toList();
    }

    @DeleteMapping("/products/{productId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteProduct(@PathVariable Long productId) {
        trackingService.deleteProduct(productId);
    }

    @PostMapping("/scheduler/trigger/{productId}")
    public ResponseEntity<Map<String, Object>> triggerRescan(@PathVariable Long productId) {
        List<String> started = trackingService.triggerRescan(productId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("productId", productId, "started", started));
    }

    @GetMapping("/health/scheduler")
    public SchedulerStatus schedulerStatus() {
        return trackingService.schedulerStatus();
    }

    private static int clamp(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }
}
