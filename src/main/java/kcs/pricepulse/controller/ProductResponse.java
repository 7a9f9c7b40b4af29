package kcs.pricepulse.controller;

import java.time.LocalDateTime;
import kcs.pricepulse.entity.TrackedProduct;

/** Prices are in minor units (paise, cents). */
public record ProductResponse(
        Long id,
        String platform,
        String url,
        String name,
        String imageUrl,
        String brand,
        String model,
        long currentPrice,
        LocalDateTime lastCheckedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    static ProductResponse from(TrackedProduct product) {
        return new ProductResponse(product.getId(), product.getPlatform(), product.getUrl(), product.getName(),
                product.getImageUrl(), product.getBrand(), product.getModel(), product.getCurrentPrice(),
                product.getLastCheckedAt(), product.getCreatedDate(), product.getModifiedDate());
    }
}
