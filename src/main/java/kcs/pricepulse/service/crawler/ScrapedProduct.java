package kcs.pricepulse.service.crawler;

/**
 * Product page as read from a platform. Prices are minor units; brand and model may be null.
 */
public record ScrapedProduct(
        String platform,
        String name,
        long price,
        String imageUrl,
        String brand,
        String model
) {
}
