package kcs.pricepulse.service.notification;

import kcs.pricepulse.entity.PriceAlert;
import kcs.pricepulse.entity.TrackedProduct;

/** Everything needed to tell one user that one alert fired. Prices are minor units. */
public record PriceDropMessage(
        Long alertId,
        String userId,
        String recipient,
        Long productId,
        String productName,
        String productUrl,
        String productImageUrl,
        long previousPrice,
        long currentPrice,
        long targetPrice
) {

    public static PriceDropMessage of(PriceAlert alert, TrackedProduct product, long previousPrice) {
        return new PriceDropMessage(alert.getId(), alert.getUserId(), alert.getUserEmail(),
                product.getId(), product.getName(), product.getUrl(), product.getImageUrl(),
                previousPrice, product.getCurrentPrice(), alert.getTargetPrice());
    }
}
