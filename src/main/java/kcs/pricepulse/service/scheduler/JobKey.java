package kcs.pricepulse.service.scheduler;

/**
 * Deterministic job identity. Product jobs are keyed by kind and product id
 * ({@code scrape_price_42}); global jobs carry no product id.
 */
public record JobKey(JobKind kind, Long productId) {

    public static JobKey price(Long productId) {
        return new JobKey(JobKind.PRICE, productId);
    }

    public static JobKey comparison(Long productId) {
        return new JobKey(JobKind.COMPARISON, productId);
    }

    public static JobKey global(JobKind kind) {
        return new JobKey(kind, null);
    }

    public String id() {
        return productId == null ? kind.getPrefix() : kind.getPrefix() + "_" + productId;
    }
}
