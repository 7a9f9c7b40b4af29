package kcs.pricepulse.exception;

public class ProductNotFoundException extends RuntimeException {

    private ProductNotFoundException(String message) {
        super(message);
    }

    public static ProductNotFoundException of(Long productId) {
        return new ProductNotFoundException("Product not found: " + productId);
    }
}
