package kcs.pricepulse.exception;

public class DuplicateProductException extends RuntimeException {

    private DuplicateProductException(String message) {
        super(message);
    }

    public static DuplicateProductException of(String url) {
        return new DuplicateProductException("Product already being tracked: " + url);
    }
}
