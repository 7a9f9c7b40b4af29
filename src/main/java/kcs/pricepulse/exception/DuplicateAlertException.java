package kcs.pricepulse.exception;

public class DuplicateAlertException extends RuntimeException {

    private DuplicateAlertException(String message) {
        super(message);
    }

    public static DuplicateAlertException of(String userId, Long productId, long targetPrice) {
        return new DuplicateAlertException("Alert already exists for user " + userId
                + " on product " + productId + " at " + targetPrice);
    }
}
