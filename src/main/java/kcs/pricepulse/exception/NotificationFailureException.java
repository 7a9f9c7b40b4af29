package kcs.pricepulse.exception;

public class NotificationFailureException extends RuntimeException {

    private NotificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotificationFailureException of(String recipient, Throwable cause) {
        return new NotificationFailureException("Failed to deliver price drop notice to " + recipient, cause);
    }
}
