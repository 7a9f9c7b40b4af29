package kcs.pricepulse.exception;

public class AlertNotFoundException extends RuntimeException {

    private AlertNotFoundException(String message) {
        super(message);
    }

    public static AlertNotFoundException of(Long alertId) {
        return new AlertNotFoundException("Alert not found: " + alertId);
    }
}
