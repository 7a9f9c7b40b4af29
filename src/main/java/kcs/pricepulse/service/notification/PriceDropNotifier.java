package kcs.pricepulse.service.notification;

public interface PriceDropNotifier {

    /**
     * @throws kcs.pricepulse.exception.NotificationFailureException if delivery failed
     */
    void send(PriceDropMessage message);
}
