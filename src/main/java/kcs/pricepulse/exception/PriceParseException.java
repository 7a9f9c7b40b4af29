package kcs.pricepulse.exception;

public class PriceParseException extends ScrapeException {

    private PriceParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PriceParseException of(String priceText) {
        return new PriceParseException("Could not extract price from: " + priceText, null);
    }

    public static PriceParseException of(String priceText, Throwable cause) {
        return new PriceParseException("Could not extract price from: " + priceText, cause);
    }
}
