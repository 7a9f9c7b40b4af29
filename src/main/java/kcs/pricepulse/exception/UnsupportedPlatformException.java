package kcs.pricepulse.exception;

public class UnsupportedPlatformException extends ScrapeException {

    private UnsupportedPlatformException(String message) {
        super(message);
    }

    public static UnsupportedPlatformException of(String url) {
        return new UnsupportedPlatformException("No supported platform matches URL: " + url);
    }

    public static UnsupportedPlatformException unknownKey(String platform) {
        return new UnsupportedPlatformException("Unknown platform: " + platform);
    }
}
