package kcs.pricepulse.exception;

/**
 * Navigation or element wait did not complete: the page timed out, the site blocked us,
 * or the browser itself failed.
 */
public class UpstreamBlockedException extends ScrapeException {

    private UpstreamBlockedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UpstreamBlockedException timeout(String url, String waitingFor, Throwable cause) {
        return new UpstreamBlockedException("Timed out waiting for '" + waitingFor + "' on " + url, cause);
    }

    public static UpstreamBlockedException navigationFailed(String url, Throwable cause) {
        return new UpstreamBlockedException("Navigation failed for " + url + ": " + cause.getMessage(), cause);
    }

    public static UpstreamBlockedException noBrowserAvailable(long waitedSeconds) {
        return new UpstreamBlockedException("No browser available after " + waitedSeconds + "s", null);
    }
}
