package kcs.pricepulse.exception;

/**
 * Base type for failures that abort a single scrape attempt.
 * Interactive callers receive it as is, scheduled jobs log it and wait for the next cycle.
 */
public abstract class ScrapeException extends RuntimeException {

    protected ScrapeException(String message) {
        super(message);
    }

    protected ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
