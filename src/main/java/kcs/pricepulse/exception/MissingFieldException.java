package kcs.pricepulse.exception;

import lombok.Getter;

@Getter
public class MissingFieldException extends ScrapeException {

    private final String platform;
    private final String field;

    private MissingFieldException(String platform, String field) {
        super("Could not find product " + field + " on " + platform);
        this.platform = platform;
        this.field = field;
    }

    public static MissingFieldException of(String platform, String field) {
        return new MissingFieldException(platform, field);
    }
}
