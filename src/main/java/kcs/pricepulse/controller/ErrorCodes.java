package kcs.pricepulse.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String PRODUCT_NOT_FOUND = "PRODUCT_NOT_FOUND";
    public static final String ALERT_NOT_FOUND = "ALERT_NOT_FOUND";
    public static final String PRODUCT_ALREADY_TRACKED = "PRODUCT_ALREADY_TRACKED";
    public static final String ALERT_ALREADY_EXISTS = "ALERT_ALREADY_EXISTS";
    public static final String UNSUPPORTED_PLATFORM = "UNSUPPORTED_PLATFORM";
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";
    public static final String UPSTREAM_BLOCKED = "UPSTREAM_BLOCKED";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
