package kcs.pricepulse.controller;

import kcs.pricepulse.exception.AlertNotFoundException;
import kcs.pricepulse.exception.DuplicateAlertException;
import kcs.pricepulse.exception.DuplicateProductException;
import kcs.pricepulse.exception.MissingFieldException;
import kcs.pricepulse.exception.PriceParseException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.exception.ScrapeException;
import kcs.pricepulse.exception.UnsupportedPlatformException;
import kcs.pricepulse.exception.UpstreamBlockedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ProductNotFoundException.class)
    public ProblemDetail handleProductNotFound(ProductNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Product Not Found", ex.getMessage(), ErrorCodes.PRODUCT_NOT_FOUND);
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public ProblemDetail handleAlertNotFound(AlertNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Alert Not Found", ex.getMessage(), ErrorCodes.ALERT_NOT_FOUND);
    }

    @ExceptionHandler(DuplicateProductException.class)
    public ProblemDetail handleDuplicateProduct(DuplicateProductException ex) {
        return problem(HttpStatus.CONFLICT, "Already Tracked", ex.getMessage(), ErrorCodes.PRODUCT_ALREADY_TRACKED);
    }

    @ExceptionHandler(DuplicateAlertException.class)
    public ProblemDetail handleDuplicateAlert(DuplicateAlertException ex) {
        return problem(HttpStatus.CONFLICT, "Alert Exists", ex.getMessage(), ErrorCodes.ALERT_ALREADY_EXISTS);
    }

    @ExceptionHandler(UnsupportedPlatformException.class)
    public ProblemDetail handleUnsupportedPlatform(UnsupportedPlatformException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Unsupported Platform", ex.getMessage(), ErrorCodes.UNSUPPORTED_PLATFORM);
    }

    @ExceptionHandler({MissingFieldException.class, PriceParseException.class})
    public ProblemDetail handleExtractionFailure(ScrapeException ex) {
        log.warn("Extraction failed: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Extraction Failed", ex.getMessage(), ErrorCodes.EXTRACTION_FAILED);
    }

    @ExceptionHandler(UpstreamBlockedException.class)
    public ProblemDetail handleUpstreamBlocked(UpstreamBlockedException ex) {
        log.warn("Upstream blocked: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Upstream Unavailable", ex.getMessage(), ErrorCodes.UPSTREAM_BLOCKED);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        var problem = problem(HttpStatus.BAD_REQUEST, "Bad Request", "Validation failed", ErrorCodes.VALIDATION_ERROR);
        var errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body", ErrorCodes.VALIDATION_ERROR);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), ErrorCodes.VALIDATION_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Internal server error",
                ErrorCodes.INTERNAL_ERROR);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, String code) {
        var problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("code", code);
        return problem;
    }
}
