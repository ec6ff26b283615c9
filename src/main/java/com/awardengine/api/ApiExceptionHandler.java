package com.awardengine.api;

import com.awardengine.contract.MetricKindMismatchException;
import com.awardengine.engine.UnknownAchievementException;
import com.awardengine.rules.CatalogConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps award engine failures to {@code {error_code, message, timestamp}} bodies.
 *
 * <ul>
 *   <li>METRIC_KIND_MISMATCH (400): count, timer or label operation on a metric of another kind</li>
 *   <li>INVALID_ARGUMENT (400): unknown metric name, missing or non-integer field,
 *       or a write that would leave a key figure negative</li>
 *   <li>BAD_REQUEST (400): body or path that cannot be parsed</li>
 *   <li>UNKNOWN_ACHIEVEMENT (404): evaluation requested for a key the catalog does not hold</li>
 *   <li>CATALOG_MISCONFIGURED (500): award catalog failed validation</li>
 *   <li>INTERNAL_ERROR (500): anything else, including a failing achievement sink</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MetricKindMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleKindMismatch(MetricKindMismatchException ex) {
        log.warn("Metric kind mismatch: {}", ex.getMessage());
        return errorResponse("METRIC_KIND_MISMATCH", ex.getMessage());
    }

    @ExceptionHandler(UnknownAchievementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownAchievement(UnknownAchievementException ex) {
        log.warn("Unknown achievement: {}", ex.getMessage());
        return errorResponse("UNKNOWN_ACHIEVEMENT", ex.getMessage());
    }

    @ExceptionHandler(CatalogConfigurationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleCatalogConfiguration(CatalogConfigurationException ex) {
        log.error("Award catalog misconfigured", ex);
        return errorResponse("CATALOG_MISCONFIGURED", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
