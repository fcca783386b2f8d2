package com.logicsynth.api;

import com.logicsynth.eval.QueryTimeoutException;
import com.logicsynth.facts.FactLimitExceededException;
import com.logicsynth.facts.FactTypeMismatchException;
import com.logicsynth.query.QuerySyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error body for runtime failures:
 * {
 *   "error_code": "FACT_TYPE_MISMATCH",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 *
 * Compile failures are not errors here; they come back as a failed CompileResult.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FactTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleFactTypeMismatch(FactTypeMismatchException ex) {
        return errorResponse("FACT_TYPE_MISMATCH", ex.getMessage());
    }

    @ExceptionHandler(FactLimitExceededException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleFactLimit(FactLimitExceededException ex) {
        log.warn("Fact limit: {}", ex.getMessage());
        return errorResponse("FACT_LIMIT_EXCEEDED", ex.getMessage());
    }

    @ExceptionHandler(QuerySyntaxException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleQuerySyntax(QuerySyntaxException ex) {
        log.warn("Invalid query: {}", ex.getMessage());
        return errorResponse("INVALID_QUERY", ex.getMessage());
    }

    @ExceptionHandler(QueryTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleQueryTimeout(QueryTimeoutException ex) {
        log.warn("Query timed out: {}", ex.getMessage());
        return errorResponse("QUERY_TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
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
