package com.watchwise.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps failures to a stable {code, message, requestId} body:
 * - ApiException: status and message come from its ApiErrorCode
 * - 400: bean validation / unreadable body / bad path or header values
 * - 503: store failures (the client may retry)
 * - 500: anything else
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex, HttpServletRequest req) {
        ApiErrorCode code = ex.code();
        if (code == ApiErrorCode.TRANSIENT_STORE_FAILURE) {
            log.warn("store failure. rid={} {} {}", rid(req), req.getMethod(), req.getRequestURI(), ex);
        }
        return ResponseEntity.status(code.status())
                .body(new ApiErrorResponse(code.name(), safeMsg(ex, code.userMessage()), rid(req)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("VALIDATION_FAILED", msg, rid(req)));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("BAD_REQUEST", "Malformed request", rid(req)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String msg = (ex.getReason() == null) ? status.getReasonPhrase() : ex.getReason();
        return ResponseEntity.status(status).body(new ApiErrorResponse(status.name(), msg, rid(req)));
    }

    // Optimistic-lock conflicts are DataAccessExceptions too
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleStore(DataAccessException ex, HttpServletRequest req) {
        log.warn("store failure. rid={} {} {}", rid(req), req.getMethod(), req.getRequestURI(), ex);
        ApiErrorCode code = ApiErrorCode.TRANSIENT_STORE_FAILURE;
        return ResponseEntity.status(code.status())
                .body(new ApiErrorResponse(code.name(), code.userMessage(), rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled. rid={} {} {}", rid(req), req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", "Unexpected error", rid(req)));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String safeMsg(Throwable t, String fallback) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? fallback : m;
    }
}
