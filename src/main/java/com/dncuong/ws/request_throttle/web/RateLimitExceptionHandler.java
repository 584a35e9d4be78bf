package com.dncuong.ws.request_throttle.web;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Chuyển {@link RateLimitExceededException} thành HTTP 429 Too Many Requests
 * kèm header Retry-After và X-RateLimit-*.
 *
 * @author dncuong
 */
@RestControllerAdvice
public class RateLimitExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(RateLimitExceededException e) {
        long retryAfterSeconds = e.getRetryAfterSeconds();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(RateLimitInterceptor.LIMIT_HEADER, String.valueOf(e.getLimit()))
                .header(RateLimitInterceptor.REMAINING_HEADER, "0")
                .header(RateLimitInterceptor.RESET_HEADER, String.valueOf(retryAfterSeconds))
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(Map.of(
                        "status", "RATE_LIMITED",
                        "message", e.getMessage(),
                        "keySpace", e.getKeySpace().name(),
                        "limit", e.getLimit(),
                        "retryAfterSeconds", retryAfterSeconds
                ));
    }
}
