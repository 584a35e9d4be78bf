package com.dncuong.ws.request_throttle.web;

import com.dncuong.ws.request_throttle.limiter.KeySpace;

import java.time.Duration;

/**
 * Throw bởi {@link RateLimitInterceptor} khi request bị từ chối,
 * được {@link RateLimitExceptionHandler} chuyển thành HTTP 429.
 *
 * @author dncuong
 */
public class RateLimitExceededException extends RuntimeException {

    private final KeySpace keySpace;
    private final int limit;
    private final Duration retryAfter;

    public RateLimitExceededException(KeySpace keySpace, int limit, Duration retryAfter) {
        super(keySpace == KeySpace.USER
                ? "Rate limit exceeded. Too many requests for this user."
                : "Rate limit exceeded. Too many requests from this IP.");
        this.keySpace = keySpace;
        this.limit = limit;
        this.retryAfter = retryAfter;
    }

    public KeySpace getKeySpace() {
        return keySpace;
    }

    public int getLimit() {
        return limit;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * @return retryAfter làm tròn lên theo giây, tối thiểu 1
     */
    public long getRetryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
