package com.dncuong.ws.request_throttle.algorithm;

import java.time.Duration;

/**
 * Kết quả của {@link RateLimiter#tryAdmit(String)}.
 *
 * Bị từ chối là kết quả bình thường của chính sách, không phải lỗi.
 * - Từ chối: remaining luôn = 0
 * - Cho phép: retryAfter luôn = {@link Duration#ZERO}
 *
 * @author dncuong
 */
public final class AdmissionResult {

    private final boolean allowed;
    private final int remaining;
    private final Duration retryAfter;

    private AdmissionResult(boolean allowed, int remaining, Duration retryAfter) {
        this.allowed = allowed;
        this.remaining = remaining;
        this.retryAfter = retryAfter;
    }

    public static AdmissionResult allowed(int remaining) {
        return new AdmissionResult(true, Math.max(0, remaining), Duration.ZERO);
    }

    public static AdmissionResult denied(Duration retryAfter) {
        return new AdmissionResult(false, 0, retryAfter);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getRemaining() {
        return remaining;
    }

    /**
     * @return thời gian đến khi request cũ nhất rời cửa sổ và giải phóng một slot
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String toString() {
        return "AdmissionResult{allowed=" + allowed
                + ", remaining=" + remaining
                + ", retryAfter=" + retryAfter + '}';
    }
}
