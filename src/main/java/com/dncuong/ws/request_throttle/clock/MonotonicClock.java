package com.dncuong.ws.request_throttle.clock;

/**
 * Nguồn thời gian đơn điệu cho các rate limiter.
 *
 * Giống {@link System#nanoTime()}: giá trị chỉ có nghĩa khi so với nhau (lấy hiệu),
 * gốc tùy ý và có thể âm. Không bao giờ lùi lại.
 *
 * @author dncuong
 */
public interface MonotonicClock {

    /**
     * @return thời điểm hiện tại, đơn vị nanosecond
     */
    long nowNanos();
}
