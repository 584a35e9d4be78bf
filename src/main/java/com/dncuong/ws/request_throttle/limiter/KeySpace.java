package com.dncuong.ws.request_throttle.limiter;

/**
 * Các không gian key độc lập của {@link RequestRateLimiter}.
 * Cùng một chuỗi ở hai không gian khác nhau không bao giờ dùng chung bộ đếm.
 */
public enum KeySpace {

    /** Địa chỉ IP client, cho request public hoặc chưa đăng nhập. */
    IP,

    /** Định danh user đã đăng nhập. */
    USER
}
