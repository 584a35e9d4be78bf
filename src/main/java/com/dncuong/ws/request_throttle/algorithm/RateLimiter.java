package com.dncuong.ws.request_throttle.algorithm;

import java.time.Duration;

/**
 * Interface chung cho một bảng rate limit theo key.
 *
 * Mỗi bảng theo dõi một không gian key (IP, userId, API key, ...) với một limit
 * và một window. Key là chuỗi bất kỳ, chuỗi rỗng cũng là key hợp lệ.
 * Các implementation phải an toàn khi nhiều thread gọi đồng thời.
 *
 * @author dncuong
 */
public interface RateLimiter {

    /**
     * Kiểm tra request từ key có được phép không, nếu có thì ghi nhận vào quota.
     *
     * Kiểm tra và ghi nhận là một bước nguyên tử cho mỗi key:
     * hai request đồng thời không bao giờ cùng lấy được slot cuối cùng.
     *
     * @param key định danh client (IP, userId, ...), không được null
     * @return quyết định kèm quota còn lại sau lần gọi này
     */
    AdmissionResult tryAdmit(String key);

    /**
     * Số request key còn được phép ngay lúc này, không tiêu thụ quota.
     *
     * @param key định danh client, không được null
     * @return quota còn lại trong khoảng {@code [0, limit]}
     */
    int remainingFor(String key);

    /**
     * Xóa các key không còn request nào trong cửa sổ.
     *
     * @return số key đã xóa
     */
    int evictIdleKeys();

    /**
     * @return số key đang giữ trong bộ nhớ
     */
    int trackedKeys();

    int getLimit();

    Duration getWindow();
}
