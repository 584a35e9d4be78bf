package com.dncuong.ws.request_throttle.algorithm.slidingwindowlog;

import com.dncuong.ws.request_throttle.algorithm.AdmissionResult;
import com.dncuong.ws.request_throttle.algorithm.RateLimiter;
import com.dncuong.ws.request_throttle.clock.MonotonicClock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * =====================================================================
 * THUẬT TOÁN: SLIDING WINDOW LOG (Nhật ký cửa sổ trượt)
 * =====================================================================
 *
 * NGUYÊN LÝ HOẠT ĐỘNG:
 * ---------------------
 * 1. Mỗi key (IP, userId, ...) duy trì một log chứa timestamp của từng
 *    request đã được chấp nhận.
 *
 * 2. Khi một request mới đến tại thời điểm now:
 *    a. Xóa mọi timestamp t ở đầu log thỏa (now - t) >= window
 *    b. Đếm số timestamp còn lại (count)
 *    c. count < limit  → CHO PHÉP, thêm now vào cuối log,
 *                        remaining = limit - (count + 1)
 *    d. count >= limit → TỪ CHỐI, remaining = 0, không thêm gì vào log
 *
 * 3. Cửa sổ trượt theo thời gian: tại thời điểm T, cửa sổ là (T - window, T].
 *    Trong BẤT KỲ khoảng dài window nào, một key được chấp nhận tối đa limit lần.
 *
 * SO SÁNH THỜI GIAN:
 * -------------------
 * Giá trị của MonotonicClock (như System.nanoTime()) có gốc tùy ý, có thể âm.
 * Vì vậy luôn so sánh bằng HIỆU (now - t), không bao giờ so sánh trực tiếp
 * t với (now - window): phép trừ đó có thể tràn số khi now gần Long.MIN_VALUE.
 *
 * CHI PHÍ:
 * ---------
 * - Bộ nhớ: tối đa limit timestamp cho mỗi key
 * - Thời gian: O(số entry hết hạn) cho mỗi lần kiểm tra, trung bình O(1)
 *
 * CẤU TRÚC DỮ LIỆU:
 * -------------------
 * - ConcurrentHashMap<String, RequestLog>: key → log
 * - ArrayDeque<Long> trong RequestLog: cũ nhất ở đầu, mới nhất ở cuối.
 *   Thời gian được đọc SAU khi lấy lock, nên log luôn tăng dần.
 *
 * THREAD-SAFETY:
 * ---------------
 * - Mỗi RequestLog là một monitor riêng: dọn dẹp + đếm + thêm mới cho một key
 *   là nguyên tử, các key khác nhau không tranh chấp nhau.
 * - {@link #evictIdleKeys()} đánh dấu log rỗng là "retired" trong lock rồi mới
 *   xóa khỏi map. Thread nào đang giữ log đã retired sẽ tra cứu lại key,
 *   nên một key không bao giờ có hai log cùng lúc.
 *
 * @author dncuong
 */
public class SlidingWindowLogRateLimiter implements RateLimiter {

    /**
     * Số request tối đa được chấp nhận cho mỗi key trong bất kỳ cửa sổ nào.
     * limit = 0 nghĩa là từ chối tất cả.
     */
    private final int limit;

    /**
     * Độ dài cửa sổ trượt.
     */
    private final Duration window;

    private final long windowNanos;

    private final MonotonicClock clock;

    /**
     * Bảng lưu log request cho mỗi key.
     */
    private final ConcurrentHashMap<String, RequestLog> requestLogMap;

    /**
     * Khởi tạo Sliding Window Log Rate Limiter.
     *
     * @param limit  số request tối đa cho mỗi key trong một cửa sổ, {@code >= 0}
     * @param window độ dài cửa sổ trượt, phải dương và biểu diễn được bằng nanosecond
     * @param clock  nguồn thời gian
     * @throws IllegalArgumentException nếu tham số không hợp lệ
     */
    public SlidingWindowLogRateLimiter(int limit, Duration window, MonotonicClock clock) {
        // === Validate tham số đầu vào ===
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        long nanos;
        try {
            nanos = window.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("window too large to express in nanoseconds: " + window, e);
        }

        this.limit = limit;
        this.window = window;
        this.windowNanos = nanos;
        this.clock = clock;
        this.requestLogMap = new ConcurrentHashMap<>();
    }

    /**
     * Kiểm tra và ghi nhận một request từ key.
     *
     * VÍ DỤ MINH HỌA:
     *   limit = 3, window = 1000ms
     *   Log hiện tại: [500, 700, 900]
     *   Request mới tại 1200ms:
     *     - 1200 - 500 = 700 < 1000 → không xóa gì
     *     - count = 3 >= 3 → TỪ CHỐI, retryAfter = 1000 - 700 = 300ms
     *
     *   Request mới tại 1600ms:
     *     - 1600 - 500 = 1100 >= 1000 → xóa 500
     *     - Log còn [700, 900], count = 2 < 3 → CHO PHÉP, remaining = 0
     */
    @Override
    public AdmissionResult tryAdmit(String key) {
        requireKey(key);

        // limit = 0: không bao giờ cho phép, cũng không tạo log cho key
        if (limit == 0) {
            return AdmissionResult.denied(window);
        }

        while (true) {
            // === BƯỚC 1: Lấy hoặc tạo mới log cho key ===
            RequestLog log = requestLogMap.computeIfAbsent(key, k -> new RequestLog());

            synchronized (log) {
                // Log đã bị sweep giữa lúc tra cứu và lúc lấy lock → tra cứu lại
                if (log.retired) {
                    continue;
                }

                // === BƯỚC 2: Lấy thời gian hiện tại (trong lock) ===
                long now = clock.nowNanos();

                // === BƯỚC 3: Dọn dẹp timestamp đã hết hạn ===
                log.prune(now, windowNanos);

                // === BƯỚC 4: Đếm và quyết định ===
                int count = log.timestamps.size();
                if (count < limit) {
                    log.timestamps.addLast(now);
                    return AdmissionResult.allowed(limit - (count + 1));
                }

                // Sau khi dọn dẹp: now - oldest < window, nên retryAfter luôn dương
                long retryAfterNanos = windowNanos - (now - log.timestamps.peekFirst());
                return AdmissionResult.denied(Duration.ofNanos(retryAfterNanos));
            }
        }
    }

    @Override
    public int remainingFor(String key) {
        requireKey(key);

        while (true) {
            RequestLog log = requestLogMap.get(key);
            if (log == null) {
                return limit;
            }

            synchronized (log) {
                if (log.retired) {
                    continue;
                }
                log.prune(clock.nowNanos(), windowNanos);
                // Phép trừ bão hòa: không bao giờ âm
                return Math.max(0, limit - log.timestamps.size());
            }
        }
    }

    @Override
    public int evictIdleKeys() {
        int evicted = 0;
        for (Map.Entry<String, RequestLog> entry : requestLogMap.entrySet()) {
            RequestLog log = entry.getValue();
            synchronized (log) {
                if (log.retired) {
                    continue;
                }
                log.prune(clock.nowNanos(), windowNanos);
                if (log.timestamps.isEmpty()) {
                    log.retired = true;
                    requestLogMap.remove(entry.getKey(), log);
                    evicted++;
                }
            }
        }
        return evicted;
    }

    @Override
    public int trackedKeys() {
        return requestLogMap.size();
    }

    @Override
    public int getLimit() {
        return limit;
    }

    @Override
    public Duration getWindow() {
        return window;
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * Lớp nội bộ lưu log các timestamp request cho một key cụ thể.
     * Được bảo vệ bởi monitor của chính nó.
     */
    static class RequestLog {

        /**
         * Timestamp của các request đã được chấp nhận, cũ nhất ở đầu.
         * Kích thước tối đa = limit.
         */
        final Deque<Long> timestamps = new ArrayDeque<>();

        /** Đã bị sweep khỏi map; sau đó không bao giờ được ghi nữa. */
        boolean retired;

        /**
         * Xóa các timestamp t thỏa (now - t) >= windowNanos.
         * So sánh bằng hiệu để không bị tràn số.
         */
        void prune(long now, long windowNanos) {
            while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
                timestamps.pollFirst();
            }
        }
    }
}
