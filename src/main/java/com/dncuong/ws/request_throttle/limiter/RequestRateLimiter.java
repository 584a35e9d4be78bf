package com.dncuong.ws.request_throttle.limiter;

import com.dncuong.ws.request_throttle.algorithm.AdmissionResult;
import com.dncuong.ws.request_throttle.algorithm.RateLimiter;
import com.dncuong.ws.request_throttle.algorithm.slidingwindowlog.SlidingWindowLogRateLimiter;
import com.dncuong.ws.request_throttle.clock.MonotonicClock;
import com.dncuong.ws.request_throttle.clock.SystemMonotonicClock;

import java.time.Duration;

/**
 * =====================================================================
 * RATE LIMITER THEO IP VÀ THEO USER
 * =====================================================================
 *
 * Giữ hai bảng Sliding Window Log độc lập, mỗi {@link KeySpace} một bảng:
 * - Bảng IP: limit riêng, dùng cho endpoint public
 * - Bảng USER: limit riêng, dùng cho endpoint cần đăng nhập
 * Hai bảng dùng chung độ dài cửa sổ.
 *
 * Chọn bảng nào là chính sách của nơi gọi: endpoint public gọi {@link #checkIp(String)},
 * endpoint cần đăng nhập gọi {@link #checkUser(String)} và quay về bảng IP khi
 * request không có user.
 *
 * Được tạo một lần khi khởi động rồi inject vào nơi cần dùng.
 *
 * @author dncuong
 */
public class RequestRateLimiter {

    private final RateLimiter ipTable;
    private final RateLimiter userTable;
    private final Duration window;

    public RequestRateLimiter(int ipLimit, int userLimit, Duration window) {
        this(ipLimit, userLimit, window, SystemMonotonicClock.instance());
    }

    public RequestRateLimiter(int ipLimit, int userLimit, Duration window, MonotonicClock clock) {
        this.ipTable = new SlidingWindowLogRateLimiter(ipLimit, window, clock);
        this.userTable = new SlidingWindowLogRateLimiter(userLimit, window, clock);
        this.window = window;
    }

    public AdmissionResult checkIp(String ip) {
        return ipTable.tryAdmit(ip);
    }

    public AdmissionResult checkUser(String userId) {
        return userTable.tryAdmit(userId);
    }

    public int remainingForIp(String ip) {
        return ipTable.remainingFor(ip);
    }

    public int remainingForUser(String userId) {
        return userTable.remainingFor(userId);
    }

    public AdmissionResult check(KeySpace keySpace, String key) {
        return table(keySpace).tryAdmit(key);
    }

    public int remainingFor(KeySpace keySpace, String key) {
        return table(keySpace).remainingFor(key);
    }

    /**
     * Dọn dẹp key không hoạt động ở cả hai bảng.
     *
     * @return tổng số key đã xóa
     */
    public int evictIdleKeys() {
        return ipTable.evictIdleKeys() + userTable.evictIdleKeys();
    }

    public int trackedKeys(KeySpace keySpace) {
        return table(keySpace).trackedKeys();
    }

    public int getLimit(KeySpace keySpace) {
        return table(keySpace).getLimit();
    }

    public int getIpLimit() {
        return ipTable.getLimit();
    }

    public int getUserLimit() {
        return userTable.getLimit();
    }

    public Duration getWindow() {
        return window;
    }

    private RateLimiter table(KeySpace keySpace) {
        if (keySpace == null) {
            throw new IllegalArgumentException("keySpace cannot be null");
        }
        return keySpace == KeySpace.IP ? ipTable : userTable;
    }
}
