package com.dncuong.ws.request_throttle.web;

import com.dncuong.ws.request_throttle.algorithm.AdmissionResult;
import com.dncuong.ws.request_throttle.limiter.KeySpace;
import com.dncuong.ws.request_throttle.limiter.RequestRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Kiểm tra mọi request khớp path với {@link RequestRateLimiter} trước khi vào controller.
 *
 * CÁCH HOẠT ĐỘNG:
 * - Được phép: thêm header {@code X-RateLimit-Limit} và {@code X-RateLimit-Remaining}
 * - Bị từ chối: throw {@link RateLimitExceededException}, trả về HTTP 429
 *
 * @author dncuong
 */
public class RateLimitInterceptor implements HandlerInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    /**
     * Request được tính vào quota của định danh nào.
     */
    public enum Policy {
        /** Endpoint public: theo IP client. */
        IP_ONLY,
        /** Endpoint cần đăng nhập: theo userId, không có user thì theo IP. */
        USER_WITH_IP_FALLBACK
    }

    private final RequestRateLimiter rateLimiter;
    private final ClientKeyResolver keyResolver;
    private final Policy policy;

    public RateLimitInterceptor(RequestRateLimiter rateLimiter, ClientKeyResolver keyResolver, Policy policy) {
        this.rateLimiter = rateLimiter;
        this.keyResolver = keyResolver;
        this.policy = policy;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // === BƯỚC 1: Xác định key và bảng ===
        KeySpace keySpace = KeySpace.IP;
        String key = null;
        if (policy == Policy.USER_WITH_IP_FALLBACK) {
            key = keyResolver.resolveUser(request);
            if (key != null) {
                keySpace = KeySpace.USER;
            }
        }
        if (key == null) {
            key = keyResolver.resolveIp(request);
        }

        // === BƯỚC 2: Kiểm tra quota ===
        AdmissionResult result = rateLimiter.check(keySpace, key);
        int limit = rateLimiter.getLimit(keySpace);

        if (!result.isAllowed()) {
            logger.debug(
                "rate_limited key_space={} key={} limit={} path={} retry_after={}",
                keySpace,
                key,
                limit,
                request.getRequestURI(),
                result.getRetryAfter()
            );
            throw new RateLimitExceededException(keySpace, limit, result.getRetryAfter());
        }

        // === BƯỚC 3: Được phép → gắn header quota ===
        response.setHeader(LIMIT_HEADER, String.valueOf(limit));
        response.setHeader(REMAINING_HEADER, String.valueOf(result.getRemaining()));
        return true;
    }
}
