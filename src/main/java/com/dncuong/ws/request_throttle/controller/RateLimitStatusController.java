package com.dncuong.ws.request_throttle.controller;

import com.dncuong.ws.request_throttle.limiter.RequestRateLimiter;
import com.dncuong.ws.request_throttle.web.ClientKeyResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trả về quota hiện tại của client mà không tiêu thụ quota.
 *
 * Không nằm trong path của interceptor, nên gọi liên tục cũng không tốn quota.
 *
 * @author dncuong
 */
@RestController
@RequestMapping("/api/rate-limit")
public class RateLimitStatusController {

    private final RequestRateLimiter rateLimiter;
    private final ClientKeyResolver keyResolver;

    public RateLimitStatusController(RequestRateLimiter rateLimiter, ClientKeyResolver keyResolver) {
        this.rateLimiter = rateLimiter;
        this.keyResolver = keyResolver;
    }

    /**
     * GET /api/rate-limit/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
        String ip = keyResolver.resolveIp(request);
        String userId = keyResolver.resolveUser(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("windowSeconds", rateLimiter.getWindow().toSeconds());

        Map<String, Object> ipQuota = new LinkedHashMap<>();
        ipQuota.put("key", ip);
        ipQuota.put("limit", rateLimiter.getIpLimit());
        ipQuota.put("remaining", rateLimiter.remainingForIp(ip));
        body.put("ip", ipQuota);

        if (userId != null) {
            Map<String, Object> userQuota = new LinkedHashMap<>();
            userQuota.put("key", userId);
            userQuota.put("limit", rateLimiter.getUserLimit());
            userQuota.put("remaining", rateLimiter.remainingForUser(userId));
            body.put("user", userQuota);
        }
        return ResponseEntity.ok(body);
    }
}
