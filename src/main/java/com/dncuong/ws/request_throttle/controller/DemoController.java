package com.dncuong.ws.request_throttle.controller;

import com.dncuong.ws.request_throttle.web.ClientKeyResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller demo để test rate limit thủ công bằng curl hoặc Postman.
 *
 * CÁCH TEST (cấu hình mặc định):
 * - /api/public/**  giới hạn theo IP (100 request / 60 giây)
 * - /api/account/** giới hạn theo user (200 request / 60 giây),
 *   request ẩn danh dùng giới hạn theo IP
 * - Vượt giới hạn → interceptor trả HTTP 429 trước khi vào các method này
 *
 * @author dncuong
 */
@RestController
@RequestMapping("/api")
public class DemoController {

    private final ClientKeyResolver keyResolver;

    public DemoController(ClientKeyResolver keyResolver) {
        this.keyResolver = keyResolver;
    }

    /**
     * GET /api/public/hello
     */
    @GetMapping("/public/hello")
    public ResponseEntity<Map<String, Object>> publicHello(HttpServletRequest request) {
        return ResponseEntity.ok(Map.of(
                "status", "SUCCESS",
                "message", "Request accepted!",
                "clientIp", keyResolver.resolveIp(request)
        ));
    }

    /**
     * GET /api/account/hello
     */
    @GetMapping("/account/hello")
    public ResponseEntity<Map<String, Object>> accountHello(HttpServletRequest request) {
        // Map.of không nhận giá trị null, userId = null khi request ẩn danh
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "SUCCESS");
        body.put("message", "Request accepted!");
        body.put("clientIp", keyResolver.resolveIp(request));
        body.put("userId", keyResolver.resolveUser(request));
        return ResponseEntity.ok(body);
    }
}
