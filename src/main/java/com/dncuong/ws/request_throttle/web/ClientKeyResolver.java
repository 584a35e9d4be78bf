package com.dncuong.ws.request_throttle.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Lấy key rate limit từ request.
 *
 * Key IP là địa chỉ peer mà servlet container thấy. Không đọc header proxy ở đây:
 * nếu chạy sau proxy, cấu hình {@code server.forward-headers-strategy} để
 * {@code remoteAddr} đã là IP thật của client.
 *
 * @author dncuong
 */
@Component
public class ClientKeyResolver {

    public String resolveIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "";
    }

    /**
     * @return tên user đã đăng nhập, hoặc {@code null} nếu request ẩn danh
     */
    public String resolveUser(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal == null) {
            return null;
        }
        String name = principal.getName();
        return name == null || name.isBlank() ? null : name;
    }
}
