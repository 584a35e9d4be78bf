package com.dncuong.ws.request_throttle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cấu hình {@code rate-limit.*} trong application.yml.
 *
 * @author dncuong
 */
@Component
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {
    /** Số request tối đa trong một cửa sổ cho mỗi IP. */
    private int ipLimit = 100;
    /** Số request tối đa trong một cửa sổ cho mỗi user. */
    private int userLimit = 200;
    private Duration window = Duration.ofSeconds(60);
    /** Chu kỳ dọn dẹp key có cửa sổ rỗng. */
    private Duration sweepInterval = Duration.ofMinutes(5);
    /** Path giới hạn theo IP. */
    private List<String> ipPaths = new ArrayList<>(List.of("/api/public/**"));
    /** Path giới hạn theo user, request ẩn danh thì theo IP. */
    private List<String> userPaths = new ArrayList<>(List.of("/api/account/**"));

    public int getIpLimit() {
        return ipLimit;
    }

    public void setIpLimit(int ipLimit) {
        this.ipLimit = ipLimit;
    }

    public int getUserLimit() {
        return userLimit;
    }

    public void setUserLimit(int userLimit) {
        this.userLimit = userLimit;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public List<String> getIpPaths() {
        return ipPaths;
    }

    public void setIpPaths(List<String> ipPaths) {
        this.ipPaths = ipPaths;
    }

    public List<String> getUserPaths() {
        return userPaths;
    }

    public void setUserPaths(List<String> userPaths) {
        this.userPaths = userPaths;
    }
}
