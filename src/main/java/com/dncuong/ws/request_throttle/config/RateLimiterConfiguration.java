package com.dncuong.ws.request_throttle.config;

import com.dncuong.ws.request_throttle.clock.MonotonicClock;
import com.dncuong.ws.request_throttle.clock.SystemMonotonicClock;
import com.dncuong.ws.request_throttle.limiter.RequestRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiterConfiguration.class);

    @Bean
    public MonotonicClock monotonicClock() {
        return SystemMonotonicClock.instance();
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(RateLimitProperties properties, MonotonicClock clock) {
        RequestRateLimiter rateLimiter = new RequestRateLimiter(
            properties.getIpLimit(),
            properties.getUserLimit(),
            properties.getWindow(),
            clock
        );
        logger.info(
            "rate_limit_config ip_limit={} user_limit={} window={} sweep_interval={} ip_paths={} user_paths={}",
            properties.getIpLimit(),
            properties.getUserLimit(),
            properties.getWindow(),
            properties.getSweepInterval(),
            properties.getIpPaths(),
            properties.getUserPaths()
        );
        return rateLimiter;
    }
}
