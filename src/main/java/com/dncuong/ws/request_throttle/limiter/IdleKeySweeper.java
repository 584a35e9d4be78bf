package com.dncuong.ws.request_throttle.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Định kỳ xóa các key có cửa sổ rỗng, để client chỉ gọi một lần
 * (scanner, IP thay đổi liên tục) không tích tụ mãi trong bộ nhớ.
 *
 * @author dncuong
 */
@Component
public class IdleKeySweeper {
    private static final Logger logger = LoggerFactory.getLogger(IdleKeySweeper.class);

    private final RequestRateLimiter rateLimiter;

    public IdleKeySweeper(RequestRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(
        initialDelayString = "#{@rateLimitProperties.sweepInterval.toMillis()}",
        fixedDelayString = "#{@rateLimitProperties.sweepInterval.toMillis()}"
    )
    public int sweep() {
        int evicted = rateLimiter.evictIdleKeys();
        if (evicted > 0) {
            logger.debug(
                "rate_limit_sweep evicted={} ip_keys={} user_keys={}",
                evicted,
                rateLimiter.trackedKeys(KeySpace.IP),
                rateLimiter.trackedKeys(KeySpace.USER)
            );
        }
        return evicted;
    }
}
