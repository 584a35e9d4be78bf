package com.dncuong.ws.request_throttle.config;

import com.dncuong.ws.request_throttle.limiter.RequestRateLimiter;
import com.dncuong.ws.request_throttle.web.ClientKeyResolver;
import com.dncuong.ws.request_throttle.web.RateLimitInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RequestRateLimiter rateLimiter;
    private final ClientKeyResolver keyResolver;
    private final RateLimitProperties properties;

    public WebMvcConfig(RequestRateLimiter rateLimiter, ClientKeyResolver keyResolver, RateLimitProperties properties) {
        this.rateLimiter = rateLimiter;
        this.keyResolver = keyResolver;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!properties.getIpPaths().isEmpty()) {
            registry.addInterceptor(
                    new RateLimitInterceptor(rateLimiter, keyResolver, RateLimitInterceptor.Policy.IP_ONLY))
                .addPathPatterns(properties.getIpPaths());
        }
        if (!properties.getUserPaths().isEmpty()) {
            registry.addInterceptor(
                    new RateLimitInterceptor(rateLimiter, keyResolver, RateLimitInterceptor.Policy.USER_WITH_IP_FALLBACK))
                .addPathPatterns(properties.getUserPaths());
        }
    }
}
