package com.dncuong.ws.request_throttle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RequestThrottleApplication {
    public static void main(String[] args) {
        SpringApplication.run(RequestThrottleApplication.class, args);
    }
}
