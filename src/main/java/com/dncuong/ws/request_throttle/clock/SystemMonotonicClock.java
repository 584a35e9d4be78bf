package com.dncuong.ws.request_throttle.clock;

/**
 * {@link MonotonicClock} dùng {@link System#nanoTime()}.
 */
public final class SystemMonotonicClock implements MonotonicClock {

    private static final SystemMonotonicClock INSTANCE = new SystemMonotonicClock();

    private SystemMonotonicClock() {
    }

    public static SystemMonotonicClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
