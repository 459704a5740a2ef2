package com.sunny.cron.worker.pekko.actor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * 可手动推进的测试时钟
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile long millis;

    public MutableClock(long millis, ZoneId zone) {
        this.millis = millis;
        this.zone = zone;
    }

    public void set(long millis) {
        this.millis = millis;
    }

    public void advance(long deltaMillis) {
        this.millis += deltaMillis;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(millis, zone);
    }

    @Override
    public long millis() {
        return millis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }
}
