package com.sunny.cron.worker.service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 日志写入监控指标
 * <p>
 * JobLogSink（生产方）与 JobLogWriter（消费方）共享
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class LogSinkMetrics {

    /**
     * 已投递、尚未被写入器取出的日志数
     */
    private final AtomicInteger pending = new AtomicInteger(0);

    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong flushedBatches = new AtomicLong(0);
    private final AtomicLong flushedLogs = new AtomicLong(0);
    private final AtomicLong failedBatches = new AtomicLong(0);
    private final AtomicLong failedLogs = new AtomicLong(0);

    /**
     * 占用一个队列位置
     *
     * @return false 表示队列已满
     */
    boolean tryEnqueue(int capacity) {
        if (pending.incrementAndGet() > capacity) {
            pending.decrementAndGet();
            return false;
        }
        return true;
    }

    public void onDequeued() {
        pending.decrementAndGet();
    }

    long onDropped() {
        return dropped.incrementAndGet();
    }

    public void onFlushed(int count) {
        flushedBatches.incrementAndGet();
        flushedLogs.addAndGet(count);
    }

    public void onFlushFailed(int count) {
        failedBatches.incrementAndGet();
        failedLogs.addAndGet(count);
    }

    public int getPending() {
        return pending.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getFlushedBatches() {
        return flushedBatches.get();
    }

    public long getFlushedLogs() {
        return flushedLogs.get();
    }

    public long getFailedBatches() {
        return failedBatches.get();
    }

    public long getFailedLogs() {
        return failedLogs.get();
    }

    @Override
    public String toString() {
        return "LogSinkMetrics{pending=" + pending.get()
                + ", dropped=" + dropped.get()
                + ", flushedBatches=" + flushedBatches.get()
                + ", flushedLogs=" + flushedLogs.get()
                + ", failedBatches=" + failedBatches.get()
                + ", failedLogs=" + failedLogs.get() + '}';
    }
}
