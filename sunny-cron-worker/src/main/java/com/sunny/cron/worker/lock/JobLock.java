package com.sunny.cron.worker.lock;

/**
 * 任务分布式锁
 * <p>
 * 同一任务名在集群内同一时刻只允许一个 Worker 持有
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public interface JobLock {

    /**
     * 尝试加锁，不等待
     *
     * @return true 加锁成功；false 锁被其他 Worker 持有
     * @throws JobLockException 锁服务异常
     */
    boolean tryLock();

    /**
     * 释放锁，未持有时无操作
     */
    void unlock();
}
