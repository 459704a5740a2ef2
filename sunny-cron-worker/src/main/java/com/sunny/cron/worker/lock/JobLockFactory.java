package com.sunny.cron.worker.lock;

/**
 * 任务锁工厂
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public interface JobLockFactory {

    /**
     * 为任务创建锁（每次执行一个新实例）
     */
    JobLock createLock(String jobName);
}
