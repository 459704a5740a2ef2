package com.sunny.cron.worker.lock;

/**
 * 锁服务异常（连接断开、会话过期等）
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class JobLockException extends RuntimeException {

    public JobLockException(String message) {
        super(message);
    }

    public JobLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
