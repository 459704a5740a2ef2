package com.sunny.cron.core.common;

/**
 * 常量定义
 * <p>
 * 协调存储（ZooKeeper）中的目录约定：
 * <pre>
 * /cron/jobs/{jobName}     任务定义（JSON）
 * /cron/killer/{jobName}   强杀标记
 * /cron/workers/{ip}       在线 Worker（临时节点）
 * /cron/lock/{jobName}     任务执行锁
 * </pre>
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public final class Constants {

    private Constants() {
    }

    // ==================== 协调存储目录 ====================

    /**
     * 任务保存目录
     */
    public static final String JOB_SAVE_DIR = "/cron/jobs";

    /**
     * 任务强杀目录
     */
    public static final String JOB_KILLER_DIR = "/cron/killer";

    /**
     * 服务注册目录
     */
    public static final String JOB_WORKER_DIR = "/cron/workers";

    /**
     * 任务锁目录
     */
    public static final String JOB_LOCK_DIR = "/cron/lock";

    // ==================== 调度常量 ====================

    /**
     * 计划表为空时的唤醒间隔 (毫秒)
     */
    public static final long IDLE_WAKE_INTERVAL_MS = 1000L;

    // ==================== 日志批量写入 ====================

    /**
     * 默认批次大小
     */
    public static final int DEFAULT_LOG_BATCH_SIZE = 100;

    /**
     * 默认批次超时自动提交时间 (毫秒)
     */
    public static final long DEFAULT_LOG_COMMIT_TIMEOUT_MS = 1000L;

    /**
     * 默认日志队列容量
     */
    public static final int DEFAULT_LOG_QUEUE_CAPACITY = 1000;

    /**
     * 任务定义路径
     */
    public static String jobPath(String jobName) {
        return JOB_SAVE_DIR + "/" + jobName;
    }

    /**
     * 强杀标记路径
     */
    public static String killerPath(String jobName) {
        return JOB_KILLER_DIR + "/" + jobName;
    }

    /**
     * 任务锁路径
     */
    public static String lockPath(String jobName) {
        return JOB_LOCK_DIR + "/" + jobName;
    }

    /**
     * Worker 注册路径
     */
    public static String workerPath(String workerIp) {
        return JOB_WORKER_DIR + "/" + workerIp;
    }

    /**
     * 从 /cron/jobs/job10 中提取 job10
     */
    public static String extractJobName(String jobKey) {
        return trimPrefix(jobKey, JOB_SAVE_DIR + "/");
    }

    /**
     * 从 /cron/killer/job10 中提取 job10
     */
    public static String extractKillerName(String killerKey) {
        return trimPrefix(killerKey, JOB_KILLER_DIR + "/");
    }

    /**
     * 从 /cron/workers/192.168.2.1 中提取 192.168.2.1
     */
    public static String extractWorkerIp(String workerKey) {
        return trimPrefix(workerKey, JOB_WORKER_DIR + "/");
    }

    private static String trimPrefix(String key, String prefix) {
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }
}
