package com.sunny.cron.core.message;

import java.util.Set;

/**
 * 调度器状态快照
 *
 * @param planCount       计划表中的任务数
 * @param runningJobs     正在执行的任务名
 * @param dispatchedCount 累计分发次数
 * @param skippedCount    累计因任务仍在执行而跳过的次数
 * @author SunnyX6
 * @date 2026-10-12
 */
public record SchedulerStatus(int planCount,
                              Set<String> runningJobs,
                              long dispatchedCount,
                              long skippedCount) {
}
