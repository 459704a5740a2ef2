package com.sunny.cron.core.model;

import java.nio.charset.StandardCharsets;

/**
 * 任务执行日志
 * <p>
 * 所有时间均为毫秒时间戳
 *
 * @param jobName      任务名
 * @param command      Shell 命令
 * @param err          错误原因（成功时为空串）
 * @param output       脚本输出
 * @param planTime     计划触发时间
 * @param scheduleTime 实际调度时间
 * @param startTime    开始执行时间
 * @param endTime      执行结束时间
 * @author SunnyX6
 * @date 2026-10-12
 */
public record JobLog(String jobName,
                     String command,
                     String err,
                     String output,
                     long planTime,
                     long scheduleTime,
                     long startTime,
                     long endTime) {

    /**
     * 由执行结果生成日志
     */
    public static JobLog from(ExecutionResult result) {
        ExecutionHandle handle = result.handle();
        return new JobLog(
                handle.jobName(),
                handle.job().command(),
                result.error() != null ? result.error() : "",
                new String(result.output(), StandardCharsets.UTF_8),
                handle.planTime(),
                handle.scheduleTime(),
                result.startTime(),
                result.endTime()
        );
    }
}
