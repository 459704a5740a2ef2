package com.sunny.cron.core.model;

/**
 * 任务执行结果
 *
 * @param handle    执行状态
 * @param outcome   结果类型
 * @param output    脚本输出
 * @param error     错误信息（成功时为 null）
 * @param startTime 开始时间（毫秒）
 * @param endTime   结束时间（毫秒）
 * @author SunnyX6
 * @date 2026-10-12
 */
public record ExecutionResult(ExecutionHandle handle,
                              ExecutionOutcome outcome,
                              byte[] output,
                              String error,
                              long startTime,
                              long endTime) {

    private static final byte[] EMPTY = new byte[0];

    public ExecutionResult {
        output = output != null ? output : EMPTY;
    }

    public static ExecutionResult success(ExecutionHandle handle, byte[] output, long startTime, long endTime) {
        return new ExecutionResult(handle, ExecutionOutcome.SUCCESS, output, null, startTime, endTime);
    }

    public static ExecutionResult failure(ExecutionHandle handle, byte[] output, String error,
                                          long startTime, long endTime) {
        return new ExecutionResult(handle, ExecutionOutcome.FAILURE, output, error, startTime, endTime);
    }

    public static ExecutionResult lockBusy(ExecutionHandle handle, long startTime, long endTime) {
        return new ExecutionResult(handle, ExecutionOutcome.LOCK_BUSY, EMPTY, null, startTime, endTime);
    }

    public String jobName() {
        return handle.jobName();
    }
}
