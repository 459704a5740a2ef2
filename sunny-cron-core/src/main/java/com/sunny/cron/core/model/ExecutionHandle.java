package com.sunny.cron.core.model;

/**
 * 任务执行状态
 * <p>
 * 分发时创建，收到执行结果后从执行表移除；同一任务名同一时刻最多存在一个
 *
 * @param job          任务定义
 * @param planTime     计划触发时间（毫秒）
 * @param scheduleTime 实际调度时间（毫秒）
 * @param cancelToken  取消令牌（强杀）
 * @author SunnyX6
 * @date 2026-10-12
 */
public record ExecutionHandle(JobDefinition job, long planTime, long scheduleTime, CancelToken cancelToken) {

    public static ExecutionHandle of(JobDefinition job, long planTime, long scheduleTime) {
        return new ExecutionHandle(job, planTime, scheduleTime, new CancelToken());
    }

    public String jobName() {
        return job.name();
    }
}
