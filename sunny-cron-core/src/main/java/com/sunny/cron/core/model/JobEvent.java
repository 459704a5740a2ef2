package com.sunny.cron.core.model;

import com.sunny.cron.core.common.Assert;

/**
 * 任务变化事件
 * <p>
 * 由协调存储的 watch 转换而来，SAVE 事件携带完整任务定义，DELETE/KILL 只携带任务名
 *
 * @param type    事件类型
 * @param jobName 任务名
 * @param job     任务定义（仅 SAVE 事件非空）
 * @author SunnyX6
 * @date 2026-10-12
 */
public record JobEvent(JobEventType type, String jobName, JobDefinition job) {

    public JobEvent {
        Assert.notNull(type, "事件类型不能为空");
        Assert.notBlank(jobName, "任务名不能为空");
        if (type == JobEventType.SAVE) {
            Assert.notNull(job, "SAVE 事件必须携带任务定义");
        }
    }

    public static JobEvent save(JobDefinition job) {
        return new JobEvent(JobEventType.SAVE, job.name(), job);
    }

    public static JobEvent delete(String jobName) {
        return new JobEvent(JobEventType.DELETE, jobName, null);
    }

    public static JobEvent kill(String jobName) {
        return new JobEvent(JobEventType.KILL, jobName, null);
    }
}
