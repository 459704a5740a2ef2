package com.sunny.cron.core.model;

import com.sunny.cron.core.cron.CronUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;

/**
 * 任务调度计划
 * <p>
 * 由任务定义派生，每次触发后推进 nextTime；只在 JobScheduler 的 Actor 线程中修改
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public final class SchedulePlan {

    private final JobDefinition job;
    private final CronExpression cron;
    private final ZoneId zoneId;

    /**
     * 下次触发时间（毫秒）
     */
    private long nextTime;

    private SchedulePlan(JobDefinition job, CronExpression cron, ZoneId zoneId, long nextTime) {
        this.job = job;
        this.cron = cron;
        this.zoneId = zoneId;
        this.nextTime = nextTime;
    }

    /**
     * 构建调度计划
     *
     * @param job    任务定义
     * @param nowMs  当前时间（毫秒）
     * @param zoneId 时区
     * @return 调度计划
     * @throws IllegalArgumentException Cron 表达式非法或不存在下一次触发时间
     */
    public static SchedulePlan build(JobDefinition job, long nowMs, ZoneId zoneId) {
        CronExpression cron = CronUtils.parse(job.cronExpr());
        long nextTime = CronUtils.nextTriggerTime(cron, nowMs, zoneId);
        if (nextTime < 0) {
            throw new IllegalArgumentException("Cron 表达式没有下一次触发时间: " + job.cronExpr());
        }
        return new SchedulePlan(job, cron, zoneId, nextTime);
    }

    /**
     * 是否到期
     */
    public boolean isDue(long nowMs) {
        return nextTime <= nowMs;
    }

    /**
     * 推进到严格晚于 nowMs 的下一次触发时间
     * <p>
     * 基于 now 而不是旧的 nextTime 计算，停机期间错过的触发不会补跑
     *
     * @return false 表示表达式已无后续触发时间
     */
    public boolean advance(long nowMs) {
        long next = CronUtils.nextTriggerTime(cron, nowMs, zoneId);
        if (next < 0) {
            return false;
        }
        this.nextTime = next;
        return true;
    }

    public JobDefinition getJob() {
        return job;
    }

    public String getJobName() {
        return job.name();
    }

    public long getNextTime() {
        return nextTime;
    }
}
