package com.sunny.cron.worker.service;

import com.sunny.cron.core.model.JobEvent;

/**
 * 任务事件发布入口
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
@FunctionalInterface
public interface JobEventPublisher {

    void publish(JobEvent event);
}
