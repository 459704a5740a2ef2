package com.sunny.cron.worker.service;

import com.sunny.cron.core.model.JobLog;

/**
 * 执行日志投递入口
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
@FunctionalInterface
public interface JobLogAppender {

    /**
     * 投递一条日志，不阻塞调用方
     *
     * @param jobLog 执行日志
     * @return false 表示队列已满，日志被丢弃
     */
    boolean append(JobLog jobLog);
}
