package com.sunny.cron.worker.service;

import com.sunny.cron.core.model.JobLog;

import java.util.List;

/**
 * 执行日志持久化存储
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public interface JobLogStore {

    /**
     * 批量写入日志
     *
     * @param logs 一个批次的日志
     * @throws RuntimeException 写入失败
     */
    void insertBatch(List<JobLog> logs);
}
