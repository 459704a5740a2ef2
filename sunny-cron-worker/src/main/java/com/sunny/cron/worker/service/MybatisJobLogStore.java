package com.sunny.cron.worker.service;

import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.worker.domain.entity.JobLogEntity;
import com.sunny.cron.worker.domain.mapper.JobLogMapper;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 基于 MyBatis 的执行日志存储
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
@Service
public class MybatisJobLogStore implements JobLogStore {

    private final JobLogMapper jobLogMapper;

    public MybatisJobLogStore(JobLogMapper jobLogMapper) {
        this.jobLogMapper = jobLogMapper;
    }

    @Override
    public void insertBatch(List<JobLog> logs) {
        if (logs.isEmpty()) {
            return;
        }
        List<JobLogEntity> entities = logs.stream().map(JobLogEntity::from).toList();
        jobLogMapper.insertBatch(entities);
    }
}
