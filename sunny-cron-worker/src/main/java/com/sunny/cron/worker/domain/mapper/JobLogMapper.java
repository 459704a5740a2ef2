package com.sunny.cron.worker.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.cron.worker.domain.entity.JobLogEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务执行日志 Mapper
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
@Mapper
public interface JobLogMapper extends BaseMapper<JobLogEntity> {

    /**
     * 批量插入日志（单条 INSERT ... VALUES 多行）
     *
     * @param logs 日志列表
     * @return 影响行数
     */
    int insertBatch(@Param("logs") List<JobLogEntity> logs);
}
