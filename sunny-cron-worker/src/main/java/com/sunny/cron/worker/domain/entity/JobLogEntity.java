package com.sunny.cron.worker.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.cron.core.model.JobLog;

/**
 * 任务执行日志实体
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
@TableName("cron_job_log")
public class JobLogEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String jobName;

    private String command;

    /**
     * 错误原因，成功时为空串
     */
    private String err;

    private String output;

    /**
     * 计划触发时间（毫秒）
     */
    private Long planTime;

    /**
     * 实际调度时间（毫秒）
     */
    private Long scheduleTime;

    private Long startTime;

    private Long endTime;

    public static JobLogEntity from(JobLog jobLog) {
        JobLogEntity entity = new JobLogEntity();
        entity.setJobName(jobLog.jobName());
        entity.setCommand(jobLog.command());
        entity.setErr(jobLog.err());
        entity.setOutput(jobLog.output());
        entity.setPlanTime(jobLog.planTime());
        entity.setScheduleTime(jobLog.scheduleTime());
        entity.setStartTime(jobLog.startTime());
        entity.setEndTime(jobLog.endTime());
        return entity;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getErr() {
        return err;
    }

    public void setErr(String err) {
        this.err = err;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public Long getPlanTime() {
        return planTime;
    }

    public void setPlanTime(Long planTime) {
        this.planTime = planTime;
    }

    public Long getScheduleTime() {
        return scheduleTime;
    }

    public void setScheduleTime(Long scheduleTime) {
        this.scheduleTime = scheduleTime;
    }

    public Long getStartTime() {
        return startTime;
    }

    public void setStartTime(Long startTime) {
        this.startTime = startTime;
    }

    public Long getEndTime() {
        return endTime;
    }

    public void setEndTime(Long endTime) {
        this.endTime = endTime;
    }
}
