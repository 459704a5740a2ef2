package com.sunny.cron.master.controller;

import com.sunny.cron.core.common.Result;
import com.sunny.cron.core.model.JobDefinition;
import com.sunny.cron.master.service.JobManagerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 任务管理 Controller
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@RestController
@RequestMapping("/api/cron/job")
public class JobController {

    private final JobManagerService jobManagerService;

    public JobController(JobManagerService jobManagerService) {
        this.jobManagerService = jobManagerService;
    }

    /**
     * 保存任务，返回覆盖前的定义
     */
    @PostMapping("/save")
    public Result<JobDefinition> save(@RequestBody JobDefinition job) {
        return Result.success(jobManagerService.saveJob(job));
    }

    /**
     * 删除任务，返回被删除的定义
     */
    @PostMapping("/delete")
    public Result<JobDefinition> delete(@RequestParam String name) {
        return Result.success(jobManagerService.deleteJob(name));
    }

    @GetMapping("/list")
    public Result<List<JobDefinition>> list() {
        return Result.success(jobManagerService.listJobs());
    }

    /**
     * 强杀任务
     */
    @PostMapping("/kill")
    public Result<Void> kill(@RequestParam String name) {
        jobManagerService.killJob(name);
        return Result.success();
    }
}
