package com.sunny.cron.master.controller;

import com.sunny.cron.core.common.Result;
import com.sunny.cron.master.service.WorkerManagerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Worker 查询 Controller
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@RestController
@RequestMapping("/api/cron/worker")
public class WorkerController {

    private final WorkerManagerService workerManagerService;

    public WorkerController(WorkerManagerService workerManagerService) {
        this.workerManagerService = workerManagerService;
    }

    /**
     * 查询在线 Worker 列表
     */
    @GetMapping("/list")
    public Result<List<String>> list() {
        return Result.success(workerManagerService.listWorkers());
    }
}
