package com.sunny.cron.worker.service;

import com.sunny.cron.core.message.SchedulerStatus;
import com.sunny.cron.worker.pekko.actor.JobSchedulerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker 状态上报（打印到日志）
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@Service
public class WorkerStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(WorkerStatusReporter.class);

    private static final Duration QUERY_TIMEOUT = Duration.ofSeconds(3);

    private final JobSchedulerManager schedulerManager;
    private final JobLogSink logSink;
    private final WorkerRegisterService registerService;

    public WorkerStatusReporter(JobSchedulerManager schedulerManager,
                                JobLogSink logSink,
                                WorkerRegisterService registerService) {
        this.schedulerManager = schedulerManager;
        this.logSink = logSink;
        this.registerService = registerService;
    }

    @Scheduled(fixedRateString = "${sunny.cron.worker.status-report-interval:60000}",
            initialDelayString = "${sunny.cron.worker.status-report-interval:60000}")
    public void report() {
        SchedulerStatus status;
        try {
            status = schedulerManager.queryStatus(QUERY_TIMEOUT)
                    .toCompletableFuture()
                    .get(QUERY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (TimeoutException | ExecutionException | CompletionException e) {
            log.warn("查询调度器状态失败: error={}", e.getMessage());
            return;
        }

        log.info("Worker 状态: ip={}, registered={}, plans={}, running={}, dispatched={}, skipped={}, logSink={}",
                registerService.getWorkerIp(), registerService.isRegistered(),
                status.planCount(), status.runningJobs(), status.dispatchedCount(), status.skippedCount(),
                logSink.getMetrics());
    }
}
