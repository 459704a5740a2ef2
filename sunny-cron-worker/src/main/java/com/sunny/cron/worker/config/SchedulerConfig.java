package com.sunny.cron.worker.config;

import com.sunny.cron.worker.lock.JobLockFactory;
import com.sunny.cron.worker.lock.ZkJobLockFactory;
import com.sunny.cron.worker.pekko.actor.JobExecutorContext;
import com.sunny.cron.worker.pekko.actor.JobSchedulerManager;
import com.sunny.cron.worker.pekko.actor.impl.ShellJobExecutorContext;
import com.sunny.cron.worker.service.JobLogSink;
import com.sunny.cron.worker.service.JobLogStore;
import com.sunny.cron.worker.service.LogSinkSettings;
import org.apache.curator.framework.CuratorFramework;
import org.apache.pekko.actor.typed.ActorSystem;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 调度引擎装配
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@Configuration
public class SchedulerConfig {

    @Value("${sunny.cron.worker.shell:/bin/bash}")
    private String shell;

    @Value("${sunny.cron.worker.log.batch-size:100}")
    private int logBatchSize;

    @Value("${sunny.cron.worker.log.commit-timeout:1000}")
    private long logCommitTimeoutMs;

    @Value("${sunny.cron.worker.log.queue-capacity:1000}")
    private int logQueueCapacity;

    /**
     * 调度时钟，时区即 Cron 表达式的解释时区
     */
    @Bean
    public Clock schedulerClock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 依赖 ActorSystem，Spring 先销毁本 Bean，保证剩余日志在 ActorSystem 终止前提交
     */
    @Bean(destroyMethod = "shutdown")
    public JobLogSink jobLogSink(ActorSystem<Void> actorSystem, JobLogStore jobLogStore) {
        LogSinkSettings settings = new LogSinkSettings(
                logBatchSize, Duration.ofMillis(logCommitTimeoutMs), logQueueCapacity);
        return JobLogSink.start(actorSystem, jobLogStore, settings);
    }

    @Bean
    public JobLockFactory jobLockFactory(CuratorFramework curatorFramework) {
        return new ZkJobLockFactory(curatorFramework);
    }

    @Bean
    public JobExecutorContext jobExecutorContext(JobLockFactory jobLockFactory, Clock schedulerClock) {
        return new ShellJobExecutorContext(jobLockFactory, shell, schedulerClock);
    }

    @Bean
    public JobSchedulerManager jobSchedulerManager(ActorSystem<Void> actorSystem,
                                                   Clock schedulerClock,
                                                   JobExecutorContext jobExecutorContext,
                                                   JobLogSink jobLogSink) {
        return new JobSchedulerManager(actorSystem, schedulerClock, jobExecutorContext, jobLogSink);
    }
}
