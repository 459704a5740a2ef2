package com.sunny.cron.worker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.model.JobDefinition;
import com.sunny.cron.core.model.JobEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.recipes.cache.ChildData;
import org.apache.curator.framework.recipes.cache.PathChildrenCache;
import org.apache.curator.framework.recipes.cache.PathChildrenCacheEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * 任务变化监听服务
 * <p>
 * 监听两个目录，把变化转换为 JobEvent 推送给调度器：
 * - /cron/jobs：新增/修改 → SAVE，删除 → DELETE（启动时已有的任务同样以 SAVE 推送）
 * - /cron/killer：新增/修改 → KILL
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@Service
public class JobWatcherService {

    private static final Logger log = LoggerFactory.getLogger(JobWatcherService.class);

    private final CuratorFramework client;
    private final ObjectMapper objectMapper;
    private final JobEventPublisher eventPublisher;

    private PathChildrenCache jobCache;
    private PathChildrenCache killerCache;

    public JobWatcherService(CuratorFramework client,
                             ObjectMapper objectMapper,
                             JobEventPublisher eventPublisher) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    public void start() throws Exception {
        jobCache = new PathChildrenCache(client, Constants.JOB_SAVE_DIR, true);
        jobCache.getListenable().addListener((c, event) -> onJobChanged(event));
        jobCache.start(PathChildrenCache.StartMode.NORMAL);

        killerCache = new PathChildrenCache(client, Constants.JOB_KILLER_DIR, false);
        killerCache.getListenable().addListener((c, event) -> onKillerChanged(event));
        killerCache.start(PathChildrenCache.StartMode.NORMAL);

        log.info("任务监听启动: jobDir={}, killerDir={}", Constants.JOB_SAVE_DIR, Constants.JOB_KILLER_DIR);
    }

    @PreDestroy
    public void stop() throws IOException {
        if (jobCache != null) {
            jobCache.close();
        }
        if (killerCache != null) {
            killerCache.close();
        }
        log.info("任务监听已停止");
    }

    void onJobChanged(PathChildrenCacheEvent event) {
        ChildData data = event.getData();
        switch (event.getType()) {
            case CHILD_ADDED, CHILD_UPDATED -> {
                JobDefinition job = decodeJob(data);
                if (job != null) {
                    eventPublisher.publish(JobEvent.save(job));
                }
            }
            case CHILD_REMOVED -> eventPublisher.publish(JobEvent.delete(Constants.extractJobName(data.getPath())));
            default -> log.debug("忽略任务目录事件: type={}", event.getType());
        }
    }

    void onKillerChanged(PathChildrenCacheEvent event) {
        switch (event.getType()) {
            case CHILD_ADDED, CHILD_UPDATED -> {
                String jobName = Constants.extractKillerName(event.getData().getPath());
                log.info("收到强杀通知: jobName={}", jobName);
                eventPublisher.publish(JobEvent.kill(jobName));
            }
            default -> log.debug("忽略强杀目录事件: type={}", event.getType());
        }
    }

    /**
     * 解析任务定义，无法解析时返回 null
     */
    private JobDefinition decodeJob(ChildData data) {
        byte[] bytes = data.getData();
        if (bytes == null || bytes.length == 0) {
            log.warn("任务定义为空，已忽略: path={}", data.getPath());
            return null;
        }
        try {
            return objectMapper.readValue(bytes, JobDefinition.class);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("任务定义解析失败，已忽略: path={}, error={}", data.getPath(), e.getMessage());
            return null;
        }
    }
}
