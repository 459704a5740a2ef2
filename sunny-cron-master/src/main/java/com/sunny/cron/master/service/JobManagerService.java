package com.sunny.cron.master.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.cron.CronUtils;
import com.sunny.cron.core.model.JobDefinition;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务管理服务
 * <p>
 * 任务定义以 JSON 保存在 /cron/jobs/{name}，Worker 监听该目录完成调度计划的增删改；
 * 强杀通过在 /cron/killer/{name} 写入临时节点通知所有 Worker
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@Service
public class JobManagerService {

    private static final Logger log = LoggerFactory.getLogger(JobManagerService.class);

    private final CuratorFramework client;
    private final ObjectMapper objectMapper;

    public JobManagerService(CuratorFramework client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    /**
     * 保存任务（新增或覆盖）
     *
     * @param job 任务定义
     * @return 覆盖前的任务定义，新增时为 null
     * @throws IllegalArgumentException 任务定义非法
     * @throws IllegalStateException    ZooKeeper 访问失败
     */
    public JobDefinition saveJob(JobDefinition job) {
        Assert.notNull(job, "任务定义不能为空");
        Assert.isTrue(!job.name().contains("/"), "任务名不能包含 /");
        Assert.notBlank(job.command(), "任务命令不能为空");
        Assert.isTrue(CronUtils.isValidCron(job.cronExpr()), "Cron 表达式非法: " + job.cronExpr());

        String path = Constants.jobPath(job.name());
        byte[] data = encode(job);
        try {
            Stat stat = new Stat();
            byte[] oldData;
            try {
                oldData = client.getData().storingStatIn(stat).forPath(path);
            } catch (KeeperException.NoNodeException e) {
                client.create().creatingParentContainersIfNeeded().forPath(path, data);
                log.info("新增任务: name={}, cronExpr={}", job.name(), job.cronExpr());
                return null;
            }
            client.setData().withVersion(stat.getVersion()).forPath(path, data);
            log.info("更新任务: name={}, cronExpr={}", job.name(), job.cronExpr());
            return decode(path, oldData);
        } catch (Exception e) {
            throw new IllegalStateException("保存任务失败: " + job.name() + ", " + e.getMessage(), e);
        }
    }

    /**
     * 删除任务
     *
     * @return 被删除的任务定义，不存在时为 null
     */
    public JobDefinition deleteJob(String name) {
        Assert.notBlank(name, "任务名不能为空");
        String path = Constants.jobPath(name);
        try {
            Stat stat = new Stat();
            byte[] oldData = client.getData().storingStatIn(stat).forPath(path);
            client.delete().withVersion(stat.getVersion()).forPath(path);
            log.info("删除任务: name={}", name);
            return decode(path, oldData);
        } catch (KeeperException.NoNodeException e) {
            return null;
        } catch (Exception e) {
            throw new IllegalStateException("删除任务失败: " + name + ", " + e.getMessage(), e);
        }
    }

    /**
     * 列出所有任务，无法解析的定义跳过
     */
    public List<JobDefinition> listJobs() {
        List<String> names;
        try {
            names = client.getChildren().forPath(Constants.JOB_SAVE_DIR);
        } catch (KeeperException.NoNodeException e) {
            return new ArrayList<>();
        } catch (Exception e) {
            throw new IllegalStateException("查询任务列表失败: " + e.getMessage(), e);
        }

        List<JobDefinition> jobs = new ArrayList<>(names.size());
        for (String name : names) {
            String path = Constants.jobPath(name);
            try {
                JobDefinition job = decode(path, client.getData().forPath(path));
                if (job != null) {
                    jobs.add(job);
                }
            } catch (KeeperException.NoNodeException e) {
                // 遍历期间被删除
                log.debug("任务已被删除: path={}", path);
            } catch (Exception e) {
                throw new IllegalStateException("读取任务失败: " + name + ", " + e.getMessage(), e);
            }
        }
        return jobs;
    }

    /**
     * 强杀任务
     * <p>
     * 在 /cron/killer/{name} 创建临时节点，已存在则更新一次数据，保证 Worker 都能收到变化
     */
    public void killJob(String name) {
        Assert.notBlank(name, "任务名不能为空");
        String path = Constants.killerPath(name);
        byte[] data = String.valueOf(System.currentTimeMillis()).getBytes(StandardCharsets.UTF_8);
        try {
            try {
                client.create()
                        .creatingParentContainersIfNeeded()
                        .withMode(CreateMode.EPHEMERAL)
                        .forPath(path, data);
            } catch (KeeperException.NodeExistsException e) {
                client.setData().forPath(path, data);
            }
            log.info("下发强杀通知: name={}", name);
        } catch (Exception e) {
            throw new IllegalStateException("强杀任务失败: " + name + ", " + e.getMessage(), e);
        }
    }

    private byte[] encode(JobDefinition job) {
        try {
            return objectMapper.writeValueAsBytes(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("任务序列化失败: " + job.name(), e);
        }
    }

    private JobDefinition decode(String path, byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(data, JobDefinition.class);
        } catch (IOException e) {
            log.warn("任务定义解析失败: path={}, error={}", path, e.getMessage());
            return null;
        }
    }
}
