package com.sunny.cron.master.service;

import com.sunny.cron.core.common.Constants;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Worker 管理服务
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@Service
public class WorkerManagerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerManagerService.class);

    private final CuratorFramework client;

    public WorkerManagerService(CuratorFramework client) {
        this.client = client;
    }

    /**
     * 获取在线 Worker 列表
     * <p>
     * 每个在线 Worker 在 /cron/workers 下持有一个临时节点，节点名即 Worker IP
     *
     * @return Worker IP 列表，没有 Worker 时为空列表
     * @throws IllegalStateException ZooKeeper 访问失败
     */
    public List<String> listWorkers() {
        List<String> children;
        try {
            children = client.getChildren().forPath(Constants.JOB_WORKER_DIR);
        } catch (KeeperException.NoNodeException e) {
            return new ArrayList<>();
        } catch (Exception e) {
            throw new IllegalStateException("查询在线 Worker 失败: " + e.getMessage(), e);
        }

        List<String> workers = new ArrayList<>(children.size());
        for (String child : children) {
            // /cron/workers/192.168.1.1 → 192.168.1.1
            workers.add(Constants.extractWorkerIp(Constants.workerPath(child)));
        }
        log.debug("在线 Worker: {}", workers);
        return workers;
    }
}
