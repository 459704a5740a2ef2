package com.sunny.cron.worker.lock;

import com.sunny.cron.core.common.Constants;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.imps.CuratorFrameworkState;
import org.apache.curator.framework.recipes.locks.InterProcessSemaphoreMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 基于 ZooKeeper 的任务锁
 * <p>
 * 锁节点：/cron/lock/{jobName}，使用 InterProcessSemaphoreMutex（不可重入），加锁零等待。
 * 会话断开后锁节点随临时节点一起消失
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class ZkJobLockFactory implements JobLockFactory {

    private final CuratorFramework client;

    public ZkJobLockFactory(CuratorFramework client) {
        this.client = client;
    }

    @Override
    public JobLock createLock(String jobName) {
        return new ZkJobLock(client, jobName, new InterProcessSemaphoreMutex(client, Constants.lockPath(jobName)));
    }

    private static final class ZkJobLock implements JobLock {

        private static final Logger log = LoggerFactory.getLogger(ZkJobLock.class);

        private final CuratorFramework client;
        private final String jobName;
        private final InterProcessSemaphoreMutex mutex;
        private boolean locked;

        ZkJobLock(CuratorFramework client, String jobName, InterProcessSemaphoreMutex mutex) {
            this.client = client;
            this.jobName = jobName;
            this.mutex = mutex;
        }

        @Override
        public boolean tryLock() {
            // 客户端关闭或断连时 acquire 直接返回 false，与锁被占用无法区分
            if (client.getState() != CuratorFrameworkState.STARTED
                    || !client.getZookeeperClient().isConnected()) {
                throw new JobLockException("ZooKeeper 不可用，无法加锁: " + jobName + ", state=" + client.getState());
            }
            try {
                locked = mutex.acquire(0, TimeUnit.MILLISECONDS);
                return locked;
            } catch (Exception e) {
                throw new JobLockException("任务加锁失败: " + jobName, e);
            }
        }

        @Override
        public void unlock() {
            if (!locked) {
                return;
            }
            locked = false;
            try {
                mutex.release();
            } catch (Exception e) {
                // 会话已失效时锁节点会自行消失
                log.warn("任务释放锁失败: jobName={}, error={}", jobName, e.getMessage());
            }
        }
    }
}
