package com.sunny.cron.worker.lock;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.RetryOneTime;
import org.apache.curator.test.TestingServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ZkJobLockFactory 测试（内嵌 ZooKeeper）
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class ZkJobLockFactoryTest {

    private TestingServer server;
    private CuratorFramework workerA;
    private CuratorFramework workerB;

    @BeforeEach
    public void setUp() throws Exception {
        server = new TestingServer();
        workerA = newClient();
        workerB = newClient();
    }

    @AfterEach
    public void tearDown() throws Exception {
        workerA.close();
        workerB.close();
        server.close();
    }

    private CuratorFramework newClient() throws InterruptedException {
        CuratorFramework client = CuratorFrameworkFactory.newClient(server.getConnectString(), new RetryOneTime(100));
        client.start();
        client.blockUntilConnected();
        return client;
    }

    @Test
    public void onlyOneWorkerHoldsJobLock() {
        JobLock lockA = new ZkJobLockFactory(workerA).createLock("job1");
        JobLock lockB = new ZkJobLockFactory(workerB).createLock("job1");

        assertTrue(lockA.tryLock());
        assertFalse(lockB.tryLock());

        lockA.unlock();
        assertTrue(lockB.tryLock());
        lockB.unlock();
    }

    @Test
    public void differentJobsDoNotContend() {
        JobLock lock1 = new ZkJobLockFactory(workerA).createLock("job1");
        JobLock lock2 = new ZkJobLockFactory(workerB).createLock("job2");

        assertTrue(lock1.tryLock());
        assertTrue(lock2.tryLock());

        lock1.unlock();
        lock2.unlock();
    }

    @Test
    public void unlockWithoutLockIsNoOp() {
        JobLock lock = new ZkJobLockFactory(workerA).createLock("job1");

        assertDoesNotThrow(lock::unlock);
    }

    @Test
    public void closedClientRaisesLockException() {
        JobLock lock = new ZkJobLockFactory(workerA).createLock("job1");
        workerA.close();

        assertThrows(JobLockException.class, lock::tryLock);
    }

    @Test
    public void lostConnectionRaisesLockException() throws Exception {
        JobLock lock = new ZkJobLockFactory(workerA).createLock("job1");
        server.stop();

        long deadline = System.currentTimeMillis() + 10_000;
        while (workerA.getZookeeperClient().isConnected() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertThrows(JobLockException.class, lock::tryLock);
    }
}
