package com.sunny.cron.worker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.model.JobDefinition;
import com.sunny.cron.core.model.JobEvent;
import com.sunny.cron.core.model.JobEventType;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.RetryOneTime;
import org.apache.curator.test.TestingServer;
import org.apache.zookeeper.CreateMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobWatcherService 测试（内嵌 ZooKeeper）
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class JobWatcherServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BlockingQueue<JobEvent> events = new LinkedBlockingQueue<>();

    private TestingServer server;
    private CuratorFramework client;
    private JobWatcherService watcher;

    @BeforeEach
    public void setUp() throws Exception {
        server = new TestingServer();
        client = CuratorFrameworkFactory.newClient(server.getConnectString(), new RetryOneTime(100));
        client.start();
        client.blockUntilConnected();
        watcher = new JobWatcherService(client, objectMapper, events::add);
    }

    @AfterEach
    public void tearDown() throws Exception {
        watcher.stop();
        client.close();
        server.close();
    }

    private void putJob(JobDefinition job) throws Exception {
        byte[] data = objectMapper.writeValueAsBytes(job);
        String path = Constants.jobPath(job.name());
        if (client.checkExists().forPath(path) == null) {
            client.create().creatingParentContainersIfNeeded().forPath(path, data);
        } else {
            client.setData().forPath(path, data);
        }
    }

    private JobEvent nextEvent() throws InterruptedException {
        JobEvent event = events.poll(10, TimeUnit.SECONDS);
        assertNotNull(event, "没有收到任务事件");
        return event;
    }

    @Test
    public void existingJobsArePublishedOnStart() throws Exception {
        putJob(new JobDefinition("job1", "echo 1", "*/5 * * * * *"));

        watcher.start();

        JobEvent event = nextEvent();
        assertEquals(JobEventType.SAVE, event.type());
        assertEquals("job1", event.jobName());
        assertEquals("*/5 * * * * *", event.job().cronExpr());
    }

    @Test
    public void jobChangesArePublished() throws Exception {
        watcher.start();

        putJob(new JobDefinition("job1", "echo 1", "* * * * * *"));
        assertEquals(JobEventType.SAVE, nextEvent().type());

        putJob(new JobDefinition("job1", "echo 2", "* * * * * *"));
        JobEvent updated = nextEvent();
        assertEquals(JobEventType.SAVE, updated.type());
        assertEquals("echo 2", updated.job().command());

        client.delete().forPath(Constants.jobPath("job1"));
        JobEvent deleted = nextEvent();
        assertEquals(JobEventType.DELETE, deleted.type());
        assertEquals("job1", deleted.jobName());
    }

    @Test
    public void undecodableJobIsIgnored() throws Exception {
        watcher.start();

        client.create().creatingParentContainersIfNeeded()
                .forPath(Constants.jobPath("broken"), "{not json".getBytes(StandardCharsets.UTF_8));
        putJob(new JobDefinition("job1", "echo 1", "* * * * * *"));

        JobEvent event = nextEvent();
        assertEquals("job1", event.jobName());
    }

    @Test
    public void killerMarkerIsPublishedAsKill() throws Exception {
        watcher.start();

        client.create().creatingParentContainersIfNeeded()
                .withMode(CreateMode.EPHEMERAL)
                .forPath(Constants.killerPath("job1"));

        JobEvent event = nextEvent();
        assertEquals(JobEventType.KILL, event.type());
        assertEquals("job1", event.jobName());
    }
}
