package com.sunny.cron.worker.service;

import com.sunny.cron.core.message.LogSinkMessage;
import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.worker.pekko.actor.JobLogWriter;
import org.apache.pekko.actor.testkit.typed.javadsl.ActorTestKit;
import org.apache.pekko.actor.testkit.typed.javadsl.TestInbox;
import org.apache.pekko.actor.testkit.typed.javadsl.TestProbe;
import org.apache.pekko.actor.typed.ActorRef;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobLogSink 单元测试
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class JobLogSinkTest {

    private static ActorTestKit testKit;

    @BeforeAll
    public static void setUp() {
        testKit = ActorTestKit.create();
    }

    @AfterAll
    public static void tearDown() {
        testKit.shutdownTestKit();
    }

    private static JobLog jobLog(String jobName) {
        return new JobLog(jobName, "echo 1", "", "1\n", 1000L, 1000L, 1001L, 1002L);
    }

    @Test
    public void appendIsDroppedWhenQueueIsFull() {
        TestInbox<LogSinkMessage> writer = TestInbox.create();
        LogSinkMetrics metrics = new LogSinkMetrics();
        JobLogSink sink = new JobLogSink(writer.getRef(), 2, metrics, testKit.system().scheduler());

        assertTrue(sink.append(jobLog("job1")));
        assertTrue(sink.append(jobLog("job2")));
        assertFalse(sink.append(jobLog("job3")));

        assertEquals(1, metrics.getDropped());
        assertEquals(2, metrics.getPending());
        assertEquals(2, writer.getAllReceived().size());
    }

    @Test
    public void queueAcceptsAgainAfterWriterDrains() {
        TestInbox<LogSinkMessage> writer = TestInbox.create();
        LogSinkMetrics metrics = new LogSinkMetrics();
        JobLogSink sink = new JobLogSink(writer.getRef(), 1, metrics, testKit.system().scheduler());

        assertTrue(sink.append(jobLog("job1")));
        assertFalse(sink.append(jobLog("job2")));

        metrics.onDequeued();

        assertTrue(sink.append(jobLog("job3")));
        assertEquals(1, metrics.getDropped());
    }

    @Test
    public void shutdownCommitsEveryQueuedLogBeforeStopping() {
        List<String> stored = Collections.synchronizedList(new ArrayList<>());
        LogSinkMetrics metrics = new LogSinkMetrics();
        // 批次上限和超时都足够大，日志只能由关闭流程提交
        ActorRef<LogSinkMessage> writer = testKit.spawn(JobLogWriter.create(
                logs -> logs.forEach(l -> stored.add(l.jobName())),
                new LogSinkSettings(1000, Duration.ofMinutes(10), 1000),
                metrics));
        JobLogSink sink = new JobLogSink(writer, 1000, metrics, testKit.system().scheduler());

        for (int i = 0; i < 50; i++) {
            assertTrue(sink.append(jobLog("job" + i)));
        }
        sink.shutdown(Duration.ofSeconds(5));

        assertEquals(50, stored.size());
        assertEquals("job0", stored.get(0));
        assertEquals("job49", stored.get(49));
        assertEquals(0, metrics.getPending());
        assertEquals(1, metrics.getFlushedBatches());

        TestProbe<Object> watcher = testKit.createTestProbe();
        watcher.expectTerminated(writer, Duration.ofSeconds(3));
    }

    @Test
    public void appendAfterShutdownIsDropped() {
        List<String> stored = Collections.synchronizedList(new ArrayList<>());
        LogSinkMetrics metrics = new LogSinkMetrics();
        ActorRef<LogSinkMessage> writer = testKit.spawn(JobLogWriter.create(
                logs -> logs.forEach(l -> stored.add(l.jobName())),
                new LogSinkSettings(10, Duration.ofSeconds(1), 10),
                metrics));
        JobLogSink sink = new JobLogSink(writer, 10, metrics, testKit.system().scheduler());

        sink.shutdown(Duration.ofSeconds(5));
        // 重复关闭直接返回
        sink.shutdown(Duration.ofSeconds(5));

        assertFalse(sink.append(jobLog("late")));
        assertEquals(1, metrics.getDropped());
        assertEquals(0, metrics.getPending());
        assertTrue(stored.isEmpty());
    }
}
