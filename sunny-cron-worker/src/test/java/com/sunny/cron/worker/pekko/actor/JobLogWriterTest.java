package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.message.LogSinkMessage;
import com.sunny.cron.core.message.LogSinkMessage.AppendLog;
import com.sunny.cron.core.message.LogSinkMessage.CommitTimeout;
import com.sunny.cron.core.message.LogSinkMessage.Shutdown;
import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.worker.service.JobLogStore;
import com.sunny.cron.worker.service.LogSinkMetrics;
import com.sunny.cron.worker.service.LogSinkSettings;
import org.apache.pekko.Done;
import org.apache.pekko.actor.testkit.typed.Effect;
import org.apache.pekko.actor.testkit.typed.javadsl.BehaviorTestKit;
import org.apache.pekko.actor.testkit.typed.javadsl.TestInbox;
import org.apache.pekko.actor.typed.PostStop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobLogWriter 单元测试
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class JobLogWriterTest {

    private RecordingStore store;
    private LogSinkMetrics metrics;
    private BehaviorTestKit<LogSinkMessage> testKit;

    @BeforeEach
    public void setUp() {
        store = new RecordingStore();
        metrics = new LogSinkMetrics();
        LogSinkSettings settings = new LogSinkSettings(3, Duration.ofSeconds(1), 100);
        testKit = BehaviorTestKit.create(JobLogWriter.create(store, settings, metrics));
        testKit.getAllEffects();
    }

    @Test
    public void fullBatchIsWrittenOnceAndTimerCancelled() {
        testKit.run(append("job1"));
        testKit.run(append("job2"));
        assertTrue(store.batches.isEmpty());

        testKit.run(append("job3"));

        assertEquals(1, store.batches.size());
        assertEquals(List.of("job1", "job2", "job3"),
                store.batches.get(0).stream().map(JobLog::jobName).toList());
        assertTrue(testKit.getAllEffects().stream().anyMatch(e -> e instanceof Effect.TimerCancelled));
        assertEquals(1, metrics.getFlushedBatches());
        assertEquals(3, metrics.getFlushedLogs());
    }

    @Test
    public void timeoutFlushesPartialBatch() {
        testKit.run(append("job1"));
        CommitTimeout timeout = commitTimeoutOf(testKit.getAllEffects());

        testKit.run(timeout);

        assertEquals(1, store.batches.size());
        assertEquals(1, store.batches.get(0).size());
    }

    @Test
    public void staleTimeoutOfCommittedBatchIsIgnored() {
        testKit.run(append("job1"));
        CommitTimeout staleTimeout = commitTimeoutOf(testKit.getAllEffects());
        testKit.run(append("job2"));
        testKit.run(append("job3"));
        assertEquals(1, store.batches.size());

        // 新批次已打开，旧定时器消息到达
        testKit.run(append("job4"));
        testKit.run(staleTimeout);

        assertEquals(1, store.batches.size());

        testKit.run(commitTimeoutOf(testKit.getAllEffects()));
        assertEquals(2, store.batches.size());
        assertEquals("job4", store.batches.get(1).get(0).jobName());
    }

    @Test
    public void failedWriteIsCountedAndBatchDiscarded() {
        store.failing = true;
        testKit.run(append("job1"));
        testKit.run(append("job2"));
        testKit.run(append("job3"));

        assertEquals(1, metrics.getFailedBatches());
        assertEquals(3, metrics.getFailedLogs());
        assertEquals(0, metrics.getFlushedBatches());

        // 失败后继续接收新日志
        store.failing = false;
        testKit.run(append("job4"));
        testKit.run(commitTimeoutOf(testKit.getAllEffects()));
        assertEquals(1, store.batches.size());
    }

    @Test
    public void storeErrorDoesNotStopWriter() {
        store.failure = new NoClassDefFoundError("com/mysql/cj/jdbc/Driver");
        testKit.run(append("job1"));
        testKit.run(append("job2"));
        testKit.run(append("job3"));

        assertTrue(testKit.isAlive());
        assertEquals(1, metrics.getFailedBatches());

        store.failure = null;
        testKit.run(append("job4"));
        testKit.run(commitTimeoutOf(testKit.getAllEffects()));
        assertEquals(1, store.batches.size());
        assertEquals(1, metrics.getFlushedBatches());
    }

    @Test
    public void undeclaredCheckedExceptionIsCountedAsFailure() {
        store.failure = new SQLException("Connection refused");
        testKit.run(append("job1"));
        testKit.run(append("job2"));
        testKit.run(append("job3"));

        assertTrue(testKit.isAlive());
        assertEquals(1, metrics.getFailedBatches());
        assertEquals(3, metrics.getFailedLogs());
    }

    @Test
    public void shutdownFlushesOpenBatchRepliesAndStops() {
        TestInbox<Done> done = TestInbox.create();
        testKit.run(append("job1"));
        testKit.run(append("job2"));
        testKit.getAllEffects();

        testKit.run(new Shutdown(done.getRef()));

        assertEquals(1, store.batches.size());
        assertEquals(2, store.batches.get(0).size());
        assertEquals(Done.getInstance(), done.receiveMessage());
        assertFalse(testKit.isAlive());
        assertTrue(testKit.getAllEffects().stream().anyMatch(e -> e instanceof Effect.TimerCancelled));
    }

    @Test
    public void shutdownWithoutOpenBatchWritesNothing() {
        TestInbox<Done> done = TestInbox.create();

        testKit.run(new Shutdown(done.getRef()));

        assertTrue(store.batches.isEmpty());
        assertEquals(Done.getInstance(), done.receiveMessage());
        assertFalse(testKit.isAlive());
    }

    @Test
    public void openBatchIsFlushedOnStop() {
        testKit.run(append("job1"));

        testKit.signal(PostStop.instance());

        assertEquals(1, store.batches.size());
    }

    static AppendLog append(String jobName) {
        return new AppendLog(new JobLog(jobName, "echo " + jobName, "", "", 1000L, 1000L, 1001L, 1002L));
    }

    private static CommitTimeout commitTimeoutOf(List<Effect> effects) {
        CommitTimeout last = null;
        for (Effect effect : effects) {
            if (effect instanceof Effect.TimerScheduled<?> timer && timer.msg() instanceof CommitTimeout timeout) {
                last = timeout;
            }
        }
        assertNotNull(last, "没有启动批次超时定时器");
        return last;
    }

    static class RecordingStore implements JobLogStore {

        final List<List<JobLog>> batches = new ArrayList<>();
        volatile boolean failing;
        volatile Throwable failure;

        @Override
        public void insertBatch(List<JobLog> logs) {
            if (failing) {
                throw new IllegalStateException("数据库不可用");
            }
            if (failure != null) {
                RecordingStore.<RuntimeException>sneakyThrow(failure);
            }
            batches.add(new ArrayList<>(logs));
        }

        /**
         * 模拟动态代理等绕过编译期检查抛出的受检异常
         */
        @SuppressWarnings("unchecked")
        private static <E extends Throwable> void sneakyThrow(Throwable e) throws E {
            throw (E) e;
        }
    }
}
