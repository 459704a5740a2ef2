package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.message.ExecutorMessage;
import com.sunny.cron.core.message.SchedulerMessage;
import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionOutcome;
import com.sunny.cron.core.model.ExecutionResult;
import com.sunny.cron.core.model.JobDefinition;
import org.apache.pekko.actor.testkit.typed.javadsl.BehaviorTestKit;
import org.apache.pekko.actor.testkit.typed.javadsl.TestInbox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobExecutor 单元测试
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class JobExecutorTest {

    private static ExecutionHandle handle() {
        return ExecutionHandle.of(new JobDefinition("job1", "echo 1", "* * * * * *"), 1000L, 1000L);
    }

    @Test
    public void resultIsReportedAndExecutorStops() {
        TestInbox<SchedulerMessage> scheduler = TestInbox.create();
        BehaviorTestKit<ExecutorMessage> testKit = BehaviorTestKit.create(JobExecutor.create(
                h -> ExecutionResult.success(h, new byte[0], 1001L, 1002L), scheduler.getRef()));

        ExecutionHandle handle = handle();
        testKit.run(new ExecutorMessage.ExecuteJob(handle));

        SchedulerMessage.JobResultReceived msg = (SchedulerMessage.JobResultReceived) scheduler.receiveMessage();
        assertEquals(ExecutionOutcome.SUCCESS, msg.result().outcome());
        assertFalse(testKit.isAlive());
        // 执行结束后强杀无效
        assertFalse(handle.cancelToken().cancel());
    }

    @Test
    public void executorExceptionBecomesFailure() {
        TestInbox<SchedulerMessage> scheduler = TestInbox.create();
        BehaviorTestKit<ExecutorMessage> testKit = BehaviorTestKit.create(JobExecutor.create(
                h -> {
                    throw new IllegalStateException("boom");
                }, scheduler.getRef()));

        testKit.run(new ExecutorMessage.ExecuteJob(handle()));

        SchedulerMessage.JobResultReceived msg = (SchedulerMessage.JobResultReceived) scheduler.receiveMessage();
        assertEquals(ExecutionOutcome.FAILURE, msg.result().outcome());
        assertTrue(msg.result().error().contains("boom"));
    }

    @Test
    public void assertionErrorStillReportsFailure() {
        TestInbox<SchedulerMessage> scheduler = TestInbox.create();
        BehaviorTestKit<ExecutorMessage> testKit = BehaviorTestKit.create(JobExecutor.create(
                h -> {
                    throw new AssertionError("broken context");
                }, scheduler.getRef()));

        ExecutionHandle handle = handle();
        testKit.run(new ExecutorMessage.ExecuteJob(handle));

        SchedulerMessage.JobResultReceived msg = (SchedulerMessage.JobResultReceived) scheduler.receiveMessage();
        assertEquals(ExecutionOutcome.FAILURE, msg.result().outcome());
        assertTrue(msg.result().error().contains("broken context"));
        assertFalse(testKit.isAlive());
        assertFalse(handle.cancelToken().cancel());
    }
}
