package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.message.ExecutorMessage;
import com.sunny.cron.core.message.ExecutorMessage.ExecuteJob;
import com.sunny.cron.core.message.SchedulerMessage;
import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionResult;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 任务执行器（本地 Actor）
 * <p>
 * 本地化设计：
 * - 由 JobScheduler 每次分发时 spawn 创建，运行在阻塞 Dispatcher 上
 * - 执行完成后把结果回传 JobScheduler，恰好一次
 * - 执行完成后自动终止
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobExecutor extends AbstractBehavior<ExecutorMessage> {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobExecutorContext executorContext;
    private final ActorRef<SchedulerMessage> scheduler;

    public static Behavior<ExecutorMessage> create(JobExecutorContext executorContext,
                                                   ActorRef<SchedulerMessage> scheduler) {
        return Behaviors.setup(ctx -> new JobExecutor(ctx, executorContext, scheduler));
    }

    private JobExecutor(ActorContext<ExecutorMessage> context,
                        JobExecutorContext executorContext,
                        ActorRef<SchedulerMessage> scheduler) {
        super(context);
        this.executorContext = executorContext;
        this.scheduler = scheduler;
    }

    @Override
    public Receive<ExecutorMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(ExecuteJob.class, this::onExecuteJob)
                .build();
    }

    /**
     * 处理执行任务
     * <p>
     * 同步执行，执行器抛出的异常和非 JVM 级错误都转换为 FAILURE 结果回传。
     * VirtualMachineError 继续上抛，执行器终止后由调度器的 watchWith 通知兜底
     */
    private Behavior<ExecutorMessage> onExecuteJob(ExecuteJob msg) {
        ExecutionHandle handle = msg.handle();
        log.debug("开始执行任务: jobName={}, planTime={}", handle.jobName(), handle.planTime());

        ExecutionResult result;
        try {
            result = executorContext.execute(handle);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("任务执行器异常: jobName={}", handle.jobName(), e);
            long now = System.currentTimeMillis();
            result = ExecutionResult.failure(handle, null, "执行器异常: " + e.getMessage(), now, now);
        } finally {
            handle.cancelToken().complete();
        }

        scheduler.tell(new SchedulerMessage.JobResultReceived(result));
        return Behaviors.stopped();
    }
}
