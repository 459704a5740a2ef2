package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.message.ExecutorMessage;
import com.sunny.cron.core.message.SchedulerMessage;
import com.sunny.cron.core.message.SchedulerMessage.ExecutorStopped;
import com.sunny.cron.core.message.SchedulerMessage.JobEventReceived;
import com.sunny.cron.core.message.SchedulerMessage.JobResultReceived;
import com.sunny.cron.core.message.SchedulerMessage.QueryStatus;
import com.sunny.cron.core.message.SchedulerMessage.TimerFired;
import com.sunny.cron.core.message.SchedulerStatus;
import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionOutcome;
import com.sunny.cron.core.model.ExecutionResult;
import com.sunny.cron.core.model.JobEvent;
import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.core.model.SchedulePlan;
import com.sunny.cron.worker.service.JobLogAppender;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;

/**
 * 任务调度器（每个 Worker 一个本地 Actor）
 * <p>
 * 核心设计原则：调度和执行是两件事
 * <p>
 * 单线程事件循环：
 * - 任务事件（JobEventReceived）、定时唤醒（TimerFired）、执行结果（JobResultReceived）进入同一个邮箱
 * - 计划表和执行表只在 Actor 消息处理线程中访问，无需加锁
 * - 每处理完一条消息重新计算一次调度（trySchedule），并按最近的触发时间重设唤醒定时器
 * <p>
 * 并发控制：
 * - 同一任务同时最多一个执行实例
 * - 任务仍在执行时到期的调度直接丢弃，不排队、不补跑
 * <p>
 * 执行分发：
 * - 每次分发 spawn 一个 JobExecutor 子 Actor，运行在阻塞 Dispatcher 上
 * - 分发只是投递消息，不阻塞调度循环
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobScheduler extends AbstractBehavior<SchedulerMessage> {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /**
     * 唤醒定时器 key（全局只有一个唤醒定时器）
     */
    private static final String WAKE_TIMER_KEY = "scheduler-wake";

    /**
     * 计划表为空时的唤醒间隔
     */
    static final Duration IDLE_WAKE_INTERVAL = Duration.ofMillis(Constants.IDLE_WAKE_INTERVAL_MS);

    private final TimerScheduler<SchedulerMessage> timers;
    private final Clock clock;
    private final JobExecutorContext executorContext;
    private final JobLogAppender logAppender;

    /**
     * 任务调度计划表
     */
    private final JobPlanTable planTable = new JobPlanTable();

    /**
     * 任务执行表
     */
    private final JobExecutingTable executingTable = new JobExecutingTable();

    /**
     * 执行器序号（用于生成子 Actor 名称）
     */
    private long executorSeq = 0;

    private long dispatchedCount = 0;
    private long skippedCount = 0;

    /**
     * 创建调度器
     *
     * @param clock           时钟（决定 now 和时区）
     * @param executorContext 执行上下文
     * @param logAppender     执行日志投递入口
     */
    public static Behavior<SchedulerMessage> create(Clock clock,
                                                    JobExecutorContext executorContext,
                                                    JobLogAppender logAppender) {
        return Behaviors.setup(ctx ->
                Behaviors.withTimers(timers ->
                        new JobScheduler(ctx, timers, clock, executorContext, logAppender)));
    }

    private JobScheduler(ActorContext<SchedulerMessage> context,
                         TimerScheduler<SchedulerMessage> timers,
                         Clock clock,
                         JobExecutorContext executorContext,
                         JobLogAppender logAppender) {
        super(context);
        this.timers = timers;
        this.clock = clock;
        this.executorContext = executorContext;
        this.logAppender = logAppender;

        log.info("JobScheduler 启动, zone={}", clock.getZone());
        rescheduleWakeUp();
    }

    @Override
    public Receive<SchedulerMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(JobEventReceived.class, this::onJobEvent)
                .onMessage(TimerFired.class, this::onTimerFired)
                .onMessage(JobResultReceived.class, this::onJobResult)
                .onMessage(ExecutorStopped.class, this::onExecutorStopped)
                .onMessage(QueryStatus.class, this::onQueryStatus)
                .onSignal(PostStop.class, this::onPostStop)
                .build();
    }

    private Behavior<SchedulerMessage> onJobEvent(JobEventReceived msg) {
        handleJobEvent(msg.event());
        return afterIteration();
    }

    private Behavior<SchedulerMessage> onTimerFired(TimerFired msg) {
        return afterIteration();
    }

    private Behavior<SchedulerMessage> onJobResult(JobResultReceived msg) {
        handleJobResult(msg.result());
        return afterIteration();
    }

    /**
     * 执行器终止通知
     * <p>
     * 正常情况下结果先于终止通知到达，执行表已清理，这里直接忽略；
     * 执行表中仍是同一个执行状态，说明执行器未回传结果就终止了，补记 FAILURE
     */
    private Behavior<SchedulerMessage> onExecutorStopped(ExecutorStopped msg) {
        ExecutionHandle handle = msg.handle();
        if (executingTable.get(handle.jobName()) == handle) {
            log.error("任务执行器异常终止，未回传执行结果: jobName={}, planTime={}",
                    handle.jobName(), handle.planTime());
            handle.cancelToken().complete();
            long now = clock.millis();
            handleJobResult(ExecutionResult.failure(handle, null, "执行器异常终止", now, now));
        }
        return afterIteration();
    }

    private Behavior<SchedulerMessage> onQueryStatus(QueryStatus msg) {
        msg.replyTo().tell(new SchedulerStatus(
                planTable.size(),
                executingTable.jobNames(),
                dispatchedCount,
                skippedCount
        ));
        return afterIteration();
    }

    /**
     * 处理 Actor 停止信号
     * <p>
     * 强杀所有仍在执行的任务，避免 Worker 退出后遗留子进程
     */
    private Behavior<SchedulerMessage> onPostStop(PostStop signal) {
        log.info("JobScheduler 停止，强杀 {} 个执行中的任务", executingTable.size());
        for (ExecutionHandle handle : executingTable.handles()) {
            handle.cancelToken().cancel();
        }
        return this;
    }

    /**
     * 每轮消息处理后重新调度一次
     */
    private Behavior<SchedulerMessage> afterIteration() {
        rescheduleWakeUp();
        return this;
    }

    private void rescheduleWakeUp() {
        Duration scheduleAfter = trySchedule();
        timers.startSingleTimer(WAKE_TIMER_KEY, new TimerFired(), scheduleAfter);
    }

    /**
     * 处理任务事件
     * <p>
     * - SAVE：构建调度计划并覆盖同名计划，Cron 非法直接丢弃
     * - DELETE：移除计划，不存在则忽略
     * - KILL：任务在执行中则触发取消令牌，计划保留
     */
    void handleJobEvent(JobEvent event) {
        String jobName = event.jobName();
        switch (event.type()) {
            case SAVE -> {
                SchedulePlan plan;
                try {
                    plan = SchedulePlan.build(event.job(), clock.millis(), clock.getZone());
                } catch (IllegalArgumentException e) {
                    log.warn("任务定义非法，已丢弃: jobName={}, cronExpr={}, reason={}",
                            jobName, event.job().cronExpr(), e.getMessage());
                    return;
                }
                SchedulePlan old = planTable.put(plan);
                log.info("{}调度计划: jobName={}, cronExpr={}, nextTime={}",
                        old == null ? "新增" : "更新", jobName, event.job().cronExpr(), plan.getNextTime());
            }
            case DELETE -> {
                if (planTable.remove(jobName) != null) {
                    log.info("删除调度计划: jobName={}", jobName);
                }
            }
            case KILL -> {
                ExecutionHandle handle = executingTable.get(jobName);
                if (handle != null && handle.cancelToken().cancel()) {
                    log.info("强杀任务: jobName={}, planTime={}", jobName, handle.planTime());
                }
            }
        }
    }

    /**
     * 尝试执行任务
     * <p>
     * 执行的任务可能运行很久，比如每秒调度一次但执行 1 分钟，这 1 分钟内只会执行 1 次。
     * 任务仍在执行时跳过本次调度
     */
    void tryStartJob(SchedulePlan plan, long now) {
        String jobName = plan.getJobName();
        if (executingTable.contains(jobName)) {
            skippedCount++;
            log.debug("任务尚未退出，跳过本次调度: jobName={}, planTime={}", jobName, plan.getNextTime());
            return;
        }

        ExecutionHandle handle = ExecutionHandle.of(plan.getJob(), plan.getNextTime(), now);
        executingTable.put(handle);
        dispatchedCount++;

        log.info("执行任务: jobName={}, planTime={}, scheduleTime={}", jobName, handle.planTime(), now);

        ActorRef<ExecutorMessage> executor = getContext().spawn(
                JobExecutor.create(executorContext, getContext().getSelf()),
                "job-executor-" + (++executorSeq),
                DispatcherSelector.blocking()
        );
        getContext().watchWith(executor, new ExecutorStopped(handle));
        executor.tell(new ExecutorMessage.ExecuteJob(handle));
    }

    /**
     * 重新计算任务调度状态
     * <p>
     * 1. 计划表为空，返回固定唤醒间隔
     * 2. 到期的计划尝试执行，并推进到严格晚于 now 的下一次触发时间
     * 3. 返回最近一个计划的触发时间与 now 的差值
     *
     * @return 下次唤醒间隔
     */
    Duration trySchedule() {
        if (planTable.isEmpty()) {
            return IDLE_WAKE_INTERVAL;
        }

        long now = clock.millis();
        long nearTime = Long.MAX_VALUE;

        Iterator<SchedulePlan> iterator = planTable.iterator();
        while (iterator.hasNext()) {
            SchedulePlan plan = iterator.next();
            if (plan.isDue(now)) {
                tryStartJob(plan, now);
                if (!plan.advance(now)) {
                    log.warn("Cron 表达式已无后续触发时间，移除计划: jobName={}", plan.getJobName());
                    iterator.remove();
                    continue;
                }
            }
            nearTime = Math.min(nearTime, plan.getNextTime());
        }

        if (nearTime == Long.MAX_VALUE) {
            return IDLE_WAKE_INTERVAL;
        }
        return Duration.ofMillis(Math.max(nearTime - now, 0));
    }

    /**
     * 处理任务执行结果
     * <p>
     * 无论成功失败都移除执行状态；锁被其他 Worker 占用时本机没有执行，不生成日志。
     * 结果对应的执行状态已不在执行表中时视为重复结果，直接忽略
     */
    void handleJobResult(ExecutionResult result) {
        if (executingTable.get(result.jobName()) != result.handle()) {
            log.debug("忽略重复的执行结果: jobName={}, planTime={}", result.jobName(), result.handle().planTime());
            return;
        }
        executingTable.remove(result.jobName());

        if (result.outcome() == ExecutionOutcome.LOCK_BUSY) {
            log.debug("任务锁被占用，本机未执行: jobName={}", result.jobName());
            return;
        }

        log.info("任务执行完成: jobName={}, outcome={}, elapsed={}ms",
                result.jobName(), result.outcome(), result.endTime() - result.startTime());
        logAppender.append(JobLog.from(result));
    }
}
