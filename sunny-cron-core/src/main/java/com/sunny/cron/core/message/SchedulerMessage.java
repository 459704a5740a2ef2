package com.sunny.cron.core.message;

import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionResult;
import com.sunny.cron.core.model.JobEvent;
import org.apache.pekko.actor.typed.ActorRef;

/**
 * 调度器消息协议
 * <p>
 * 定义 JobScheduler（每个 Worker 一个本地 Actor）接收的所有消息类型。
 * 任务事件、定时唤醒、执行结果三路输入都进入同一个邮箱，按到达顺序串行处理
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public sealed interface SchedulerMessage {

    /**
     * 任务变化事件
     * <p>
     * 来源：JobWatcherService 监听协调存储
     *
     * @param event 任务事件
     */
    record JobEventReceived(JobEvent event) implements SchedulerMessage {}

    /**
     * 定时器触发
     * <p>
     * 内部消息：最近一个计划到期（或空表兜底间隔到期）
     */
    record TimerFired() implements SchedulerMessage {}

    /**
     * 任务执行结果
     * <p>
     * 来源：JobExecutor 执行完成后回传，每个分发恰好一次
     *
     * @param result 执行结果
     */
    record JobResultReceived(ExecutionResult result) implements SchedulerMessage {}

    /**
     * 执行器已终止
     * <p>
     * 来源：JobScheduler 对每个 JobExecutor 的 watchWith 通知。
     * 执行器未回传结果就终止时，由调度器补记 FAILURE 并清理执行表
     *
     * @param handle 该执行器负责的执行状态
     */
    record ExecutorStopped(ExecutionHandle handle) implements SchedulerMessage {}

    /**
     * 查询调度器状态
     *
     * @param replyTo 应答地址
     */
    record QueryStatus(ActorRef<SchedulerStatus> replyTo) implements SchedulerMessage {}
}
