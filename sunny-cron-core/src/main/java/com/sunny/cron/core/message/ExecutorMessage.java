package com.sunny.cron.core.message;

import com.sunny.cron.core.model.ExecutionHandle;

/**
 * 执行器消息协议
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public sealed interface ExecutorMessage {

    /**
     * 执行任务命令
     * <p>
     * 来源：JobScheduler 分发任务时发送；强杀通过 handle 上的取消令牌完成，不走消息
     *
     * @param handle 执行状态
     */
    record ExecuteJob(ExecutionHandle handle) implements ExecutorMessage {}
}
