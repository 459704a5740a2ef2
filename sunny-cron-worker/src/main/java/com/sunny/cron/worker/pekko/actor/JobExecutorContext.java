package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionResult;

/**
 * JobExecutor 上下文接口
 * <p>
 * 解耦 Executor Actor 与分布式锁、进程执行逻辑
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public interface JobExecutorContext {

    /**
     * 同步执行任务（在阻塞 Dispatcher 上调用）
     * <p>
     * 约定：
     * - 未抢到任务锁返回 LOCK_BUSY
     * - 执行失败以 FAILURE 结果返回，不抛异常
     * - 监听 handle 的取消令牌，强杀时尽快结束
     *
     * @param handle 执行状态
     * @return 执行结果
     */
    ExecutionResult execute(ExecutionHandle handle);
}
