package com.sunny.cron.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次性取消令牌
 * <p>
 * 调度器通过 {@link #cancel()} 发起强杀，执行器通过 {@link #onCancel(Runnable)} 注册终止动作：
 * <ul>
 *     <li>cancel 最多生效一次，重复调用返回 false</li>
 *     <li>执行结束后 {@link #complete()}，此后 cancel 不再有任何效果</li>
 *     <li>取消之后注册的回调立即执行</li>
 * </ul>
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public final class CancelToken {

    private static final Logger log = LoggerFactory.getLogger(CancelToken.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;
    private boolean completed;

    /**
     * 发起取消
     *
     * @return true 本次调用触发了取消
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled || completed) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancelToken::runCallback);
        return true;
    }

    /**
     * 注册取消回调
     */
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (completed) {
                return;
            }
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    /**
     * 标记执行结束，丢弃尚未触发的回调
     */
    public synchronized void complete() {
        completed = true;
        callbacks.clear();
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("取消回调执行失败", e);
        }
    }
}
