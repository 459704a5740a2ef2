package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.message.LogSinkMessage;
import com.sunny.cron.core.message.LogSinkMessage.AppendLog;
import com.sunny.cron.core.message.LogSinkMessage.CommitTimeout;
import com.sunny.cron.core.message.LogSinkMessage.Shutdown;
import com.sunny.cron.core.model.LogBatch;
import com.sunny.cron.worker.service.JobLogStore;
import com.sunny.cron.worker.service.LogSinkMetrics;
import com.sunny.cron.worker.service.LogSinkSettings;
import org.apache.pekko.Done;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 执行日志批量写入器（本地 Actor）
 * <p>
 * 核心优化：
 * - 日志先攒批，批次满或超时后一次批量写入，减少存储写放大
 * - 批次满：立即写入并取消超时定时器
 * - 批次超时：定时器携带批次引用，触发时仍是当前批次才写入，否则说明已被提交，直接跳过
 * <p>
 * 失败处理：
 * - 批量写入失败不重试，记录错误后丢弃该批次，避免重复写入
 * - 除 VirtualMachineError 外，存储抛出的任何异常和错误都按写入失败处理
 * <p>
 * 关闭：
 * - 收到 Shutdown 时邮箱中之前的日志已全部处理，提交剩余批次后停止
 * - 未经 Shutdown 直接停止时，PostStop 只能提交已出队的批次
 * <p>
 * 写入在本 Actor 线程上同步执行，慢写只会拖慢日志，不影响调度器
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobLogWriter extends AbstractBehavior<LogSinkMessage> {

    private static final Logger log = LoggerFactory.getLogger(JobLogWriter.class);

    private static final String COMMIT_TIMER_KEY = "log-commit";

    private final TimerScheduler<LogSinkMessage> timers;
    private final JobLogStore logStore;
    private final LogSinkSettings settings;
    private final LogSinkMetrics metrics;

    /**
     * 当前打开的批次，空闲时为 null
     */
    private LogBatch logBatch;

    public static Behavior<LogSinkMessage> create(JobLogStore logStore,
                                                  LogSinkSettings settings,
                                                  LogSinkMetrics metrics) {
        return Behaviors.setup(ctx ->
                Behaviors.withTimers(timers ->
                        new JobLogWriter(ctx, timers, logStore, settings, metrics)));
    }

    private JobLogWriter(ActorContext<LogSinkMessage> context,
                         TimerScheduler<LogSinkMessage> timers,
                         JobLogStore logStore,
                         LogSinkSettings settings,
                         LogSinkMetrics metrics) {
        super(context);
        this.timers = timers;
        this.logStore = logStore;
        this.settings = settings;
        this.metrics = metrics;

        log.info("JobLogWriter 启动: batchSize={}, commitTimeout={}ms",
                settings.batchSize(), settings.commitTimeout().toMillis());
    }

    @Override
    public Receive<LogSinkMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(AppendLog.class, this::onAppendLog)
                .onMessage(CommitTimeout.class, this::onCommitTimeout)
                .onMessage(Shutdown.class, this::onShutdown)
                .onSignal(PostStop.class, this::onPostStop)
                .build();
    }

    private Behavior<LogSinkMessage> onAppendLog(AppendLog msg) {
        metrics.onDequeued();

        if (logBatch == null) {
            logBatch = new LogBatch();
            // 让这个批次超时自动提交
            timers.startSingleTimer(COMMIT_TIMER_KEY, new CommitTimeout(logBatch), settings.commitTimeout());
        }

        logBatch.add(msg.jobLog());

        if (logBatch.size() >= settings.batchSize()) {
            LogBatch fullBatch = logBatch;
            logBatch = null;
            timers.cancel(COMMIT_TIMER_KEY);
            saveLogs(fullBatch);
        }
        return this;
    }

    private Behavior<LogSinkMessage> onCommitTimeout(CommitTimeout msg) {
        // 过期批次已被批次满提交，跳过
        if (msg.batch() != logBatch) {
            log.debug("超时批次已提交，跳过: size={}", msg.batch().size());
            return this;
        }

        LogBatch timeoutBatch = logBatch;
        logBatch = null;
        saveLogs(timeoutBatch);
        return this;
    }

    private Behavior<LogSinkMessage> onShutdown(Shutdown msg) {
        timers.cancel(COMMIT_TIMER_KEY);
        flushOpenBatch();
        log.info("JobLogWriter 已关闭: {}", metrics);
        msg.replyTo().tell(Done.getInstance());
        return Behaviors.stopped();
    }

    /**
     * 停止时提交未满的批次
     */
    private Behavior<LogSinkMessage> onPostStop(PostStop signal) {
        flushOpenBatch();
        return this;
    }

    private void flushOpenBatch() {
        if (logBatch != null) {
            log.info("JobLogWriter 停止，提交剩余 {} 条日志", logBatch.size());
            LogBatch lastBatch = logBatch;
            logBatch = null;
            saveLogs(lastBatch);
        }
    }

    private void saveLogs(LogBatch batch) {
        long startTime = System.currentTimeMillis();
        try {
            logStore.insertBatch(batch.getLogs());
            metrics.onFlushed(batch.size());

            long elapsed = System.currentTimeMillis() - startTime;
            if (elapsed > 500) {
                log.warn("日志批量写入耗时较长: count={}, elapsed={}ms", batch.size(), elapsed);
            } else {
                log.debug("日志批量写入完成: count={}, elapsed={}ms", batch.size(), elapsed);
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // 驱动缺类、代理抛出的受检异常等都只丢弃本批次，写入器继续工作
            metrics.onFlushFailed(batch.size());
            log.error("日志批量写入失败，批次已丢弃: count={}", batch.size(), e);
        }
    }
}
