package com.sunny.cron.worker.service;

import com.sunny.cron.core.message.LogSinkMessage;
import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.worker.pekko.actor.JobLogWriter;
import org.apache.pekko.Done;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.Scheduler;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 执行日志投递服务
 * <p>
 * 调度器投递日志的入口，背后是 JobLogWriter 批量写入：
 * - 队列有界，满了直接丢弃，调度器永远不会因日志写入而阻塞
 * - 丢弃数量记入 LogSinkMetrics，按间隔打印告警
 * - 关闭时投递 Shutdown 并等待写入器把队列中的日志全部提交，此后的投递直接丢弃
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobLogSink implements JobLogAppender {

    private static final Logger log = LoggerFactory.getLogger(JobLogSink.class);

    static final String WRITER_DISPATCHER = "sunny-cron.log-writer-dispatcher";

    /**
     * 丢弃告警打印间隔（条）
     */
    private static final long DROP_WARN_INTERVAL = 1000;

    /**
     * 等待写入器提交剩余日志的超时时间
     */
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final ActorRef<LogSinkMessage> writer;
    private final int queueCapacity;
    private final LogSinkMetrics metrics;
    private final Scheduler scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JobLogSink(ActorRef<LogSinkMessage> writer, int queueCapacity, LogSinkMetrics metrics,
                      Scheduler scheduler) {
        this.writer = writer;
        this.queueCapacity = queueCapacity;
        this.metrics = metrics;
        this.scheduler = scheduler;
    }

    /**
     * 启动日志写入器
     */
    public static JobLogSink start(ActorSystem<Void> actorSystem, JobLogStore logStore, LogSinkSettings settings) {
        LogSinkMetrics metrics = new LogSinkMetrics();
        ActorRef<LogSinkMessage> writer = actorSystem.systemActorOf(
                JobLogWriter.create(logStore, settings, metrics),
                "job-log-writer",
                DispatcherSelector.fromConfig(WRITER_DISPATCHER)
        );
        log.info("JobLogSink 启动: queueCapacity={}", settings.queueCapacity());
        return new JobLogSink(writer, settings.queueCapacity(), metrics, actorSystem.scheduler());
    }

    @Override
    public boolean append(JobLog jobLog) {
        if (closed.get()) {
            metrics.onDropped();
            log.warn("JobLogSink 已关闭，丢弃日志: jobName={}", jobLog.jobName());
            return false;
        }
        if (!metrics.tryEnqueue(queueCapacity)) {
            long dropped = metrics.onDropped();
            if (dropped == 1 || dropped % DROP_WARN_INTERVAL == 0) {
                log.warn("日志队列已满，丢弃日志: jobName={}, 累计丢弃={}", jobLog.jobName(), dropped);
            }
            return false;
        }
        writer.tell(new LogSinkMessage.AppendLog(jobLog));
        return true;
    }

    /**
     * 关闭日志写入器（Spring 销毁时调用，早于 ActorSystem 终止）
     */
    public void shutdown() {
        shutdown(SHUTDOWN_TIMEOUT);
    }

    /**
     * 关闭日志写入器
     * <p>
     * 阻塞等待写入器处理完 Shutdown 之前投递的全部日志，超时只记录告警
     *
     * @param timeout 等待超时时间
     */
    public void shutdown(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("JobLogSink 关闭中: pending={}", metrics.getPending());
        try {
            AskPattern.<LogSinkMessage, Done>ask(writer, LogSinkMessage.Shutdown::new, timeout, scheduler)
                    .toCompletableFuture()
                    .get();
            log.info("JobLogSink 已关闭: {}", metrics);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待日志写入器关闭被中断: pending={}", metrics.getPending());
        } catch (ExecutionException e) {
            log.warn("等待日志写入器关闭失败: pending={}", metrics.getPending(), e.getCause());
        }
    }

    public LogSinkMetrics getMetrics() {
        return metrics;
    }
}
