package com.sunny.cron.core.message;

import com.sunny.cron.core.model.JobLog;
import com.sunny.cron.core.model.LogBatch;
import org.apache.pekko.Done;
import org.apache.pekko.actor.typed.ActorRef;

/**
 * 日志写入器消息协议
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public sealed interface LogSinkMessage {

    /**
     * 追加一条日志
     *
     * @param jobLog 执行日志
     */
    record AppendLog(JobLog jobLog) implements LogSinkMessage {}

    /**
     * 批次超时提交
     * <p>
     * 内部消息：携带打开定时器时的批次引用，触发时与当前批次比较身份
     *
     * @param batch 定时器所属批次
     */
    record CommitTimeout(LogBatch batch) implements LogSinkMessage {}

    /**
     * 关闭写入器
     * <p>
     * 与 AppendLog 走同一个邮箱，之前投递的日志全部处理完后才会处理本消息；
     * 提交剩余批次后应答 Done 并停止
     *
     * @param replyTo 应答地址
     */
    record Shutdown(ActorRef<Done> replyTo) implements LogSinkMessage {}
}
