package com.sunny.cron.worker.service;

import com.sunny.cron.core.common.Assert;

import java.time.Duration;

/**
 * 日志批量写入配置
 *
 * @param batchSize     批次大小，达到即写入
 * @param commitTimeout 批次超时自动提交时间
 * @param queueCapacity 待写入日志队列容量，超出丢弃
 * @author SunnyX6
 * @date 2026-10-13
 */
public record LogSinkSettings(int batchSize, Duration commitTimeout, int queueCapacity) {

    public LogSinkSettings {
        Assert.positive(batchSize, "batchSize 必须大于 0");
        Assert.notNull(commitTimeout, "commitTimeout 不能为空");
        Assert.isTrue(!commitTimeout.isNegative() && !commitTimeout.isZero(), "commitTimeout 必须大于 0");
        Assert.positive(queueCapacity, "queueCapacity 必须大于 0");
    }
}
