package com.sunny.cron.core.cron;

import com.sunny.cron.core.common.Assert;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron 工具类
 * <p>
 * 基于 Spring CronExpression 实现，支持：
 * <ul>
 *     <li>6 位秒级表达式：秒 分 时 日 月 周</li>
 *     <li>5 位分钟级表达式：自动补齐秒位为 0</li>
 *     <li>宏：@yearly @monthly @weekly @daily @hourly</li>
 * </ul>
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public final class CronUtils {

    private CronUtils() {
    }

    /**
     * 解析 Cron 表达式
     *
     * @param cronExpr Cron 表达式
     * @return 解析结果
     * @throws IllegalArgumentException 表达式非法
     */
    public static CronExpression parse(String cronExpr) {
        Assert.notBlank(cronExpr, "Cron 表达式不能为空");
        return CronExpression.parse(normalize(cronExpr));
    }

    /**
     * 计算下一次触发时间（严格晚于 fromMs）
     *
     * @param cron   Cron 表达式
     * @param fromMs 起始时间 (毫秒)
     * @param zoneId 时区
     * @return 下一次触发时间 (毫秒)，-1 表示不存在
     */
    public static long nextTriggerTime(CronExpression cron, long fromMs, ZoneId zoneId) {
        ZonedDateTime from = ZonedDateTime.ofInstant(Instant.ofEpochMilli(fromMs), zoneId);
        ZonedDateTime next = cron.next(from);
        if (next == null) {
            return -1;
        }
        return next.toInstant().toEpochMilli();
    }

    /**
     * 验证 Cron 表达式是否有效
     *
     * @param cronExpr Cron 表达式
     * @return true 有效，false 无效
     */
    public static boolean isValidCron(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            return false;
        }
        try {
            parse(cronExpr);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * 5 位表达式补齐秒位
     */
    static String normalize(String cronExpr) {
        String expr = cronExpr.trim();
        if (expr.startsWith("@")) {
            return expr;
        }
        String[] fields = expr.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        return expr;
    }
}
