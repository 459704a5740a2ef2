package com.sunny.cron.core.model;

import com.sunny.cron.core.common.Assert;

/**
 * 任务定义
 * <p>
 * 由 Master 以 JSON 形式保存在 /cron/jobs/{name}，Worker 只持有副本
 *
 * @param name     任务名（唯一）
 * @param command  Shell 命令
 * @param cronExpr Cron 表达式
 * @author SunnyX6
 * @date 2026-10-12
 */
public record JobDefinition(String name, String command, String cronExpr) {

    public JobDefinition {
        Assert.notBlank(name, "任务名不能为空");
    }
}
