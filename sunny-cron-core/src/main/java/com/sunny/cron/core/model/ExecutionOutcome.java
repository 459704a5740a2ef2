package com.sunny.cron.core.model;

/**
 * 执行结果类型
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public enum ExecutionOutcome {

    SUCCESS("成功"),
    FAILURE("失败"),
    /**
     * 任务锁被其他 Worker 持有，本机未执行
     */
    LOCK_BUSY("锁已被占用");

    private final String desc;

    ExecutionOutcome(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
