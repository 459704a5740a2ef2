package com.sunny.cron.core.model;

/**
 * 任务变化事件类型
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public enum JobEventType {

    SAVE(1, "保存"),
    DELETE(2, "删除"),
    KILL(3, "强杀");

    private final int code;
    private final String desc;

    JobEventType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
