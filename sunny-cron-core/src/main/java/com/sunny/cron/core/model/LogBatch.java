package com.sunny.cron.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 日志批次
 * <p>
 * 以对象引用作为批次身份，超时提交时用 == 判断是否仍是当前批次，故不覆写 equals/hashCode
 *
 * @author SunnyX6
 * @date 2026-10-12
 */
public final class LogBatch {

    private final List<JobLog> logs = new ArrayList<>();

    public void add(JobLog jobLog) {
        logs.add(jobLog);
    }

    public int size() {
        return logs.size();
    }

    public List<JobLog> getLogs() {
        return logs;
    }
}
