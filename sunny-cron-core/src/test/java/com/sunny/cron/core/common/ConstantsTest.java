package com.sunny.cron.core.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Constants 路径工具测试
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class ConstantsTest {

    @Test
    public void extractNamesFromKeys() {
        assertEquals("192.168.1.1", Constants.extractWorkerIp("/cron/workers/192.168.1.1"));
        assertEquals("job10", Constants.extractJobName(Constants.jobPath("job10")));
        assertEquals("job10", Constants.extractKillerName(Constants.killerPath("job10")));
        assertEquals("/cron/lock/job10", Constants.lockPath("job10"));
    }
}
