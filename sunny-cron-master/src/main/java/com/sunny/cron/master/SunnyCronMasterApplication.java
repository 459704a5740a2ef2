package com.sunny.cron.master;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sunny Cron Master 启动类
 * <p>
 * Master 职责：
 * - 维护 ZooKeeper 中的任务定义（保存、删除、列表）
 * - 下发强杀通知
 * - 查询在线 Worker
 * <p>
 * Master 不参与调度，所有调度由 Worker 本地完成
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@SpringBootApplication
public class SunnyCronMasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SunnyCronMasterApplication.class, args);
    }
}
