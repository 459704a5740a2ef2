package com.sunny.cron.worker;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sunny Cron Worker 启动类
 * <p>
 * Worker 职责：
 * - 监听 ZooKeeper 中的任务定义和强杀通知
 * - 本地 JobScheduler 按 Cron 调度，抢到分布式锁的 Worker 执行
 * - 执行日志批量写入 MySQL
 * - 以临时节点注册自己，供 Master 查询
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.sunny.cron.worker.domain.mapper")
public class SunnyCronWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SunnyCronWorkerApplication.class, args);
    }
}
