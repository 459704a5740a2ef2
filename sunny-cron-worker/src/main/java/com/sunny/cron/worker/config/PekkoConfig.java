package com.sunny.cron.worker.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import jakarta.annotation.PreDestroy;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pekko ActorSystem 配置
 * <p>
 * 本地 ActorSystem，承载 JobScheduler、JobExecutor 和 JobLogWriter。
 * Dispatcher 定义在 worker.conf
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@Configuration
public class PekkoConfig {

    private static final Logger log = LoggerFactory.getLogger(PekkoConfig.class);

    private static final String ACTOR_SYSTEM_NAME = "sunny-cron-worker";

    private ActorSystem<Void> actorSystem;

    @Bean
    public ActorSystem<Void> actorSystem() {
        Config config = ConfigFactory.parseResources("worker.conf").withFallback(ConfigFactory.load());
        actorSystem = ActorSystem.create(Behaviors.empty(), ACTOR_SYSTEM_NAME, config);
        log.info("Pekko ActorSystem 启动成功: {}", actorSystem.name());
        return actorSystem;
    }

    /**
     * 关闭时 JobScheduler 强杀执行中的任务，JobLogWriter 刷出未提交的批次
     */
    @PreDestroy
    public void shutdown() {
        if (actorSystem != null) {
            log.info("关闭 Pekko ActorSystem...");
            actorSystem.terminate();
            try {
                actorSystem.getWhenTerminated().toCompletableFuture().get();
                log.info("Pekko ActorSystem 已关闭");
            } catch (Exception e) {
                log.error("等待 ActorSystem 关闭时出错", e);
            }
        }
    }
}
