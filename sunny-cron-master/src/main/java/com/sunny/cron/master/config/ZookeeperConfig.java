package com.sunny.cron.master.config;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ZooKeeper 客户端配置
 *
 * @author SunnyX6
 * @date 2026-10-15
 */
@Configuration
public class ZookeeperConfig {

    private static final Logger log = LoggerFactory.getLogger(ZookeeperConfig.class);

    @Value("${sunny.cron.zookeeper.connect-string:127.0.0.1:2181}")
    private String connectString;

    @Value("${sunny.cron.zookeeper.session-timeout:5000}")
    private int sessionTimeoutMs;

    @Value("${sunny.cron.zookeeper.connection-timeout:5000}")
    private int connectionTimeoutMs;

    @Bean(initMethod = "start", destroyMethod = "close")
    public CuratorFramework curatorFramework() {
        log.info("初始化 ZooKeeper 客户端: connectString={}, sessionTimeout={}ms", connectString, sessionTimeoutMs);
        return CuratorFrameworkFactory.builder()
                .connectString(connectString)
                .sessionTimeoutMs(sessionTimeoutMs)
                .connectionTimeoutMs(connectionTimeoutMs)
                .retryPolicy(new ExponentialBackoffRetry(1000, 3))
                .build();
    }
}
