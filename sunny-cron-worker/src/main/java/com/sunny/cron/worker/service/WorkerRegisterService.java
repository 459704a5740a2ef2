package com.sunny.cron.worker.service;

import com.sunny.cron.core.common.Constants;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.state.ConnectionState;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;

/**
 * Worker 注册服务
 * <p>
 * 核心逻辑：
 * 1. 启动时在 /cron/workers/{ip} 创建临时节点
 * 2. 会话断开后临时节点自动删除，Master 即认为 Worker 下线
 * 3. 重连成功后重新创建节点（会话过期时原节点已被删除）
 * 4. 关闭时主动删除节点
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
@Service
public class WorkerRegisterService {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegisterService.class);

    private final CuratorFramework client;
    private final String workerIp;
    private final ConnectionStateListener reconnectListener = this::onStateChanged;

    private volatile boolean registered = false;

    public WorkerRegisterService(CuratorFramework client,
                                 @Value("${sunny.cron.worker.ip:}") String configuredIp) {
        this.client = client;
        this.workerIp = configuredIp == null || configuredIp.isBlank() ? resolveLocalIp() : configuredIp.trim();
    }

    @PostConstruct
    public void register() {
        client.getConnectionStateListenable().addListener(reconnectListener);
        registered = createNode();
    }

    @PreDestroy
    public void unregister() {
        client.getConnectionStateListenable().removeListener(reconnectListener);
        if (!registered) {
            return;
        }
        try {
            client.delete().forPath(Constants.workerPath(workerIp));
            log.info("Worker 注销成功: ip={}", workerIp);
        } catch (KeeperException.NoNodeException e) {
            log.debug("Worker 节点已不存在: ip={}", workerIp);
        } catch (Exception e) {
            log.warn("Worker 注销失败: ip={}, error={}", workerIp, e.getMessage());
        }
        registered = false;
    }

    public String getWorkerIp() {
        return workerIp;
    }

    public boolean isRegistered() {
        return registered;
    }

    void onStateChanged(CuratorFramework c, ConnectionState newState) {
        if (newState == ConnectionState.RECONNECTED) {
            log.info("ZooKeeper 重连成功，重新注册 Worker: ip={}", workerIp);
            registered = createNode();
        } else if (newState == ConnectionState.LOST) {
            log.warn("ZooKeeper 会话丢失，Worker 节点已失效: ip={}", workerIp);
        }
    }

    private boolean createNode() {
        String path = Constants.workerPath(workerIp);
        try {
            client.create()
                    .creatingParentContainersIfNeeded()
                    .withMode(CreateMode.EPHEMERAL)
                    .forPath(path);
            log.info("Worker 注册成功: path={}", path);
            return true;
        } catch (KeeperException.NodeExistsException e) {
            log.info("Worker 节点已存在: path={}", path);
            return true;
        } catch (Exception e) {
            // 注册失败不影响调度，等待下次重连再注册
            log.error("Worker 注册失败: path={}", path, e);
            return false;
        }
    }

    /**
     * 取本机第一个非回环 IPv4 地址
     */
    static String resolveLocalIp() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces.hasMoreElements()) {
                NetworkInterface ni = interfaces.nextElement();
                if (!ni.isUp() || ni.isLoopback()) {
                    continue;
                }
                Enumeration<InetAddress> addresses = ni.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress address = addresses.nextElement();
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            throw new IllegalStateException("获取本机 IP 失败", e);
        }
        throw new IllegalStateException("没有找到可用的本机 IPv4 地址，请配置 sunny.cron.worker.ip");
    }
}
