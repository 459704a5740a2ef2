package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.model.ExecutionHandle;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 任务执行表
 * <p>
 * jobName → ExecutionHandle，一个任务名同一时刻最多一条记录，
 * 记录存在即表示任务仍在执行，用于阻止重复分发
 * <p>
 * 线程安全：
 * - 本类非线程安全，只应在 JobScheduler 的 Actor 消息处理线程中使用
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobExecutingTable {

    private final Map<String, ExecutionHandle> executing = new HashMap<>();

    public boolean contains(String jobName) {
        return executing.containsKey(jobName);
    }

    public ExecutionHandle get(String jobName) {
        return executing.get(jobName);
    }

    /**
     * 记录执行状态
     *
     * @throws IllegalStateException 该任务已有执行记录
     */
    public void put(ExecutionHandle handle) {
        Assert.state(!executing.containsKey(handle.jobName()), "任务已在执行中: " + handle.jobName());
        executing.put(handle.jobName(), handle);
    }

    public ExecutionHandle remove(String jobName) {
        return executing.remove(jobName);
    }

    public Set<String> jobNames() {
        return Set.copyOf(executing.keySet());
    }

    public Collection<ExecutionHandle> handles() {
        return executing.values();
    }

    public int size() {
        return executing.size();
    }
}
