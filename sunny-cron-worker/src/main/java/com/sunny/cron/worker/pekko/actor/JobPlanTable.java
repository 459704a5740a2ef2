package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.model.SchedulePlan;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 任务调度计划表
 * <p>
 * jobName → SchedulePlan，重复保存同名任务直接替换计划
 * <p>
 * 线程安全：
 * - 本类非线程安全，只应在 JobScheduler 的 Actor 消息处理线程中使用
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobPlanTable implements Iterable<SchedulePlan> {

    private final Map<String, SchedulePlan> plans = new HashMap<>();

    /**
     * 保存计划
     *
     * @return 被替换的旧计划，没有则返回 null
     */
    public SchedulePlan put(SchedulePlan plan) {
        return plans.put(plan.getJobName(), plan);
    }

    /**
     * 移除计划
     *
     * @return 被移除的计划，不存在返回 null
     */
    public SchedulePlan remove(String jobName) {
        return plans.remove(jobName);
    }

    public SchedulePlan get(String jobName) {
        return plans.get(jobName);
    }

    public boolean isEmpty() {
        return plans.isEmpty();
    }

    public int size() {
        return plans.size();
    }

    /**
     * 遍历计划，支持 Iterator.remove
     */
    @Override
    public Iterator<SchedulePlan> iterator() {
        return plans.values().iterator();
    }
}
