package com.sunny.cron.worker.pekko.actor;

import com.sunny.cron.core.message.SchedulerMessage;
import com.sunny.cron.core.message.SchedulerStatus;
import com.sunny.cron.core.model.JobEvent;
import com.sunny.cron.worker.service.JobEventPublisher;
import com.sunny.cron.worker.service.JobLogAppender;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * JobScheduler 管理器
 * <p>
 * 创建本地 JobScheduler Actor，并作为外部组件（watcher、状态上报）访问调度器的唯一入口
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class JobSchedulerManager implements JobEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerManager.class);

    static final String SCHEDULER_DISPATCHER = "sunny-cron.job-scheduler-dispatcher";

    private final ActorSystem<Void> actorSystem;
    private final ActorRef<SchedulerMessage> scheduler;

    /**
     * 创建调度管理器
     *
     * @param actorSystem     Actor 系统
     * @param clock           时钟
     * @param executorContext 执行上下文
     * @param logAppender     执行日志投递入口
     */
    public JobSchedulerManager(ActorSystem<Void> actorSystem,
                               Clock clock,
                               JobExecutorContext executorContext,
                               JobLogAppender logAppender) {
        this.actorSystem = actorSystem;
        this.scheduler = actorSystem.systemActorOf(
                JobScheduler.create(clock, executorContext, logAppender),
                "job-scheduler",
                DispatcherSelector.fromConfig(SCHEDULER_DISPATCHER)
        );
        log.info("JobSchedulerManager 初始化完成");
    }

    /**
     * 推送任务变化事件
     */
    @Override
    public void publish(JobEvent event) {
        scheduler.tell(new SchedulerMessage.JobEventReceived(event));
    }

    /**
     * 查询调度器状态
     */
    public CompletionStage<SchedulerStatus> queryStatus(Duration timeout) {
        return AskPattern.ask(
                scheduler,
                SchedulerMessage.QueryStatus::new,
                timeout,
                actorSystem.scheduler()
        );
    }
}
