package com.sunny.cron.worker.pekko.actor.impl;

import com.sunny.cron.core.model.CancelToken;
import com.sunny.cron.core.model.ExecutionHandle;
import com.sunny.cron.core.model.ExecutionResult;
import com.sunny.cron.worker.lock.JobLock;
import com.sunny.cron.worker.lock.JobLockException;
import com.sunny.cron.worker.lock.JobLockFactory;
import com.sunny.cron.worker.pekko.actor.JobExecutorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Shell 命令执行上下文
 * <p>
 * 执行流程：
 * 1. 抢分布式锁，锁被占用返回 LOCK_BUSY，锁服务异常返回 FAILURE
 * 2. 以 {shell} -c {command} 启动子进程，stdout 与 stderr 合并收集
 * 3. 强杀时销毁子进程及其后代进程
 * 4. 无论结果如何都释放锁
 *
 * @author SunnyX6
 * @date 2026-10-14
 */
public class ShellJobExecutorContext implements JobExecutorContext {

    private static final Logger log = LoggerFactory.getLogger(ShellJobExecutorContext.class);

    static final String KILLED_ERROR = "任务被强杀";

    private final JobLockFactory lockFactory;
    private final String shell;
    private final Clock clock;

    public ShellJobExecutorContext(JobLockFactory lockFactory, String shell, Clock clock) {
        this.lockFactory = lockFactory;
        this.shell = shell;
        this.clock = clock;
    }

    @Override
    public ExecutionResult execute(ExecutionHandle handle) {
        long startTime = clock.millis();
        JobLock lock = lockFactory.createLock(handle.jobName());

        boolean locked;
        try {
            locked = lock.tryLock();
        } catch (JobLockException e) {
            log.error("任务加锁异常: jobName={}", handle.jobName(), e);
            return ExecutionResult.failure(handle, null, e.getMessage(), startTime, clock.millis());
        }
        if (!locked) {
            return ExecutionResult.lockBusy(handle, startTime, clock.millis());
        }

        try {
            // 抢锁耗时不计入执行时间
            return runCommand(handle, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    private ExecutionResult runCommand(ExecutionHandle handle, long startTime) {
        CancelToken cancelToken = handle.cancelToken();
        if (cancelToken.isCancelled()) {
            return ExecutionResult.failure(handle, null, KILLED_ERROR, startTime, clock.millis());
        }

        Process process;
        try {
            process = new ProcessBuilder(shell, "-c", handle.job().command())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("任务进程启动失败: jobName={}, shell={}", handle.jobName(), shell, e);
            return ExecutionResult.failure(handle, null, "进程启动失败: " + e.getMessage(), startTime, clock.millis());
        }
        cancelToken.onCancel(() -> destroyProcessTree(process));

        byte[] output;
        int exitCode;
        try {
            output = process.getInputStream().readAllBytes();
            exitCode = process.waitFor();
        } catch (IOException e) {
            destroyProcessTree(process);
            return ExecutionResult.failure(handle, null, "读取任务输出失败: " + e.getMessage(), startTime, clock.millis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcessTree(process);
            return ExecutionResult.failure(handle, null, "任务执行被中断", startTime, clock.millis());
        }

        long endTime = clock.millis();
        if (cancelToken.isCancelled()) {
            return ExecutionResult.failure(handle, output, KILLED_ERROR, startTime, endTime);
        }
        if (exitCode != 0) {
            return ExecutionResult.failure(handle, output, "exit status " + exitCode, startTime, endTime);
        }
        return ExecutionResult.success(handle, output, startTime, endTime);
    }

    /**
     * 后代进程持有输出管道时，只杀父进程会导致读取一直阻塞
     */
    private static void destroyProcessTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
