package com.elssolution.ammeterlab.config;

import com.elssolution.ammeterlab.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    @Value("${lab.scheduler.threads:4}")     private int schedulerThreads;
    @Value("${lab.scheduler.pollThreads:6}") private int pollThreads;
    @Value("${lab.scheduler.campaignThreads:4}") private int campaignThreads;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /** Housekeeping: status summary. */
    @Primary
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(Math.max(1, schedulerThreads), namedDaemon("lab-sched-"));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /** One task per device per sampling round; sized so all three devices poll in parallel. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pollingExecutor() {
        int n = Math.max(1, pollThreads);
        ThreadPoolExecutor ex = new ThreadPoolExecutor(n, n, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedDaemon("lab-poll-"));
        ex.allowCoreThreadTimeOut(true);
        log.info("Polling pool ready: {} threads", n);
        return ex;
    }

    /** Async campaigns hold a thread for their whole run; no queue, extra submissions are rejected. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService campaignExecutor() {
        int n = Math.max(1, campaignThreads);
        ThreadPoolExecutor ex = new ThreadPoolExecutor(n, n, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(), namedDaemon("lab-campaign-"));
        ex.allowCoreThreadTimeOut(true);
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

    private ThreadFactory namedDaemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
