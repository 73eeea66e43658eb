package com.elssolution.insteonbridge.config;

import com.elssolution.insteonbridge.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /** Timers: mock device cycles, status summary. */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(4, threads("insteon-sched-", handler));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /**
     * Single thread that device and gateway callbacks hand off to. Library threads
     * never touch the registry directly; everything funnels through here in order.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor(threads("insteon-notify-", handler));
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

    public static ThreadFactory threads(String prefix, Thread.UncaughtExceptionHandler handler) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet()); // unique name → easier debugging/logging
            t.setDaemon(true); // don’t block JVM exit; Spring handles clean shutdown
            if (handler != null) t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
