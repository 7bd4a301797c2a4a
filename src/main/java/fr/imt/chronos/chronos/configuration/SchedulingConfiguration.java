package fr.imt.chronos.chronos.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulingConfiguration {

    public static final String TIMER_SCHEDULER = "triggerTaskScheduler";
    public static final String WORKER_EXECUTOR = "jobWorkerExecutor";

    @Bean
    public Clock clock(SchedulerProperties properties) {
        return Clock.system(properties.getZone());
    }

    @Bean(name = TIMER_SCHEDULER)
    public ThreadPoolTaskScheduler triggerTaskScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("chronos-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor jobWorkerExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setThreadNamePrefix("chronos-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
