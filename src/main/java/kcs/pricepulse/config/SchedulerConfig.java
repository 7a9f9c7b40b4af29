package kcs.pricepulse.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * One trigger thread decides when jobs fire; the job bodies (browser scrapes) run on the
 * worker pool so a slow page never holds up the trigger loop.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler jobTriggerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("job-trigger-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor scrapeJobExecutor(TrackerProperties properties) {
        TrackerProperties.Workers workers = properties.getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getCorePoolSize());
        executor.setMaxPoolSize(workers.getMaxPoolSize());
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("scrape-job-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(workers.getAwaitTerminationSeconds());
        return executor;
    }
}
