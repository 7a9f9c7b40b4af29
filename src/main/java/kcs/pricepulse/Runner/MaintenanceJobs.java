package kcs.pricepulse.Runner;

import kcs.pricepulse.config.TrackerProperties;
import kcs.pricepulse.service.PriceHistoryService;
import kcs.pricepulse.service.scheduler.JobKey;
import kcs.pricepulse.service.scheduler.JobKind;
import kcs.pricepulse.service.scheduler.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceJobs {

    private final PriceHistoryService priceHistoryService;
    private final JobScheduler jobScheduler;
    private final TrackerProperties properties;

    public void register() {
        TrackerProperties.Jobs jobs = properties.getJobs();
        // daily at midnight by default
        jobScheduler.scheduleCron(JobKey.global(JobKind.RETENTION_SWEEP), this::purgeOldHistory, jobs.getRetentionCron());
        jobScheduler.scheduleFixedRate(JobKey.global(JobKind.LIVENESS_PROBE), this::healthCheck, jobs.getLivenessPeriod());
    }

    public int purgeOldHistory() {
        // price points older than the retention window are dropped
        return priceHistoryService.purgeOldPricePoints(properties.getJobs().getRetentionDays());
    }

    public void healthCheck() {
        log.info("Scheduler health check - active jobs: {}", jobScheduler.activeJobCount());
    }
}
