package kcs.pricepulse.Runner;

import java.util.List;
import kcs.pricepulse.repository.TrackedProductRepository;
import kcs.pricepulse.service.scheduler.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Jobs live in memory only, so every tracked product is scheduled again on startup. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobBootstrapRunner implements ApplicationRunner {

    private final TrackedProductRepository productRepository;
    private final JobScheduler jobScheduler;
    private final MaintenanceJobs maintenanceJobs;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Registering scheduled jobs");
        maintenanceJobs.register();
        List<Long> productIds = productRepository.findAllIds();
        productIds.forEach(jobScheduler::scheduleProduct);
        log.info("Scheduled jobs ready: products={}, activeJobs={}", productIds.size(), jobScheduler.activeJobCount());
    }
}
