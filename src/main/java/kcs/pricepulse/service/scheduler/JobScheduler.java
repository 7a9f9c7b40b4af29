package kcs.pricepulse.service.scheduler;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import kcs.pricepulse.config.TrackerProperties;
import kcs.pricepulse.service.ComparisonReconciler;
import kcs.pricepulse.service.PriceUpdateReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Recurring jobs keyed by {@link JobKey}.
 * <p>
 * The trigger scheduler only decides when a job is due; the body is handed to the worker
 * executor. Each key has one gate that is held while a run is in flight, so a firing that
 * finds the gate taken is skipped. Gates outlive re-scheduling of their key.
 * </p>
 */
@Slf4j
@Component
public class JobScheduler {

    private final TaskScheduler triggerScheduler;
    private final TaskExecutor workers;
    private final TrackerProperties properties;
    private final Clock clock;
    private final PriceUpdateReconciler priceUpdateReconciler;
    private final ComparisonReconciler comparisonReconciler;

    private final Map<JobKey, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Map<JobKey, AtomicBoolean> gates = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public JobScheduler(@Qualifier("jobTriggerScheduler") TaskScheduler triggerScheduler,
                        @Qualifier("scrapeJobExecutor") TaskExecutor workers,
                        TrackerProperties properties,
                        Clock clock,
                        PriceUpdateReconciler priceUpdateReconciler,
                        ComparisonReconciler comparisonReconciler) {
        this.triggerScheduler = triggerScheduler;
        this.workers = workers;
        this.properties = properties;
        this.clock = clock;
        this.priceUpdateReconciler = priceUpdateReconciler;
        this.comparisonReconciler = comparisonReconciler;
    }

    /** Price and comparison jobs of one product. Calling it again replaces both. */
    public void scheduleProduct(Long productId) {
        TrackerProperties.Jobs cfg = properties.getJobs();
        scheduleFixedRate(JobKey.price(productId),
                () -> priceUpdateReconciler.updatePrice(productId), cfg.getPricePeriod());
        scheduleFixedRate(JobKey.comparison(productId),
                () -> comparisonReconciler.updateComparison(productId), cfg.comparisonPeriod());
    }

    public void removeProduct(Long productId) {
        remove(JobKey.price(productId));
        remove(JobKey.comparison(productId));
        log.info("Removed scheduled jobs for product {}", productId);
    }

    public void scheduleFixedRate(JobKey key, Runnable body, Duration period) {
        ScheduledJob job = ScheduledJob.fixedRate(key, body, period);
        Instant first = clock.instant().plus(period);
        register(job, () -> triggerScheduler.scheduleAtFixedRate(() -> fire(job), first, period), first);
        log.info("Scheduled {} every {}", key.id(), period);
    }

    public void scheduleCron(JobKey key, Runnable body, String expression) {
        ScheduledJob job = ScheduledJob.cron(key, body, expression);
        ZonedDateTime next = job.getCron().next(ZonedDateTime.now(clock));
        Instant first = next == null ? null : next.toInstant();
        register(job, () -> triggerScheduler.schedule(() -> fire(job), new CronTrigger(expression, clock.getZone())), first);
        log.info("Scheduled {} with cron '{}'", key.id(), expression);
    }

    /**
     * Runs the job's body now on the worker pool, through the same gate as scheduled firings.
     *
     * @return false when the key is unknown or a run is already in flight
     */
    public boolean runNow(JobKey key) {
        ScheduledJob job = jobs.get(key);
        if (job == null) {
            log.warn("Job {} is not scheduled, nothing to run", key.id());
            return false;
        }
        return dispatch(job);
    }

    public boolean isScheduled(JobKey key) {
        return jobs.containsKey(key);
    }

    public int activeJobCount() {
        return jobs.size();
    }

    public SchedulerStatus status() {
        List<SchedulerStatus.JobStatus> views = new ArrayList<>();
        for (ScheduledJob job : jobs.values()) {
            JobKey key = job.getKey();
            AtomicBoolean gate = gates.get(key);
            views.add(new SchedulerStatus.JobStatus(key.id(), key.kind(), key.productId(), job.getTrigger(),
                    job.getNextFireTime(), gate != null && gate.get()));
        }
        views.sort(Comparator.comparing(SchedulerStatus.JobStatus::id));
        return new SchedulerStatus(running, views.size(), views);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        jobs.values().forEach(ScheduledJob::cancel);
        log.info("Job scheduler stopped, {} job(s) cancelled", jobs.size());
        jobs.clear();
    }

    private void register(ScheduledJob job, FutureSource source, Instant firstFire) {
        if (!running) {
            throw new IllegalStateException("job scheduler is shut down");
        }
        jobs.compute(job.getKey(), (key, previous) -> {
            if (previous != null) {
                previous.cancel();
                log.debug("Replacing job {}", key.id());
            }
            job.attach(source.schedule(), firstFire);
            return job;
        });
    }

    private void remove(JobKey key) {
        ScheduledJob job = jobs.remove(key);
        if (job != null) {
            job.cancel();
        }
        gates.computeIfPresent(key, (k, gate) -> gate.get() ? gate : null);
    }

    private void fire(ScheduledJob job) {
        if (!running || jobs.get(job.getKey()) != job) {
            return;
        }
        job.advance(clock.instant(), clock.getZone());
        dispatch(job);
    }

    private boolean dispatch(ScheduledJob job) {
        JobKey key = job.getKey();
        AtomicBoolean gate = gates.computeIfAbsent(key, k -> new AtomicBoolean());
        if (!gate.compareAndSet(false, true)) {
            log.warn("Job {} is still running, skipping this run", key.id());
            return false;
        }
        try {
            workers.execute(() -> runGuarded(job, gate));
            return true;
        } catch (TaskRejectedException e) {
            gate.set(false);
            log.warn("Job {} rejected by worker pool: {}", key.id(), e.getMessage());
            return false;
        }
    }

    private void runGuarded(ScheduledJob job, AtomicBoolean gate) {
        try {
            job.getBody().run();
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.getKey().id(), e.getMessage(), e);
        } finally {
            gate.set(false);
            // key removed while this run was in flight
            if (!jobs.containsKey(job.getKey())) {
                gates.remove(job.getKey(), gate);
            }
        }
    }

    @FunctionalInterface
    private interface FutureSource {
        ScheduledFuture<?> schedule();
    }
}
