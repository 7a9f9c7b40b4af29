package kcs.pricepulse.service.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

/** One registered recurrence. Replaced wholesale when its key is scheduled again. */
@Getter
class ScheduledJob {

    private final JobKey key;
    private final Runnable body;
    private final Duration period;
    private final CronExpression cron;
    private final String trigger;
    private volatile ScheduledFuture<?> future;
    private volatile Instant nextFireTime;

    private ScheduledJob(JobKey key, Runnable body, Duration period, CronExpression cron, String trigger) {
        this.key = key;
        this.body = body;
        this.period = period;
        this.cron = cron;
        this.trigger = trigger;
    }

    static ScheduledJob fixedRate(JobKey key, Runnable body, Duration period) {
        return new ScheduledJob(key, body, period, null, "interval[" + period + "]");
    }

    static ScheduledJob cron(JobKey key, Runnable body, String expression) {
        return new ScheduledJob(key, body, null, CronExpression.parse(expression), "cron[" + expression + "]");
    }

    void attach(ScheduledFuture<?> future, Instant firstFire) {
        this.future = future;
        this.nextFireTime = firstFire;
    }

    /** Moves {@link #nextFireTime} past {@code firedAt}. */
    void advance(Instant firedAt, ZoneId zone) {
        if (period != null) {
            nextFireTime = firedAt.plus(period);
        } else {
            ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(firedAt, zone));
            nextFireTime = next == null ? null : next.toInstant();
        }
    }

    void cancel() {
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }
}
