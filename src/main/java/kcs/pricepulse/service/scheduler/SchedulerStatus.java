package kcs.pricepulse.service.scheduler;

import java.time.Instant;
import java.util.List;

public record SchedulerStatus(boolean running, int activeJobCount, List<JobStatus> jobs) {

    public record JobStatus(String id, JobKind kind, Long productId, String trigger, Instant nextRun, boolean inFlight) {
    }
}
