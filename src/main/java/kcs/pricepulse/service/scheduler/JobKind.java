package kcs.pricepulse.service.scheduler;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JobKind {

    PRICE("scrape_price"),
    COMPARISON("compare_price"),
    RETENTION_SWEEP("cleanup_old_data"),
    LIVENESS_PROBE("health_check");

    private final String prefix;
}
