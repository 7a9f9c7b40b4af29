package kcs.pricepulse.controller;

import java.time.LocalDateTime;
import kcs.pricepulse.entity.ComparisonResult;

public record ComparisonResponse(
        String platform,
        String name,
        long price,
        String url,
        double matchScore,
        LocalDateTime lastChecked) {

    static ComparisonResponse from(ComparisonResult result) {
        return new ComparisonResponse(result.getPlatform(), result.getFoundName(), result.getFoundPrice(),
                result.getFoundUrl(), result.getMatchScore(), result.getLastChecked());
    }
}
