package kcs.pricepulse.controller;

import java.time.LocalDateTime;
import kcs.pricepulse.entity.PricePoint;

public record PricePointResponse(Long id, long price, String platform, LocalDateTime recordedAt) {

    static PricePointResponse from(PricePoint point) {
        return new PricePointResponse(point.getId(), point.getPrice(), point.getPlatform(), point.getRecordedAt());
    }
}
