package kcs.pricepulse.controller;

import java.time.LocalDateTime;
import kcs.pricepulse.entity.PriceAlert;

public record AlertResponse(
        Long id,
        String userId,
        Long productId,
        long targetPrice,
        boolean active,
        boolean triggered,
        LocalDateTime createdAt,
        LocalDateTime triggeredAt) {

    static AlertResponse from(PriceAlert alert) {
        return new AlertResponse(alert.getId(), alert.getUserId(), alert.getProduct().getId(), alert.getTargetPrice(),
                alert.isActive(), alert.isTriggered(), alert.getCreatedAt(), alert.getTriggeredAt());
    }
}
