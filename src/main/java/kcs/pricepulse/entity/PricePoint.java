package kcs.pricepulse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Append-only price observation. */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "price_history",
        indexes = {
                @Index(name = "idx_history_product_recorded", columnList = "product_id, recorded_at"),
                @Index(name = "idx_history_recorded", columnList = "recorded_at")
        }
)
public class PricePoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "price_history_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private TrackedProduct product;

    @Column(name = "price", nullable = false)
    private long price;

    @Column(name = "platform", length = 50, nullable = false)
    private String platform;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    public static PricePoint record(TrackedProduct product, long price, LocalDateTime recordedAt) {
        if (price < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
        PricePoint point = new PricePoint();
        point.product = product;
        point.price = price;
        point.platform = product.getPlatform();
        point.recordedAt = recordedAt;
        return point;
    }
}
