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
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A user's "tell me when it drops to X" request. Fires at most once: {@code triggered} only
 * ever goes from false to true, and {@code triggeredAt} is written in that same step.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "price_alert",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_alert_user_product_target",
                        columnNames = {"user_id", "product_id", "target_price"})
        },
        indexes = {
                @Index(name = "idx_alert_product_state", columnList = "product_id, active, triggered")
        }
)
public class PriceAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "alert_id")
    private Long id;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "user_email", length = 320, nullable = false)
    private String userEmail;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private TrackedProduct product;

    @Column(name = "target_price", nullable = false)
    private long targetPrice;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "triggered", nullable = false)
    private boolean triggered;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "triggered_at")
    private LocalDateTime triggeredAt;

    @Version
    private Long version;

    public static PriceAlert create(String userId, String userEmail, TrackedProduct product,
                                    long targetPrice, LocalDateTime now) {
        if (targetPrice <= 0) {
            throw new IllegalArgumentException("target price must be positive: " + targetPrice);
        }
        PriceAlert alert = new PriceAlert();
        alert.userId = userId;
        alert.userEmail = userEmail;
        alert.product = product;
        alert.targetPrice = targetPrice;
        alert.active = true;
        alert.triggered = false;
        alert.createdAt = now;
        return alert;
    }

    /**
     * @return true if this call triggered the alert, false if it had already fired or is inactive
     */
    public boolean trigger(LocalDateTime now) {
        if (triggered || !active) {
            return false;
        }
        this.triggered = true;
        this.triggeredAt = now;
        return true;
    }
}
