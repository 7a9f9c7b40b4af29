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
import kcs.pricepulse.service.crawler.MatchedListing;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "price_comparison",
        indexes = {
                @Index(name = "idx_comparison_product", columnList = "product_id")
        }
)
public class ComparisonResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "comparison_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private TrackedProduct product;

    @Column(name = "platform", length = 50, nullable = false)
    private String platform;

    @Column(name = "found_name", length = 1000, nullable = false)
    private String foundName;

    @Column(name = "found_price", nullable = false)
    private long foundPrice;

    @Column(name = "found_url", length = 1000, nullable = false)
    private String foundUrl;

    @Column(name = "match_score", nullable = false)
    private double matchScore;

    @Column(name = "last_checked", nullable = false)
    private LocalDateTime lastChecked;

    public static ComparisonResult of(TrackedProduct product, MatchedListing match, LocalDateTime checkedAt) {
        ComparisonResult result = new ComparisonResult();
        result.product = product;
        result.platform = match.platform();
        result.foundName = match.name();
        result.foundPrice = match.price();
        result.foundUrl = match.url();
        result.matchScore = match.score();
        result.lastChecked = checkedAt;
        return result;
    }
}
