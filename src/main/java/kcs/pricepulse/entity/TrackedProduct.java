package kcs.pricepulse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import kcs.pricepulse.entity.common.BaseTimeEntity;
import kcs.pricepulse.service.crawler.ScrapedProduct;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "tracked_product",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_product_url", columnNames = {"url"})
        },
        indexes = {
                @Index(name = "idx_product_platform", columnList = "platform")
        }
)
public class TrackedProduct extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long id;

    @Column(name = "platform", length = 50, nullable = false)
    private String platform;

    @Column(name = "url", length = 700, nullable = false)
    private String url;

    @Column(name = "name", length = 1000, nullable = false)
    private String name;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @Column(name = "brand", length = 200)
    private String brand;

    @Column(name = "model", length = 100)
    private String model;

    /** Minor units (paise, cents). */
    @Column(name = "current_price", nullable = false)
    private long currentPrice;

    @Column(name = "last_checked_at")
    private LocalDateTime lastCheckedAt;

    public static TrackedProduct create(String url, ScrapedProduct scraped, LocalDateTime checkedAt) {
        TrackedProduct product = new TrackedProduct();
        product.url = url;
        product.platform = scraped.platform();
        product.name = scraped.name();
        product.imageUrl = scraped.imageUrl();
        product.brand = scraped.brand();
        product.model = scraped.model();
        product.currentPrice = scraped.price();
        product.lastCheckedAt = checkedAt;
        return product;
    }

    public void updatePrice(long price, LocalDateTime checkedAt) {
        this.currentPrice = price;
        this.lastCheckedAt = checkedAt;
    }
}
