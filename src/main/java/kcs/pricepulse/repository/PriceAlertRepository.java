package kcs.pricepulse.repository;

import java.util.List;
import java.util.Optional;
import kcs.pricepulse.entity.PriceAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PriceAlertRepository extends JpaRepository<PriceAlert, Long> {

    /** Active, not yet triggered alerts whose target the given price has reached. */
    @Query("select a from PriceAlert a "
            + "where a.product.id = :productId and a.active = true and a.triggered = false "
            + "and a.targetPrice >= :price order by a.id")
    List<PriceAlert> findTriggerable(@Param("productId") Long productId, @Param("price") long price);

    boolean existsByUserIdAndProduct_IdAndTargetPrice(String userId, Long productId, long targetPrice);

    Optional<PriceAlert> findByIdAndUserId(Long id, String userId);

    List<PriceAlert> findByUserIdOrderByIdDesc(String userId);

    List<PriceAlert> findByProduct_IdAndUserIdOrderByIdDesc(Long productId, String userId);

    @Modifying(flushAutomatically = true)
    @Query("delete from PriceAlert a where a.product.id = :productId")
    int deleteByProductId(@Param("productId") Long productId);
}
