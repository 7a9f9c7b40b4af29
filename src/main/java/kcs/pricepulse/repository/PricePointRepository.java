package kcs.pricepulse.repository;

import java.time.LocalDateTime;
import kcs.pricepulse.entity.PricePoint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PricePointRepository extends JpaRepository<PricePoint, Long> {

    // newest first; id breaks ties between points recorded in the same instant
    Page<PricePoint> findByProduct_IdOrderByRecordedAtDescIdDesc(Long productId, Pageable pageable);

    long countByProduct_Id(Long productId);

    // retention sweep
    @Modifying(flushAutomatically = true)
    @Query("delete from PricePoint p where p.recordedAt < :threshold")
    int deleteByRecordedAtBefore(@Param("threshold") LocalDateTime threshold);

    @Modifying(flushAutomatically = true)
    @Query("delete from PricePoint p where p.product.id = :productId")
    int deleteByProductId(@Param("productId") Long productId);
}
