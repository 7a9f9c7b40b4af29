package kcs.pricepulse.repository;

import java.util.List;
import kcs.pricepulse.entity.ComparisonResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ComparisonResultRepository extends JpaRepository<ComparisonResult, Long> {

    List<ComparisonResult> findByProduct_IdOrderByFoundPriceAsc(Long productId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ComparisonResult c where c.product.id = :productId")
    int deleteByProductId(@Param("productId") Long productId);
}
