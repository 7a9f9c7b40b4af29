package kcs.pricepulse.repository;

import java.util.List;
import java.util.Optional;
import kcs.pricepulse.entity.TrackedProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface TrackedProductRepository extends JpaRepository<TrackedProduct, Long> {

    boolean existsByUrl(String url);

    Optional<TrackedProduct> findByUrl(String url);

    @Query("select p.id from TrackedProduct p order by p.id")
    List<Long> findAllIds();
}
