package com.garment.materials.repository;

import com.garment.materials.model.BomHeader;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface BomHeaderRepository extends JpaRepository<BomHeader, Long> {
    List<BomHeader> findByActiveTrueOrderByNameAsc();

    @Query("SELECT DISTINCT b FROM BomHeader b JOIN b.productIds p "
            + "WHERE b.active = true AND p = :productId ORDER BY b.name ASC")
    List<BomHeader> findActiveByProductId(@Param("productId") Long productId);
}
