package com.garment.materials.repository;

import com.garment.materials.model.InventoryLayer;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

public interface InventoryLayerRepository extends JpaRepository<InventoryLayer, Long> {

    // FIFO order; id breaks timestamp ties. Rows stay locked until the transaction ends.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM InventoryLayer l WHERE l.materialId = :materialId AND l.quantityAvailable > 0 "
            + "ORDER BY l.createdAt ASC, l.id ASC")
    List<InventoryLayer> findAvailableForUpdate(@Param("materialId") Long materialId);

    List<InventoryLayer> findByMaterialIdOrderByCreatedAtAscIdAsc(Long materialId);

    List<InventoryLayer> findByMaterialIdInAndQuantityAvailableGreaterThan(Collection<Long> materialIds,
            BigDecimal quantity);

    @Query("SELECT COALESCE(SUM(l.quantityAvailable), 0) FROM InventoryLayer l WHERE l.materialId = :materialId")
    BigDecimal sumAvailableByMaterialId(@Param("materialId") Long materialId);
}
