package com.garment.materials.repository;

import com.garment.materials.model.InventoryLayer;
import com.garment.materials.model.Material;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InventoryLayerRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 9, 0);

    @Autowired
    private InventoryLayerRepository layerRepository;

    @Autowired
    private MaterialRepository materialRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Material material(String code) {
        Material m = new Material();
        m.setCode(code);
        m.setName("Material " + code);
        m.setBaseUnit("m");
        m.setPurchaseUnit("m");
        return materialRepository.save(m);
    }

    private InventoryLayer layer(Long materialId, LocalDateTime createdAt, String qty, String cost) {
        InventoryLayer layer = new InventoryLayer();
        layer.setMaterialId(materialId);
        layer.setCreatedAt(createdAt);
        layer.setQuantityOnHand(new BigDecimal(qty));
        layer.setQuantityAvailable(new BigDecimal(qty));
        layer.setUnitCost(new BigDecimal(cost));
        return layerRepository.save(layer);
    }

    @Test
    void findAvailableForUpdate_ShouldReturnOpenLayersOldestFirst() {
        Material m = material("FAB-1");
        InventoryLayer late = layer(m.getId(), T0.plusHours(2), "5", "3.00");
        InventoryLayer early = layer(m.getId(), T0, "5", "2.00");
        InventoryLayer sameTime = layer(m.getId(), T0, "1", "2.50");
        layer(m.getId(), T0.minusDays(1), "0", "1.00");

        List<InventoryLayer> layers = layerRepository.findAvailableForUpdate(m.getId());

        assertEquals(3, layers.size());
        assertEquals(early.getId(), layers.get(0).getId());
        assertEquals(sameTime.getId(), layers.get(1).getId());
        assertEquals(late.getId(), layers.get(2).getId());
    }

    @Test
    void sumAvailableByMaterialId_ShouldBeZeroWithoutStock() {
        Material m = material("FAB-2");
        assertEquals(0, BigDecimal.ZERO.compareTo(layerRepository.sumAvailableByMaterialId(m.getId())));

        layer(m.getId(), T0, "4.5", "1.00");
        layer(m.getId(), T0.plusMinutes(1), "2", "1.00");
        assertEquals(0, new BigDecimal("6.5").compareTo(layerRepository.sumAvailableByMaterialId(m.getId())));
    }

    @Test
    void prePersist_ShouldDefaultAvailableToOnHand() {
        InventoryLayer layer = new InventoryLayer();
        layer.setMaterialId(material("FAB-3").getId());
        layer.setQuantityOnHand(new BigDecimal("8"));
        layer.setUnitCost(BigDecimal.ONE);

        InventoryLayer saved = layerRepository.saveAndFlush(layer);

        assertNotNull(saved.getCreatedAt());
        assertEquals(0, new BigDecimal("8").compareTo(saved.getQuantityAvailable()));
    }

    @Test
    void deletedMaterial_ShouldNoLongerResolve() {
        Material m = material("TRIM-1");
        materialRepository.delete(m);
        entityManager.flush();
        entityManager.clear();

        assertTrue(materialRepository.findById(m.getId()).isEmpty());
        assertTrue(materialRepository.findByCode("TRIM-1").isEmpty());
    }
}
