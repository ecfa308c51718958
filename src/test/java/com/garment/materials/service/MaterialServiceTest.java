package com.garment.materials.service;

import com.garment.materials.dto.MaterialRequest;
import com.garment.materials.exception.RecordNotFoundException;
import com.garment.materials.model.Material;
import com.garment.materials.repository.InventoryLayerRepository;
import com.garment.materials.repository.MaterialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MaterialServiceTest {

    @Mock
    private MaterialRepository materialRepository;

    @Mock
    private InventoryLayerRepository layerRepository;

    @Mock
    private UnitConversionService unitConversionService;

    @Mock
    private AuditService auditService;

    @InjectMocks
    private MaterialService materialService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(materialRepository.save(any(Material.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static MaterialRequest request(String cost) {
        MaterialRequest request = new MaterialRequest();
        request.setCode("FAB-001");
        request.setName("Cotton Jersey");
        request.setBaseUnit("m");
        request.setCostPerUnit(cost != null ? new BigDecimal(cost) : null);
        return request;
    }

    private Material existing(String cost) {
        Material material = new Material();
        material.setId(1L);
        material.setCode("FAB-001");
        material.setName("Cotton Jersey");
        material.setBaseUnit("m");
        material.setCostPerUnit(cost != null ? new BigDecimal(cost) : null);
        when(materialRepository.findById(1L)).thenReturn(Optional.of(material));
        return material;
    }

    @Test
    void createMaterial_defaultsPurchaseUnitAndFactor() {
        Material created = materialService.createMaterial(request("4.20"));

        assertEquals("m", created.getPurchaseUnit());
        assertEquals(0, BigDecimal.ONE.compareTo(created.getConversionFactor()));
        verify(unitConversionService).validateConversionFactor("m", "m", BigDecimal.ONE);
    }

    @Test
    void createMaterial_rejectsDuplicateCode() {
        when(materialRepository.findByCode("FAB-001")).thenReturn(Optional.of(new Material()));

        assertThrows(IllegalArgumentException.class, () -> materialService.createMaterial(request("1")));
        verify(materialRepository, never()).save(any());
    }

    @Test
    void updateMaterial_auditsCostChangeIncludingToUnpriced() {
        existing("4.20");

        materialService.updateMaterial(1L, request("4.200"));
        verify(auditService, never()).log(eq("UPDATE_MATERIAL_COST"), anyString());

        assertDoesNotThrow(() -> materialService.updateMaterial(1L, request(null)));
        verify(auditService).log(eq("UPDATE_MATERIAL_COST"), contains("Old: 4.200"));
    }

    @Test
    void deleteMaterial_blockedWhileInStock() {
        existing("1");
        when(layerRepository.sumAvailableByMaterialId(1L)).thenReturn(new BigDecimal("12.500"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> materialService.deleteMaterial(1L));
        assertEquals("Cannot delete material FAB-001. 12.5 m still in stock.", ex.getMessage());
        verify(materialRepository, never()).delete(any());
    }

    @Test
    void deleteMaterial_softDeletesWhenEmpty() {
        Material material = existing("1");
        when(layerRepository.sumAvailableByMaterialId(1L)).thenReturn(BigDecimal.ZERO);

        materialService.deleteMaterial(1L);

        verify(materialRepository).delete(material);
        verify(auditService).log(eq("DELETE_MATERIAL"), contains("FAB-001"));
    }

    @Test
    void getMaterial_missingIsNotFound() {
        RecordNotFoundException ex = assertThrows(RecordNotFoundException.class,
                () -> materialService.getMaterial(404L));
        assertEquals("Material not found: 404", ex.getMessage());
    }
}
