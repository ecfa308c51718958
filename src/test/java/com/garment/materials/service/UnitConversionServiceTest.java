package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.model.Material;
import com.garment.materials.model.UnitCategory;
import com.garment.materials.model.UnitOfMeasure;
import com.garment.materials.repository.UnitOfMeasureRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class UnitConversionServiceTest {

    @Mock
    private UnitOfMeasureRepository uomRepository;

    private UnitConversionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new UnitConversionService(uomRepository, new MaterialsProperties());
    }

    private static UnitOfMeasure uom(String code, UnitCategory category, String factor) {
        UnitOfMeasure unit = new UnitOfMeasure();
        unit.setCode(code);
        unit.setCategory(category);
        unit.setToBaseFactor(new BigDecimal(factor));
        return unit;
    }

    private static Material roll() {
        Material m = new Material();
        m.setBaseUnit("m");
        m.setPurchaseUnit("roll");
        m.setConversionFactor(new BigDecimal("50"));
        return m;
    }

    @Test
    void purchaseQuantity_convertsToBaseUnits() {
        assertEquals(0, new BigDecimal("150").compareTo(service.toBaseUnits(new BigDecimal("3"), roll())));
        assertEquals(0, new BigDecimal("0.5").compareTo(service.toPurchaseUnits(new BigDecimal("25"), roll())));
    }

    @Test
    void costPerBaseUnit_dividesByFactor() {
        assertEquals(0, new BigDecimal("2.5").compareTo(service.costPerBaseUnit(new BigDecimal("125"), roll())));
    }

    @Test
    void convert_withinCategory() {
        when(uomRepository.findByCodeIgnoreCase("yd")).thenReturn(Optional.of(uom("yd", UnitCategory.LENGTH, "0.9144")));
        when(uomRepository.findByCodeIgnoreCase("m")).thenReturn(Optional.of(uom("m", UnitCategory.LENGTH, "1")));

        assertEquals(0, new BigDecimal("9.144").compareTo(service.convert(BigDecimal.TEN, "yd", "m")));
    }

    @Test
    void convert_acrossCategoriesFails() {
        when(uomRepository.findByCodeIgnoreCase("kg")).thenReturn(Optional.of(uom("kg", UnitCategory.WEIGHT, "1")));
        when(uomRepository.findByCodeIgnoreCase("m")).thenReturn(Optional.of(uom("m", UnitCategory.LENGTH, "1")));

        assertThrows(IllegalArgumentException.class, () -> service.convert(BigDecimal.ONE, "kg", "m"));
    }

    @Test
    void validateConversionFactor_rules() {
        assertDoesNotThrow(() -> service.validateConversionFactor("m", "roll", new BigDecimal("50")));
        assertDoesNotThrow(() -> service.validateConversionFactor("m", "m", BigDecimal.ONE));

        IllegalArgumentException zero = assertThrows(IllegalArgumentException.class,
                () -> service.validateConversionFactor("m", "roll", BigDecimal.ZERO));
        assertEquals("Conversion factor must be positive", zero.getMessage());

        IllegalArgumentException same = assertThrows(IllegalArgumentException.class,
                () -> service.validateConversionFactor("m", "M", new BigDecimal("2")));
        assertEquals("Same units should have conversion factor of 1", same.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> service.validateConversionFactor("pcs", "container", new BigDecimal("10001")));
    }
}
