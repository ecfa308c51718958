package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.ConsumptionResult;
import com.garment.materials.dto.InventoryValuation;
import com.garment.materials.exception.InsufficientInventoryException;
import com.garment.materials.model.InventoryLayer;
import com.garment.materials.model.Material;
import com.garment.materials.repository.InventoryLayerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Layered (FIFO) stock per material.
 * <p>
 * Every consuming read goes through {@link InventoryLayerRepository#findAvailableForUpdate(Long)}, which
 * row-locks the material's open layers until the surrounding transaction ends. Two issues against the
 * same material therefore run one after the other.
 */
@Slf4j
@Service
public class InventoryLedgerService {

    private final InventoryLayerRepository layerRepository;
    private final MaterialService materialService;
    private final UnitConversionService unitConversionService;
    private final FifoLayerConsumer fifoLayerConsumer;
    private final AuditService auditService;
    private final MaterialsProperties properties;

    public InventoryLedgerService(InventoryLayerRepository layerRepository, MaterialService materialService,
            UnitConversionService unitConversionService, FifoLayerConsumer fifoLayerConsumer,
            AuditService auditService, MaterialsProperties properties) {
        this.layerRepository = layerRepository;
        this.materialService = materialService;
        this.unitConversionService = unitConversionService;
        this.fifoLayerConsumer = fifoLayerConsumer;
        this.auditService = auditService;
        this.properties = properties;
    }

    /**
     * Records a goods receipt as a new layer. Quantity and cost are in the material's base unit.
     */
    @Transactional
    public InventoryLayer receive(Long materialId, BigDecimal quantity, BigDecimal unitCost, String reference) {
        Material material = materialService.getMaterial(materialId);
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Received quantity must be greater than zero");
        }
        if (unitCost == null || unitCost.signum() < 0) {
            throw new IllegalArgumentException("Unit cost cannot be negative");
        }

        InventoryLayer layer = new InventoryLayer();
        layer.setMaterialId(material.getId());
        layer.setQuantityOnHand(quantity);
        layer.setQuantityAvailable(quantity);
        layer.setUnitCost(unitCost);
        layer.setTransactionRef(reference);
        InventoryLayer saved = layerRepository.save(layer);

        log.info("Received {} {} of {} at {} (layer {})", quantity.toPlainString(), material.getBaseUnit(),
                material.getCode(), unitCost.toPlainString(), saved.getId());
        auditService.log("RECEIVE_STOCK", "Material: " + material.getCode() + ", Qty: " + quantity.toPlainString()
                + ", Cost: " + unitCost.toPlainString() + ", Ref: " + reference);
        return saved;
    }

    /**
     * Receipt expressed in purchase units (e.g. rolls); stored in base units.
     */
    @Transactional
    public InventoryLayer receivePurchase(Long materialId, BigDecimal purchaseQuantity,
            BigDecimal pricePerPurchaseUnit, String reference) {
        Material material = materialService.getMaterial(materialId);
        BigDecimal baseQuantity = unitConversionService.toBaseUnits(purchaseQuantity, material);
        BigDecimal baseCost = unitConversionService.costPerBaseUnit(pricePerPurchaseUnit, material);
        return receive(materialId, baseQuantity, baseCost, reference);
    }

    @Transactional(readOnly = true)
    public BigDecimal availableQuantity(Long materialId) {
        BigDecimal available = layerRepository.sumAvailableByMaterialId(materialId);
        return available != null ? available : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public List<InventoryLayer> getLayers(Long materialId) {
        return layerRepository.findByMaterialIdOrderByCreatedAtAscIdAsc(materialId);
    }

    /**
     * Locks the material's layers and fails if they cannot cover {@code required}. Nothing is changed.
     */
    @Transactional
    public void checkAvailability(Long materialId, BigDecimal required) {
        List<InventoryLayer> layers = layerRepository.findAvailableForUpdate(materialId);
        BigDecimal available = FifoLayerConsumer.availableIn(layers);
        if (available.compareTo(required) < 0) {
            Material material = materialService.getMaterial(materialId);
            log.warn("Insufficient {}: available {}, required {}", material.getCode(), available.toPlainString(),
                    required.toPlainString());
            throw new InsufficientInventoryException(materialId, material.getName(), available, required);
        }
    }

    /**
     * Takes {@code required} base units out of stock, oldest layer first.
     * <p>
     * Not idempotent: every call consumes again.
     *
     * @return the layers drawn and the quantity-weighted average unit cost
     * @throws InsufficientInventoryException if stock is short; no layer is changed in that case
     */
    @Transactional
    public ConsumptionResult consume(Long materialId, BigDecimal required) {
        Material material = materialService.getMaterial(materialId);
        List<InventoryLayer> layers = layerRepository.findAvailableForUpdate(materialId);

        ConsumptionResult result = fifoLayerConsumer.consume(materialId, material.getName(), layers, required);
        layerRepository.saveAll(layers);

        log.info("Consumed {} {} of {} across {} layer(s), average cost {}", required.toPlainString(),
                material.getBaseUnit(), material.getCode(), result.layersConsumed().size(),
                result.averageUnitCost().toPlainString());
        return result;
    }

    @Transactional(readOnly = true)
    public List<InventoryValuation> valuation(Collection<Long> materialIds) {
        Map<Long, List<InventoryLayer>> byMaterial = layerRepository
                .findByMaterialIdInAndQuantityAvailableGreaterThan(materialIds, BigDecimal.ZERO).stream()
                .collect(Collectors.groupingBy(InventoryLayer::getMaterialId, LinkedHashMap::new,
                        Collectors.toList()));

        return materialIds.stream()
                .distinct()
                .map(id -> valuationOf(id, byMaterial.getOrDefault(id, List.of())))
                .toList();
    }

    private InventoryValuation valuationOf(Long materialId, List<InventoryLayer> layers) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal value = BigDecimal.ZERO;
        for (InventoryLayer layer : layers) {
            quantity = quantity.add(layer.getQuantityAvailable());
            value = value.add(layer.getQuantityAvailable().multiply(layer.getUnitCost()));
        }
        BigDecimal averageCost = quantity.signum() > 0
                ? value.divide(quantity, properties.getCosting().getScale(), RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new InventoryValuation(materialId, quantity, value, averageCost);
    }
}
