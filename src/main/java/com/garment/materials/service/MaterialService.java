package com.garment.materials.service;

import com.garment.materials.dto.MaterialRequest;
import com.garment.materials.exception.RecordNotFoundException;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.BomLine;
import com.garment.materials.model.Material;
import com.garment.materials.repository.InventoryLayerRepository;
import com.garment.materials.repository.MaterialRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class MaterialService {

    private final MaterialRepository materialRepository;
    private final InventoryLayerRepository layerRepository;
    private final UnitConversionService unitConversionService;
    private final AuditService auditService;

    public MaterialService(MaterialRepository materialRepository, InventoryLayerRepository layerRepository,
            UnitConversionService unitConversionService, AuditService auditService) {
        this.materialRepository = materialRepository;
        this.layerRepository = layerRepository;
        this.unitConversionService = unitConversionService;
        this.auditService = auditService;
    }

    @Transactional
    public Material createMaterial(MaterialRequest request) {
        if (materialRepository.findByCode(request.getCode()).isPresent()) {
            throw new IllegalArgumentException("Material code already exists: " + request.getCode());
        }
        Material material = new Material();
        material.setCode(request.getCode());
        apply(material, request);
        Material saved = materialRepository.save(material);
        log.info("Created material {} ({})", saved.getCode(), saved.getId());
        return saved;
    }

    @Transactional
    public Material updateMaterial(Long id, MaterialRequest request) {
        Material material = getMaterial(id);
        BigDecimal oldCost = material.getCostPerUnit();
        apply(material, request);
        Material saved = materialRepository.save(material);
        if (costChanged(oldCost, saved.getCostPerUnit())) {
            auditService.log("UPDATE_MATERIAL_COST",
                    "Material: " + saved.getCode() + ", Old: " + oldCost + ", New: " + saved.getCostPerUnit());
        }
        return saved;
    }

    @Transactional
    public void deleteMaterial(Long id) {
        Material material = getMaterial(id);
        BigDecimal inStock = layerRepository.sumAvailableByMaterialId(id);
        if (inStock != null && inStock.signum() > 0) {
            throw new IllegalArgumentException("Cannot delete material " + material.getCode() + ". "
                    + inStock.stripTrailingZeros().toPlainString() + " " + material.getBaseUnit() + " still in stock.");
        }
        materialRepository.delete(material);
        auditService.log("DELETE_MATERIAL", "Material: " + material.getCode());
    }

    public Material getMaterial(Long id) {
        return materialRepository.findById(id).orElseThrow(() -> new RecordNotFoundException("Material", id));
    }

    public List<Material> getAllMaterials() {
        return materialRepository.findAll();
    }

    /**
     * Looks up materials by id. Ids that do not resolve (unknown or deleted) are absent from the map.
     */
    public Map<Long, Material> resolve(Collection<Long> ids) {
        return materialRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Material::getId, Function.identity()));
    }

    public Map<Long, Material> resolve(BomHeader bom) {
        return resolve(bom.getLines().stream().map(BomLine::getMaterialId).collect(Collectors.toSet()));
    }

    private static boolean costChanged(BigDecimal oldCost, BigDecimal newCost) {
        if (oldCost == null || newCost == null)
            return oldCost != newCost;
        return oldCost.compareTo(newCost) != 0;
    }

    private void apply(Material material, MaterialRequest request) {
        BigDecimal factor = request.getConversionFactor() != null ? request.getConversionFactor() : BigDecimal.ONE;
        String purchaseUnit = request.getPurchaseUnit() != null ? request.getPurchaseUnit() : request.getBaseUnit();
        unitConversionService.validateConversionFactor(request.getBaseUnit(), purchaseUnit, factor);

        material.setName(request.getName());
        material.setBaseUnit(request.getBaseUnit());
        material.setPurchaseUnit(purchaseUnit);
        material.setConversionFactor(factor);
        material.setCostPerUnit(request.getCostPerUnit());
    }
}
