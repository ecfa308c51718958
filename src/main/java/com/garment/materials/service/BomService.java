package com.garment.materials.service;

import com.garment.materials.dto.BomCostBreakdown;
import com.garment.materials.dto.BomLineRequest;
import com.garment.materials.dto.BomRequest;
import com.garment.materials.dto.BomUpdateRequest;
import com.garment.materials.dto.MaterialRequirement;
import com.garment.materials.dto.ProductSelection;
import com.garment.materials.dto.RequirementPreview;
import com.garment.materials.exception.InvalidBomException;
import com.garment.materials.exception.RecordNotFoundException;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.BomLine;
import com.garment.materials.model.ConsumptionKind;
import com.garment.materials.model.ConsumptionSpec;
import com.garment.materials.model.Material;
import com.garment.materials.repository.BomHeaderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class BomService {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final BomHeaderRepository bomRepository;
    private final MaterialService materialService;
    private final InventoryLedgerService ledgerService;
    private final BomExpander bomExpander;
    private final MaterialRequirementCalculator requirementCalculator;
    private final UnitConversionService unitConversionService;
    private final SettingsService settingsService;
    private final AuditService auditService;

    public BomService(BomHeaderRepository bomRepository, MaterialService materialService,
            InventoryLedgerService ledgerService, BomExpander bomExpander,
            MaterialRequirementCalculator requirementCalculator, UnitConversionService unitConversionService,
            SettingsService settingsService, AuditService auditService) {
        this.bomRepository = bomRepository;
        this.materialService = materialService;
        this.ledgerService = ledgerService;
        this.bomExpander = bomExpander;
        this.requirementCalculator = requirementCalculator;
        this.unitConversionService = unitConversionService;
        this.settingsService = settingsService;
        this.auditService = auditService;
    }

    @Transactional
    public BomHeader createBom(BomRequest request) {
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new InvalidBomException("BOM output quantity must be greater than zero.");
        }

        BomHeader bom = new BomHeader();
        bom.setName(request.getName());
        if (request.getVersion() != null)
            bom.setVersion(request.getVersion());
        bom.setQuantity(request.getQuantity());
        if (request.getUnit() != null)
            bom.setUnit(request.getUnit());
        bom.setDescription(request.getDescription());
        if (request.getProductIds() != null)
            bom.getProductIds().addAll(request.getProductIds());

        for (BomLineRequest lineRequest : request.getLines()) {
            bom.addLine(toLine(new BomLine(), lineRequest));
        }

        BomHeader saved = bomRepository.save(bom);
        log.info("Created BOM {} v{} with {} line(s)", saved.getName(), saved.getVersion(), saved.getLines().size());
        return saved;
    }

    public BomHeader getBom(Long bomId) {
        return bomRepository.findById(bomId).orElseThrow(() -> new RecordNotFoundException("BOM", bomId));
    }

    public List<BomHeader> getActiveBoms() {
        return bomRepository.findByActiveTrueOrderByNameAsc();
    }

    public List<BomHeader> getBomsByProduct(Long productId) {
        return bomRepository.findActiveByProductId(productId);
    }

    /**
     * Changes header fields of an active BOM. Lines are edited through their own operations.
     */
    @Transactional
    public BomHeader updateBom(Long bomId, BomUpdateRequest request) {
        BomHeader bom = getEditableBom(bomId);
        if (request.getQuantity() != null && request.getQuantity().signum() <= 0) {
            throw new InvalidBomException("BOM output quantity must be greater than zero.");
        }
        if (request.getName() != null && request.getName().isBlank()) {
            throw new IllegalArgumentException("BOM name cannot be blank");
        }

        if (request.getName() != null)
            bom.setName(request.getName());
        if (request.getVersion() != null)
            bom.setVersion(request.getVersion());
        if (request.getQuantity() != null)
            bom.setQuantity(request.getQuantity());
        if (request.getUnit() != null)
            bom.setUnit(request.getUnit());
        if (request.getDescription() != null)
            bom.setDescription(request.getDescription());
        if (request.getProductIds() != null) {
            bom.getProductIds().clear();
            bom.getProductIds().addAll(request.getProductIds());
        }

        BomHeader saved = bomRepository.save(bom);
        auditService.log("UPDATE_BOM", "BOM: " + saved.getName() + " v" + saved.getVersion());
        return saved;
    }

    @Transactional
    public BomLine addLine(Long bomId, BomLineRequest request) {
        BomHeader bom = getEditableBom(bomId);
        BomLine line = toLine(new BomLine(), request);
        bom.addLine(line);
        bomRepository.save(bom);
        return line;
    }

    @Transactional
    public BomLine updateLine(Long bomId, Long lineId, BomLineRequest request) {
        BomHeader bom = getEditableBom(bomId);
        BomLine line = findLine(bom, lineId);
        toLine(line, request);
        bomRepository.save(bom);
        return line;
    }

    @Transactional
    public void removeLine(Long bomId, Long lineId) {
        BomHeader bom = getEditableBom(bomId);
        BomLine line = findLine(bom, lineId);
        bom.getLines().remove(line);
        bomRepository.save(bom);
    }

    /**
     * Soft delete. The BOM stays readable for costing history but can no longer be edited.
     */
    @Transactional
    public void deactivateBom(Long bomId) {
        BomHeader bom = getBom(bomId);
        if (!bom.isActive())
            return;
        bom.setActive(false);
        bomRepository.save(bom);
        auditService.log("DEACTIVATE_BOM", "BOM: " + bom.getName() + " v" + bom.getVersion());
        log.info("Deactivated BOM {} ({})", bom.getName(), bom.getId());
    }

    /**
     * Copies a BOM as version 1.0 under a new name, for {@code targetProductId} when given,
     * otherwise for the same products as the source.
     */
    @Transactional
    public BomHeader copyBom(Long sourceBomId, String newName, Long targetProductId) {
        BomHeader source = getBom(sourceBomId);

        BomHeader copy = new BomHeader();
        copy.setName(newName);
        copy.setVersion("1.0");
        copy.setQuantity(source.getQuantity());
        copy.setUnit(source.getUnit());
        copy.setDescription(source.getDescription());
        copy.getProductIds().addAll(targetProductId != null ? Set.of(targetProductId) : source.getProductIds());

        for (BomLine line : source.getLines()) {
            BomLine newLine = new BomLine();
            newLine.setMaterialId(line.getMaterialId());
            newLine.setQuantity(line.getQuantity());
            newLine.setUnit(line.getUnit());
            newLine.setEnteredQuantity(line.getEnteredQuantity());
            newLine.setEnteredUnit(line.getEnteredUnit());
            newLine.setWastePercentage(line.getWastePercentage());
            newLine.setConsumption(line.getConsumption().copy());
            newLine.setFabricUsage(line.getFabricUsage());
            newLine.setNotes(line.getNotes());
            newLine.setSortOrder(line.getSortOrder());
            copy.addLine(newLine);
        }
        BomHeader saved = bomRepository.save(copy);
        auditService.log("COPY_BOM", "BOM: " + source.getName() + " -> " + saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public BomCostBreakdown costBreakdown(Long bomId) {
        BomHeader bom = getBom(bomId);
        return bomExpander.expand(bom, materialService.resolve(bom));
    }

    @Transactional(readOnly = true)
    public List<MaterialRequirement> calculateRequirements(Long bomId, BigDecimal productionQuantity) {
        BomHeader bom = getBom(bomId);
        return requirementCalculator.calculateRequirements(bom, materialService.resolve(bom), productionQuantity);
    }

    @Transactional(readOnly = true)
    public List<MaterialRequirement> calculateRequirements(Long bomId, List<ProductSelection> selections) {
        BomHeader bom = getBom(bomId);
        return requirementCalculator.calculateRequirements(bom, materialService.resolve(bom), selections);
    }

    /**
     * Requirements for a production run next to what is in stock right now.
     */
    @Transactional(readOnly = true)
    public List<RequirementPreview> consumptionPreview(Long bomId, BigDecimal productionQuantity) {
        return toPreview(calculateRequirements(bomId, productionQuantity));
    }

    @Transactional(readOnly = true)
    public List<RequirementPreview> consumptionPreview(Long bomId, List<ProductSelection> selections) {
        return toPreview(calculateRequirements(bomId, selections));
    }

    private List<RequirementPreview> toPreview(List<MaterialRequirement> requirements) {
        return requirements.stream()
                .map(r -> {
                    BigDecimal available = ledgerService.availableQuantity(r.getMaterialId());
                    return new RequirementPreview(r.getMaterialId(), r.getMaterialName(), r.getUnit(),
                            r.getRequiredQuantity(), available, available.compareTo(r.getRequiredQuantity()) >= 0);
                })
                .toList();
    }

    private BomHeader getEditableBom(Long bomId) {
        BomHeader bom = getBom(bomId);
        if (!bom.isActive()) {
            throw new InvalidBomException("BOM " + bom.getName() + " is inactive and cannot be modified.");
        }
        return bom;
    }

    private BomLine findLine(BomHeader bom, Long lineId) {
        return bom.getLines().stream()
                .filter(l -> lineId.equals(l.getId()))
                .findFirst()
                .orElseThrow(() -> new RecordNotFoundException("BOM line", lineId));
    }

    private BomLine toLine(BomLine line, BomLineRequest request) {
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new IllegalArgumentException("BOM line quantity must be greater than zero");
        }
        // Fails with NOT_FOUND for unknown or deleted materials
        Material material = materialService.getMaterial(request.getMaterialId());

        BigDecimal waste = request.getWastePercentage() != null ? request.getWastePercentage() : BigDecimal.ZERO;
        checkWaste(waste);

        // Stored in the base unit; unknown or incompatible units fail in the conversion
        String enteredUnit = request.getUnit() != null && !request.getUnit().isBlank()
                ? request.getUnit().trim()
                : material.getBaseUnit();
        BigDecimal quantity = enteredUnit.equalsIgnoreCase(material.getBaseUnit())
                ? request.getQuantity()
                : unitConversionService.convert(request.getQuantity(), enteredUnit, material.getBaseUnit());

        line.setMaterialId(request.getMaterialId());
        line.setQuantity(quantity);
        line.setUnit(material.getBaseUnit());
        line.setEnteredQuantity(request.getQuantity());
        line.setEnteredUnit(enteredUnit);
        line.setWastePercentage(waste);
        line.setConsumption(toConsumptionSpec(request.getConsumptionKind(), request.getConsumptionValue()));
        line.setFabricUsage(request.getFabricUsage());
        line.setNotes(request.getNotes());
        if (request.getSortOrder() != null)
            line.setSortOrder(request.getSortOrder());
        return line;
    }

    private void checkWaste(BigDecimal waste) {
        if (waste.signum() < 0) {
            throw new InvalidBomException("Waste percentage cannot be negative: " + waste);
        }
        if (waste.compareTo(ONE_HUNDRED) > 0 && !settingsService.isExcessWasteAllowed()) {
            throw new InvalidBomException("Waste percentage " + waste + " exceeds 100%. Enable '"
                    + SettingsService.KEY_ALLOW_EXCESS_WASTE + "' to allow it.");
        }
    }

    static ConsumptionSpec toConsumptionSpec(ConsumptionKind kind, String value) {
        if (kind == null || kind == ConsumptionKind.GENERAL)
            return ConsumptionSpec.general();
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Consumption " + kind + " needs a value");
        }
        switch (kind) {
            case BY_SIZE:
                return ConsumptionSpec.bySize(value.trim());
            case BY_COLOR:
                return ConsumptionSpec.byColor(value.trim());
            case BY_CATEGORY:
                try {
                    return ConsumptionSpec.byCategory(Long.parseLong(value.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Category id must be numeric: " + value);
                }
            default:
                throw new IllegalArgumentException("Unsupported consumption kind: " + kind);
        }
    }
}
