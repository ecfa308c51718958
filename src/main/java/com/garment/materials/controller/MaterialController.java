package com.garment.materials.controller;

import com.garment.materials.dto.InventoryValuation;
import com.garment.materials.dto.MaterialRequest;
import com.garment.materials.dto.ReceiptRequest;
import com.garment.materials.model.InventoryLayer;
import com.garment.materials.model.Material;
import com.garment.materials.service.InventoryLedgerService;
import com.garment.materials.service.MaterialService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/materials")
public class MaterialController {

    private final MaterialService materialService;
    private final InventoryLedgerService ledgerService;

    public MaterialController(MaterialService materialService, InventoryLedgerService ledgerService) {
        this.materialService = materialService;
        this.ledgerService = ledgerService;
    }

    @GetMapping
    public List<Material> list() {
        return materialService.getAllMaterials();
    }

    @GetMapping("/{id}")
    public Material get(@PathVariable Long id) {
        return materialService.getMaterial(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasRole('ADMIN')")
    public Material create(@Valid @RequestBody MaterialRequest request) {
        return materialService.createMaterial(request);
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public Material update(@PathVariable Long id, @Valid @RequestBody MaterialRequest request) {
        return materialService.updateMaterial(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasRole('ADMIN')")
    public void delete(@PathVariable Long id) {
        materialService.deleteMaterial(id);
    }

    @PostMapping("/{id}/receipts")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('STORES', 'ADMIN')")
    public InventoryLayer receive(@PathVariable Long id, @Valid @RequestBody ReceiptRequest request) {
        if (request.isPurchaseUnits()) {
            return ledgerService.receivePurchase(id, request.getQuantity(), request.getUnitCost(),
                    request.getReference());
        }
        return ledgerService.receive(id, request.getQuantity(), request.getUnitCost(), request.getReference());
    }

    @GetMapping("/{id}/layers")
    public List<InventoryLayer> layers(@PathVariable Long id) {
        materialService.getMaterial(id);
        return ledgerService.getLayers(id);
    }

    @GetMapping("/{id}/availability")
    public Map<String, Object> availability(@PathVariable Long id) {
        Material material = materialService.getMaterial(id);
        BigDecimal available = ledgerService.availableQuantity(id);
        return Map.of("materialId", id, "unit", material.getBaseUnit(), "available", available);
    }

    @GetMapping("/valuation")
    public List<InventoryValuation> valuation(@RequestParam List<Long> ids) {
        return ledgerService.valuation(ids);
    }
}
