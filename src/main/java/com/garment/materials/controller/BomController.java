package com.garment.materials.controller;

import com.garment.materials.dto.BomCostBreakdown;
import com.garment.materials.dto.BomLineRequest;
import com.garment.materials.dto.BomRequest;
import com.garment.materials.dto.BomUpdateRequest;
import com.garment.materials.dto.CopyBomRequest;
import com.garment.materials.dto.MaterialRequirement;
import com.garment.materials.dto.ProductSelection;
import com.garment.materials.dto.RequirementPreview;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.BomLine;
import com.garment.materials.service.BomService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/boms")
public class BomController {

    private final BomService bomService;

    public BomController(BomService bomService) {
        this.bomService = bomService;
    }

    @GetMapping
    public List<BomHeader> listActive(@RequestParam(required = false) Long productId) {
        return productId != null ? bomService.getBomsByProduct(productId) : bomService.getActiveBoms();
    }

    @GetMapping("/{id}")
    public BomHeader get(@PathVariable Long id) {
        return bomService.getBom(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public BomHeader create(@Valid @RequestBody BomRequest request) {
        return bomService.createBom(request);
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public BomHeader update(@PathVariable Long id, @RequestBody BomUpdateRequest request) {
        return bomService.updateBom(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public void deactivate(@PathVariable Long id) {
        bomService.deactivateBom(id);
    }

    @PostMapping("/{id}/copy")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public BomHeader copy(@PathVariable Long id, @Valid @RequestBody CopyBomRequest request) {
        return bomService.copyBom(id, request.getNewName(), request.getTargetProductId());
    }

    @PostMapping("/{id}/lines")
    @ResponseStatus(HttpStatus.CREATED)
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public BomLine addLine(@PathVariable Long id, @Valid @RequestBody BomLineRequest request) {
        return bomService.addLine(id, request);
    }

    @PutMapping("/{id}/lines/{lineId}")
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public BomLine updateLine(@PathVariable Long id, @PathVariable Long lineId,
            @Valid @RequestBody BomLineRequest request) {
        return bomService.updateLine(id, lineId, request);
    }

    @DeleteMapping("/{id}/lines/{lineId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasAnyRole('PLANNER', 'ADMIN')")
    public void removeLine(@PathVariable Long id, @PathVariable Long lineId) {
        bomService.removeLine(id, lineId);
    }

    @GetMapping("/{id}/cost")
    public BomCostBreakdown cost(@PathVariable Long id) {
        return bomService.costBreakdown(id);
    }

    @GetMapping("/{id}/requirements")
    public List<MaterialRequirement> requirements(@PathVariable Long id, @RequestParam BigDecimal quantity) {
        return bomService.calculateRequirements(id, quantity);
    }

    @PostMapping("/{id}/requirements")
    public List<MaterialRequirement> requirementsForSelections(@PathVariable Long id,
            @RequestBody List<ProductSelection> selections) {
        return bomService.calculateRequirements(id, selections);
    }

    @GetMapping("/{id}/preview")
    public List<RequirementPreview> preview(@PathVariable Long id, @RequestParam BigDecimal quantity) {
        return bomService.consumptionPreview(id, quantity);
    }

    @PostMapping("/{id}/preview")
    public List<RequirementPreview> previewForSelections(@PathVariable Long id,
            @RequestBody List<ProductSelection> selections) {
        return bomService.consumptionPreview(id, selections);
    }
}
