package com.garment.materials.controller;

import com.garment.materials.model.AuditLog;
import com.garment.materials.model.UnitOfMeasure;
import com.garment.materials.repository.AuditLogRepository;
import com.garment.materials.repository.UnitOfMeasureRepository;
import com.garment.materials.service.SettingsService;
import com.garment.materials.service.UnitConversionService;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api")
public class AdminController {

    private final SettingsService settingsService;
    private final AuditLogRepository auditLogRepository;
    private final UnitOfMeasureRepository uomRepository;
    private final UnitConversionService unitConversionService;

    public AdminController(SettingsService settingsService, AuditLogRepository auditLogRepository,
            UnitOfMeasureRepository uomRepository, UnitConversionService unitConversionService) {
        this.settingsService = settingsService;
        this.auditLogRepository = auditLogRepository;
        this.uomRepository = uomRepository;
        this.unitConversionService = unitConversionService;
    }

    @GetMapping("/units")
    public List<UnitOfMeasure> units() {
        return uomRepository.findAll(Sort.by("category", "toBaseFactor"));
    }

    @GetMapping("/units/convert")
    public BigDecimal convert(@RequestParam BigDecimal quantity, @RequestParam String from,
            @RequestParam String to) {
        return unitConversionService.convert(quantity, from, to);
    }

    @PutMapping("/settings/{key}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PreAuthorize("hasRole('ADMIN')")
    public void updateSetting(@PathVariable String key, @RequestBody String value) {
        settingsService.updateSetting(key, value.trim());
    }

    @GetMapping("/audit")
    @PreAuthorize("hasRole('ADMIN')")
    public List<AuditLog> audit(@RequestParam(required = false) String action) {
        if (action != null) {
            return auditLogRepository.findByActionOrderByTimestampDesc(action);
        }
        return auditLogRepository.findAll(Sort.by(Sort.Direction.DESC, "timestamp"));
    }
}
