package com.garment.materials.config;

import com.garment.materials.model.UnitCategory;
import com.garment.materials.model.UnitOfMeasure;
import com.garment.materials.repository.UnitOfMeasureRepository;
import com.garment.materials.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Slf4j
@Configuration
public class DataInitializer {

    @Bean
    CommandLineRunner init(UnitOfMeasureRepository uomRepo, SettingsService settingsService) {
        return args -> {
            // Units of measure, factors into the base unit of each category
            if (uomRepo.count() == 0) {
                uom(uomRepo, "g", "Grams", UnitCategory.WEIGHT, "0.001");
                uom(uomRepo, "kg", "Kilograms", UnitCategory.WEIGHT, "1");
                uom(uomRepo, "t", "Tons", UnitCategory.WEIGHT, "1000");
                uom(uomRepo, "lb", "Pounds", UnitCategory.WEIGHT, "0.453592");
                uom(uomRepo, "oz", "Ounces", UnitCategory.WEIGHT, "0.0283495");

                uom(uomRepo, "mm", "Millimeters", UnitCategory.LENGTH, "0.001");
                uom(uomRepo, "cm", "Centimeters", UnitCategory.LENGTH, "0.01");
                uom(uomRepo, "m", "Meters", UnitCategory.LENGTH, "1");
                uom(uomRepo, "km", "Kilometers", UnitCategory.LENGTH, "1000");
                uom(uomRepo, "in", "Inches", UnitCategory.LENGTH, "0.0254");
                uom(uomRepo, "ft", "Feet", UnitCategory.LENGTH, "0.3048");
                uom(uomRepo, "yd", "Yards", UnitCategory.LENGTH, "0.9144");

                uom(uomRepo, "cm2", "Square centimeters", UnitCategory.AREA, "0.0001");
                uom(uomRepo, "m2", "Square meters", UnitCategory.AREA, "1");
                uom(uomRepo, "ft2", "Square feet", UnitCategory.AREA, "0.092903");
                uom(uomRepo, "yd2", "Square yards", UnitCategory.AREA, "0.836127");

                uom(uomRepo, "ml", "Milliliters", UnitCategory.VOLUME, "0.001");
                uom(uomRepo, "l", "Liters", UnitCategory.VOLUME, "1");
                uom(uomRepo, "gal", "Gallons", UnitCategory.VOLUME, "3.78541");
                uom(uomRepo, "floz", "Fluid ounces", UnitCategory.VOLUME, "0.0295735");

                uom(uomRepo, "pcs", "Pieces", UnitCategory.COUNT, "1");
                uom(uomRepo, "doz", "Dozens", UnitCategory.COUNT, "12");
                uom(uomRepo, "gr", "Gross", UnitCategory.COUNT, "144");
                uom(uomRepo, "pr", "Pairs", UnitCategory.COUNT, "2");
                log.info("Seeded {} units of measure", uomRepo.count());
            }

            if (settingsService.getSetting(SettingsService.KEY_ALLOW_EXCESS_WASTE).isEmpty()) {
                settingsService.updateSetting(SettingsService.KEY_ALLOW_EXCESS_WASTE, "false");
            }
        };
    }

    private static void uom(UnitOfMeasureRepository repo, String code, String description, UnitCategory category,
            String factor) {
        UnitOfMeasure unit = new UnitOfMeasure();
        unit.setCode(code);
        unit.setDescription(description);
        unit.setCategory(category);
        unit.setToBaseFactor(new BigDecimal(factor));
        repo.save(unit);
    }
}
