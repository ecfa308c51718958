package com.garment.materials.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "materials")
public class MaterialsProperties {

    private Costing costing = new Costing();
    private Issue issue = new Issue();
    private Security security = new Security();

    @Data
    public static class Costing {
        // Decimal places for money (line cost, totals, FIFO average)
        private int scale = 4;
        // Decimal places for quantities produced by a division
        private int quantityScale = 6;
    }

    @Data
    public static class Issue {
        private String numberPrefix = "GI-";
    }

    @Data
    public static class Security {
        private String defaultPassword = "password";
    }
}
