package com.garment.materials.model;

import com.garment.materials.dto.ProductSelection;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Which output variants a BOM line is consumed for.
 */
@Embeddable
@Data
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ConsumptionSpec {

    @Enumerated(EnumType.STRING)
    @Column(name = "consumption_kind", nullable = false)
    private ConsumptionKind kind = ConsumptionKind.GENERAL;

    @Column(name = "consumption_value")
    private String attributeValue;

    private ConsumptionSpec(ConsumptionKind kind, String attributeValue) {
        this.kind = kind;
        this.attributeValue = attributeValue;
    }

    public static ConsumptionSpec general() {
        return new ConsumptionSpec(ConsumptionKind.GENERAL, null);
    }

    public static ConsumptionSpec bySize(String size) {
        return new ConsumptionSpec(ConsumptionKind.BY_SIZE, Objects.requireNonNull(size, "size"));
    }

    public static ConsumptionSpec byColor(String color) {
        return new ConsumptionSpec(ConsumptionKind.BY_COLOR, Objects.requireNonNull(color, "color"));
    }

    public static ConsumptionSpec byCategory(Long categoryId) {
        return new ConsumptionSpec(ConsumptionKind.BY_CATEGORY,
                String.valueOf(Objects.requireNonNull(categoryId, "categoryId")));
    }

    public ConsumptionSpec copy() {
        return new ConsumptionSpec(kind, attributeValue);
    }

    public boolean appliesTo(ProductSelection selection) {
        switch (kind) {
            case BY_SIZE:
                return attributeValue.equalsIgnoreCase(selection.size());
            case BY_COLOR:
                return attributeValue.equalsIgnoreCase(selection.color());
            case BY_CATEGORY:
                return selection.categoryId() != null
                        && attributeValue.equals(String.valueOf(selection.categoryId()));
            case GENERAL:
            default:
                return true;
        }
    }
}
