package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.ConsumptionResult;
import com.garment.materials.exception.InsufficientInventoryException;
import com.garment.materials.model.InventoryLayer;
import com.garment.materials.model.LayerDraw;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Draws a quantity out of a material's layers, oldest first.
 * <p>
 * The layers are mutated in place; persisting them is the caller's job. Nothing is
 * touched when the layers cannot cover the whole quantity.
 */
@Component
public class FifoLayerConsumer {

    static final Comparator<InventoryLayer> FIFO_ORDER = Comparator
            .comparing(InventoryLayer::getCreatedAt)
            .thenComparing(InventoryLayer::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MaterialsProperties properties;

    public FifoLayerConsumer(MaterialsProperties properties) {
        this.properties = properties;
    }

    public ConsumptionResult consume(Long materialId, String materialName, List<InventoryLayer> layers,
            BigDecimal required) {
        if (required == null || required.signum() <= 0) {
            throw new IllegalArgumentException("Quantity to consume must be greater than zero, got " + required);
        }

        // Snapshot the order once; the pass never re-reads
        List<InventoryLayer> ordered = new ArrayList<>(layers);
        ordered.sort(FIFO_ORDER);

        BigDecimal available = availableIn(ordered);
        if (available.compareTo(required) < 0) {
            throw new InsufficientInventoryException(materialId, materialName, available, required);
        }

        BigDecimal remaining = required;
        BigDecimal totalCost = BigDecimal.ZERO;
        List<LayerDraw> draws = new ArrayList<>();

        for (InventoryLayer layer : ordered) {
            if (remaining.signum() == 0)
                break;
            BigDecimal layerAvailable = layer.getQuantityAvailable();
            if (layerAvailable.signum() <= 0)
                continue;

            BigDecimal take = layerAvailable.min(remaining);
            layer.setQuantityAvailable(layerAvailable.subtract(take));
            layer.setQuantityOnHand(layer.getQuantityOnHand().subtract(take).max(BigDecimal.ZERO));

            draws.add(new LayerDraw(layer.getId(), take, layer.getUnitCost()));
            totalCost = totalCost.add(take.multiply(layer.getUnitCost()));
            remaining = remaining.subtract(take);
        }

        BigDecimal averageUnitCost = totalCost.divide(required, properties.getCosting().getScale(),
                RoundingMode.HALF_UP);
        return new ConsumptionResult(materialId, required, averageUnitCost, List.copyOf(draws));
    }

    static BigDecimal availableIn(List<InventoryLayer> layers) {
        return layers.stream()
                .map(InventoryLayer::getQuantityAvailable)
                .filter(q -> q != null && q.signum() > 0)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
