package com.travelrevenue.dto;

import com.travelrevenue.entity.UnitKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class PricingResult {
    Long unitId;
    String name;
    UnitKind kind;
    PricingStrategy strategy;
    long basePrice;
    int remainingCapacity;
    double inventoryRatio;
    Integer leadDays;
    VelocitySignal velocitySignal;
    boolean brakeActive;
    Double decayFactor;
    long theoreticalPrice;
    long minPrice;
    long maxPrice;
    long finalPrice;
    List<PriceAdjustment> waterfall;
    String justification;

    public Optional<PriceAdjustment> adjustment(String label) {
        return waterfall.stream().filter(a -> a.getLabel().equals(label)).findFirst();
    }

    public long adjustmentValue(String label) {
        return adjustment(label).map(PriceAdjustment::getValue).orElse(0L);
    }
}
