package com.travelrevenue.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable set of numeric knobs for one computation pass. Defaults come from
 * {@link RevenueEngineProperties}; callers override single values with
 * {@code settings.toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {

    @Builder.Default double targetSellRatio = 0.90;
    @Builder.Default double brakeThreshold = 1.5;
    @Builder.Default double brakeStrengthPct = 0.05;
    @Builder.Default double maxDiscountPct = 0.30;
    @Builder.Default double maxMarkupPct = 0.50;

    @Builder.Default double pessimisticMultiplier = 0.7;
    @Builder.Default double baseMultiplier = 1.0;
    @Builder.Default double optimisticMultiplier = 1.3;

    @Builder.Default double bundleVelocityBoost = 1.5;
    @Builder.Default double bundleDiscountRate = 0.08;
    @Builder.Default long bundleGainThreshold = 5000;
    @Builder.Default double cannibalizationBaseRate = 0.15;
    @Builder.Default long referenceDiscount = 10000;

    @Builder.Default double costRatio = 0.70;
    @Builder.Default int velocityWindowHours = 24;
    @Builder.Default int forecastLookbackDays = 14;
    @Builder.Default double theoreticalSellThrough = 0.70;

    @Builder.Default double decaySteepness = 20.0;
    @Builder.Default double decayMidpoint = 0.12;
    @Builder.Default int defaultHorizonDays = 90;
    @Builder.Default double defaultElasticity = -1.5;

    @Builder.Default long currencyUnit = 100;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
