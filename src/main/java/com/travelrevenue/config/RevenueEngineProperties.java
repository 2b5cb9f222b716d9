package com.travelrevenue.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "revenue.engine")
public class RevenueEngineProperties {

    @DecimalMin(value = "0.01", message = "target-sell-ratio must be > 0")
    @DecimalMax(value = "1.0", message = "target-sell-ratio must be <= 1")
    private double targetSellRatio = 0.90;

    @DecimalMin(value = "0.0", message = "brake-threshold must be >= 0")
    private double brakeThreshold = 1.5;

    @DecimalMin(value = "0.0", message = "brake-strength-pct must be >= 0")
    private double brakeStrengthPct = 0.05;

    @DecimalMin(value = "0.0", message = "max-discount-pct must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "max-discount-pct must be between 0 and 1")
    private double maxDiscountPct = 0.30;

    @DecimalMin(value = "0.0", message = "max-markup-pct must be >= 0")
    private double maxMarkupPct = 0.50;

    private Scenario scenario = new Scenario();

    @DecimalMin(value = "0.0", message = "bundle-velocity-boost must be >= 0")
    private double bundleVelocityBoost = 1.5;

    @DecimalMin(value = "0.0", message = "bundle-discount-rate must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "bundle-discount-rate must be between 0 and 1")
    private double bundleDiscountRate = 0.08;

    @Min(value = 0, message = "bundle-gain-threshold must be >= 0")
    private long bundleGainThreshold = 5000;

    @DecimalMin(value = "0.0", message = "cannibalization-base-rate must be >= 0")
    private double cannibalizationBaseRate = 0.15;

    @Min(value = 1, message = "reference-discount must be >= 1")
    private long referenceDiscount = 10000;

    @DecimalMin(value = "0.0", message = "cost-ratio must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "cost-ratio must be between 0 and 1")
    private double costRatio = 0.70;

    @Min(value = 1, message = "velocity-window-hours must be >= 1")
    private int velocityWindowHours = 24;

    @Min(value = 1, message = "forecast-lookback-days must be >= 1")
    private int forecastLookbackDays = 14;

    @DecimalMin(value = "0.0", message = "theoretical-sell-through must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "theoretical-sell-through must be between 0 and 1")
    private double theoreticalSellThrough = 0.70;

    private Decay decay = new Decay();

    @Min(value = 1, message = "default-horizon-days must be >= 1")
    private int defaultHorizonDays = 90;

    private double defaultElasticity = -1.5;

    @Min(value = 1, message = "currency-unit must be >= 1")
    private long currencyUnit = 100;

    @Getter
    @Setter
    public static class Scenario {
        private double pessimistic = 0.7;
        private double base = 1.0;
        private double optimistic = 1.3;
    }

    @Getter
    @Setter
    public static class Decay {
        private double steepness = 20.0;
        private double midpoint = 0.12;
    }

    public EngineSettings toSettings() {
        return EngineSettings.builder()
            .targetSellRatio(targetSellRatio)
            .brakeThreshold(brakeThreshold)
            .brakeStrengthPct(brakeStrengthPct)
            .maxDiscountPct(maxDiscountPct)
            .maxMarkupPct(maxMarkupPct)
            .pessimisticMultiplier(scenario.getPessimistic())
            .baseMultiplier(scenario.getBase())
            .optimisticMultiplier(scenario.getOptimistic())
            .bundleVelocityBoost(bundleVelocityBoost)
            .bundleDiscountRate(bundleDiscountRate)
            .bundleGainThreshold(bundleGainThreshold)
            .cannibalizationBaseRate(cannibalizationBaseRate)
            .referenceDiscount(referenceDiscount)
            .costRatio(costRatio)
            .velocityWindowHours(velocityWindowHours)
            .forecastLookbackDays(forecastLookbackDays)
            .theoreticalSellThrough(theoreticalSellThrough)
            .decaySteepness(decay.getSteepness())
            .decayMidpoint(decay.getMidpoint())
            .defaultHorizonDays(defaultHorizonDays)
            .defaultElasticity(defaultElasticity)
            .currencyUnit(currencyUnit)
            .build();
    }
}
