package com.travelrevenue.dto;

import com.travelrevenue.config.EngineSettings;

public enum ForecastScenario {
    PESSIMISTIC,
    BASE,
    OPTIMISTIC;

    public double multiplier(EngineSettings settings) {
        return switch (this) {
            case PESSIMISTIC -> settings.getPessimisticMultiplier();
            case BASE -> settings.getBaseMultiplier();
            case OPTIMISTIC -> settings.getOptimisticMultiplier();
        };
    }
}
