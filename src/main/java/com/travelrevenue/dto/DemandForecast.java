package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DemandForecast {
    Long unitId;
    int leadDays;
    int remaining;
    long price;
    long cost;
    double baselineDailyPace;
    PaceSource paceSource;
    Map<ForecastScenario, ForecastResult> scenarios;

    public ForecastResult scenario(ForecastScenario scenario) {
        return scenarios.get(scenario);
    }
}
