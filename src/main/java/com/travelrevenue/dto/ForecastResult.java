package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ForecastResult {
    ForecastScenario scenario;
    double dailyPace;
    double predictedSold;
    double predictedUnsold;
    long expectedNetProfit;
}
