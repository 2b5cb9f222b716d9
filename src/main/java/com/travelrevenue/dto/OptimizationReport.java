package com.travelrevenue.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class OptimizationReport {
    ForecastScenario scenario;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant referenceTime;
    List<BundleRecommendation> recommendations;
    long totalStandaloneProfit;
    long totalOptimizedProfit;
    long uplift;
    List<Long> excludedUnitIds;

    public long bundleCount() {
        return recommendations.stream()
            .filter(r -> r.getAction() == RecommendationAction.BUNDLE)
            .count();
    }
}
