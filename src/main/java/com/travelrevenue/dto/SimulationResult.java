package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SimulationResult {
    Long hotelUnitId;
    Long flightUnitId;
    ForecastScenario scenario;
    int horizonDays;
    long discount;
    double packageDailyPace;
    long packageUnitProfit;
    long cannibalizationPerPackage;
    long profitA;
    long profitB;
    long gain;
    int packagesSold;
    long wasteCostA;
    long wasteCostB;
    List<SimulationDay> history;
}
