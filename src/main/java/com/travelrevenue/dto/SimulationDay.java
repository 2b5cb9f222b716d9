package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimulationDay {
    int dayIndex;
    long profitA;
    long profitB;
    int hotelStockA;
    int flightStockA;
    int hotelStockB;
    int flightStockB;
    int hotelSoldA;
    int flightSoldA;
    int packagesSold;
    double decayFactor;
    long residualAssetValue;
}
