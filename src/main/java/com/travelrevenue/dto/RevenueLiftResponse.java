package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class RevenueLiftResponse {
    long totalDynamic;
    long totalFixed;
    long lift;
    double liftPct;
    long totalUnits;
    List<DailyRevenue> daily;

    @Value
    @Builder
    public static class DailyRevenue {
        LocalDate day;
        long dynamicRevenue;
        long fixedRevenue;
    }
}
