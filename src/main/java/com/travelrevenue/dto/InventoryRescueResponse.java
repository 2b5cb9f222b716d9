package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InventoryRescueResponse {
    double overallRescueRate;
    long rescuedUnits;
    long totalUnits;
    double hotelRescueRate;
    long hotelRescuedUnits;
    long hotelTotalUnits;
}
