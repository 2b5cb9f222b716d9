package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PackageOffer {
    int rank;
    Long flightUnitId;
    String flightName;
    Long hotelUnitId;
    String hotelName;
    long flightBasePrice;
    long hotelBasePrice;
    long flightDynamicPrice;
    long hotelDynamicPrice;
    VelocitySignal flightVelocity;
    VelocitySignal hotelVelocity;
    long sumDynamicPrice;
    double hotelUrgencyScore;
    long bundleDiscount;
    long finalPackagePrice;
    double strategyScore;
    String reason;
}
