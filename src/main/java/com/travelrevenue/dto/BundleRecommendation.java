package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BundleRecommendation {
    Long hotelUnitId;
    String hotelName;
    Long flightUnitId;
    String flightName;
    LocalDate departureDate;
    RecommendationAction action;
    long hotelPrice;
    long flightPrice;
    long discount;
    long proposedBundlePrice;
    long estimatedGain;
    double strategyScore;
    double urgencyScore;
    String justification;
}
