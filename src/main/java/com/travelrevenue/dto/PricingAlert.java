package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PricingAlert {
    AlertLevel level;
    Long unitId;
    String message;
}
