package com.travelrevenue.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class SaleRecordRequest {

    @NotNull(message = "unitId is required")
    Long unitId;

    Long partnerUnitId;

    @NotNull(message = "bookedAt is required")
    Instant bookedAt;

    @Min(value = 1, message = "quantity must be >= 1")
    int quantity;

    @Min(value = 0, message = "soldPrice must be >= 0")
    long soldPrice;

    @Min(value = 0, message = "basePriceAtSale must be >= 0")
    long basePriceAtSale;

    boolean bundle;

    @Min(value = 0, message = "discountAmount must be >= 0")
    long discountAmount;
}
