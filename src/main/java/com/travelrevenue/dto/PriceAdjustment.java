package com.travelrevenue.dto;

import lombok.Builder;
import lombok.Value;

/** One bar of the price waterfall. */
@Value
@Builder
public class PriceAdjustment {
    String label;
    long value;
    AdjustmentMeasure measure;
    String reason;
    @Builder.Default
    boolean applicable = true;
}
