package com.travelrevenue.dto;

public enum AdjustmentMeasure {
    ABSOLUTE,
    RELATIVE,
    TOTAL
}
