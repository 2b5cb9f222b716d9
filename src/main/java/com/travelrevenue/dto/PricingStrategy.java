package com.travelrevenue.dto;

public enum PricingStrategy {
    RULE_BASED,
    DEMAND_ELASTICITY
}
