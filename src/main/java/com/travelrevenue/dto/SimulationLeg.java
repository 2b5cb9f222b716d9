package com.travelrevenue.dto;

import com.travelrevenue.entity.UnitKind;
import lombok.Builder;
import lombok.Value;

/** Inputs the simulator needs for one leg of a hotel + flight pair. */
@Value
@Builder
public class SimulationLeg {
    Long unitId;
    String name;
    UnitKind kind;
    int remaining;
    long price;
    long cost;
    double dailyPace;
    @Builder.Default
    VelocitySignal velocitySignal = VelocitySignal.noSignal("not measured");

    public long margin() {
        return price - cost;
    }
}
