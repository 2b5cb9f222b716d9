package com.travelrevenue.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Sales-pace signal for one unit: either a measured ratio of actual to expected
 * daily pace, or an explicit absence of signal with the reason. Absence is not a
 * ratio of zero and must never be used as one.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VelocitySignal {

    boolean measured;
    double ratio;
    String reason;

    public static VelocitySignal measured(double ratio) {
        return new VelocitySignal(true, ratio, null);
    }

    public static VelocitySignal noSignal(String reason) {
        return new VelocitySignal(false, 0.0, reason);
    }

    /** The measured ratio; only meaningful when {@link #isMeasured()}. */
    @JsonIgnore
    public double getRatio() {
        if (!measured) {
            throw new IllegalStateException("No velocity signal: " + reason);
        }
        return ratio;
    }

    @JsonProperty("ratio")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double ratioOrNull() {
        return measured ? ratio : null;
    }

    @JsonIgnore
    public boolean isAtLeast(double threshold) {
        return measured && ratio >= threshold;
    }

    @JsonIgnore
    public boolean isBelow(double threshold) {
        return measured && ratio < threshold;
    }

    @Override
    public String toString() {
        return measured ? String.format("%.3fx", ratio) : "no signal (" + reason + ")";
    }
}
