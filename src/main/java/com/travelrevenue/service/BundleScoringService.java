package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.VelocitySignal;
import org.springframework.stereotype.Service;

import java.util.OptionalInt;

/**
 * Scores hotel stock for bundling and sizes the package discount.
 */
@Service
public class BundleScoringService {

    static final double URGENCY_WINDOW_DAYS = 30.0;
    static final double DISCOUNT_BASE_SHARE = 0.25;
    static final double DISCOUNT_DYNAMIC_SHARE = 0.30;

    /**
     * Urgency in [0, 1]: 60% time pressure over the last 30 days, 40% surplus stock.
     * An unknown or past departure carries no time pressure.
     */
    public double urgency(int remaining, int total, OptionalInt leadDays) {
        double timeUrgency = 0.0;
        if (leadDays.isPresent() && leadDays.getAsInt() >= 0) {
            timeUrgency = Math.max(0.0, 1.0 - leadDays.getAsInt() / URGENCY_WINDOW_DAYS);
        }
        double surplus = total > 0 ? (double) remaining / total : 0.0;
        return RevenueMath.clamp(0.6 * timeUrgency + 0.4 * surplus, 0.0, 1.0);
    }

    /** Negative amount; never deeper than 25% of list price or 30% of the dynamic price. */
    public long bundleDiscount(long hotelBasePrice, long hotelDynamicPrice, double urgency, EngineSettings settings) {
        long unit = settings.getCurrencyUnit();
        long byUrgency = RevenueMath.roundToUnit(hotelBasePrice * DISCOUNT_BASE_SHARE * urgency, unit);
        long baseCeiling = RevenueMath.floorToUnit(hotelBasePrice * DISCOUNT_BASE_SHARE, unit);
        long dynamicCeiling = RevenueMath.floorToUnit(hotelDynamicPrice * DISCOUNT_DYNAMIC_SHARE, unit);
        long amount = Math.max(0, Math.min(byUrgency, Math.min(baseCeiling, dynamicCeiling)));
        return -amount;
    }

    public double strategyScore(double urgency, int flightRemaining, int flightTotal) {
        double flightDemand = flightTotal > 0 ? 1.0 - (double) flightRemaining / flightTotal : 0.0;
        return RevenueMath.clamp(0.7 * urgency + 0.3 * flightDemand, 0.0, 1.0);
    }

    /** Discount the optimizer assumes when sizing a candidate pair. */
    public long estimatedBundleDiscount(long hotelPrice, long flightPrice, EngineSettings settings) {
        return RevenueMath.roundToUnit((hotelPrice + flightPrice) * settings.getBundleDiscountRate(),
            settings.getCurrencyUnit());
    }

    public String velocityNote(VelocitySignal signal) {
        if (!signal.isMeasured()) {
            return "insufficient data";
        }
        if (signal.isAtLeast(2.0)) {
            return String.format("strong surge (%.1fx)", signal.getRatio());
        }
        if (signal.isAtLeast(1.5)) {
            return String.format("surge (%.1fx)", signal.getRatio());
        }
        if (signal.isAtLeast(0.7)) {
            return String.format("on pace (%.1fx)", signal.getRatio());
        }
        if (signal.isAtLeast(0.3)) {
            return String.format("slowing (%.1fx)", signal.getRatio());
        }
        return String.format("stalled (%.1fx)", signal.getRatio());
    }
}
