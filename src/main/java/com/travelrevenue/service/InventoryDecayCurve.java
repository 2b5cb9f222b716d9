package com.travelrevenue.service;

/**
 * Logistic "cliff" applied to the residual value of unsold inventory. The value
 * holds near 1 for most of the horizon and collapses towards 0 in the last
 * {@code midpoint} fraction before departure.
 */
public final class InventoryDecayCurve {

    private InventoryDecayCurve() {
    }

    /**
     * @param leadDays    days left until departure
     * @param horizonDays days from procurement to departure
     * @param steepness   logistic slope {@code k}
     * @param midpoint    position {@code p} of the cliff as a fraction of the horizon
     * @return factor in [0, 1], 1 at the start of the horizon and 0 at departure
     */
    public static double factor(int leadDays, int horizonDays, double steepness, double midpoint) {
        if (leadDays <= 0) {
            return 0.0;
        }
        if (horizonDays <= 0) {
            return 1.0;
        }
        double x = Math.min(1.0, (double) leadDays / horizonDays);
        double high = logistic(steepness * (1.0 - midpoint));
        double low = logistic(steepness * (0.0 - midpoint));
        if (high - low < 1e-12) {
            return 1.0;
        }
        double normalized = (logistic(steepness * (x - midpoint)) - low) / (high - low);
        return RevenueMath.clamp(normalized, 0.0, 1.0);
    }

    private static double logistic(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
