package com.travelrevenue.service;

final class RevenueMath {

    private static final double EPS = 1e-9;

    private RevenueMath() {
    }

    static long roundToUnit(double amount, long unit) {
        return Math.round(amount / unit) * unit;
    }

    static long floorToUnit(double amount, long unit) {
        return (long) Math.floor(amount / unit + EPS) * unit;
    }

    static long ceilToUnit(double amount, long unit) {
        return (long) Math.ceil(amount / unit - EPS) * unit;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    static int percent(double ratio) {
        return (int) Math.floor(ratio * 100.0 + EPS);
    }

    static String yen(long amount) {
        return String.format("%s¥%,d", amount < 0 ? "-" : "+", Math.abs(amount));
    }
}
