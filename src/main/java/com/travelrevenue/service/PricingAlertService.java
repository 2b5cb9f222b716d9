package com.travelrevenue.service;

import com.travelrevenue.dto.AlertLevel;
import com.travelrevenue.dto.PackageOffer;
import com.travelrevenue.dto.PricingAlert;
import com.travelrevenue.dto.PricingResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PricingAlertService {

    static final double SLOW_PACE_RATIO = 0.5;
    static final double SURPLUS_RATIO = 0.6;
    static final double HOT_PACKAGE_SCORE = 0.8;

    /** Dangers first, then warnings, then the package hint; units in input order. */
    public List<PricingAlert> alerts(List<PricingResult> results, List<PackageOffer> packages) {
        List<PricingAlert> alerts = new ArrayList<>();
        for (PricingResult result : results) {
            if (result.isBrakeActive()) {
                alerts.add(PricingAlert.builder()
                    .level(AlertLevel.DANGER)
                    .unitId(result.getUnitId())
                    .message(String.format("%s is selling at %.1fx of plan; price brake applied, final ¥%,d",
                        result.getName(), result.getVelocitySignal().getRatio(), result.getFinalPrice()))
                    .build());
            }
        }
        for (PricingResult result : results) {
            if (result.getVelocitySignal().isBelow(SLOW_PACE_RATIO) && result.getInventoryRatio() > SURPLUS_RATIO) {
                alerts.add(PricingAlert.builder()
                    .level(AlertLevel.WARNING)
                    .unitId(result.getUnitId())
                    .message(String.format("%s is selling at %.1fx of plan with %d%% of stock left; consider bundling",
                        result.getName(), result.getVelocitySignal().getRatio(),
                        RevenueMath.percent(result.getInventoryRatio())))
                    .build());
            }
        }
        if (!packages.isEmpty() && packages.get(0).getStrategyScore() > HOT_PACKAGE_SCORE) {
            PackageOffer top = packages.get(0);
            alerts.add(PricingAlert.builder()
                .level(AlertLevel.INFO)
                .unitId(top.getHotelUnitId())
                .message(String.format("Top package %s + %s scores %.2f; promote it now",
                    top.getFlightName(), top.getHotelName(), top.getStrategyScore()))
                .build());
        }
        return alerts;
    }
}
