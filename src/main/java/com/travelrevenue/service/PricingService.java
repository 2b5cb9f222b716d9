package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.AdjustmentMeasure;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.PriceAdjustment;
import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.PricingStrategy;
import com.travelrevenue.dto.VelocitySignal;
import com.travelrevenue.entity.InventoryUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Explainable price calculator. Every price comes with the ordered list of
 * adjustments that produced it and a readable justification, so the number
 * can be traced back to inventory, timing and sales-pace inputs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingService {

    public static final String LABEL_BASE       = "Base price";
    public static final String LABEL_SCARCITY   = "Scarcity";
    public static final String LABEL_LEAD_TIME  = "Lead time";
    public static final String LABEL_VELOCITY   = "Velocity brake";
    public static final String LABEL_ELASTICITY = "Demand elasticity";
    public static final String LABEL_DECAY      = "Inventory decay";
    public static final String LABEL_BOUNDS     = "Rounding and bounds";
    public static final String LABEL_FINAL      = "Final price";

    private static final double MIN_PACE_RATIO = 0.2;
    private static final double MAX_PACE_RATIO = 5.0;

    private final VelocitySignalService velocityService;
    private final DemandForecastService forecastService;

    public PricingResult price(InventoryUnit unit, EngineSettings settings,
                               Instant referenceTime, PricingStrategy strategy) {
        LocalDate referenceDate = referenceTime.atZone(ZoneOffset.UTC).toLocalDate();
        OptionalInt leadDays = unit.leadDays(referenceDate);
        long base = unit.getBasePrice();
        double inventoryRatio = unit.remainingRatio();

        VelocitySignal signal = velocityService.velocityRatio(
            unit.getId(), unit.getTotalCapacity(), unit.getRemainingCapacity(), leadDays,
            referenceTime, settings.getVelocityWindowHours(), settings.getTargetSellRatio());

        List<PriceAdjustment> adjustments = new ArrayList<>();
        boolean brakeActive = false;
        Double decayFactor = null;

        if (strategy == PricingStrategy.DEMAND_ELASTICITY) {
            ElasticityOutcome outcome = elasticityAdjustments(unit, leadDays, referenceTime, referenceDate, settings);
            adjustments.addAll(outcome.adjustments());
            decayFactor = outcome.decayFactor();
        } else {
            adjustments.add(scarcityAdjustment(base, inventoryRatio));
            adjustments.add(leadTimeAdjustment(base, leadDays));
            PriceAdjustment brake = velocityBrake(base, signal, settings);
            brakeActive = brake.getValue() > 0;
            adjustments.add(brake);
        }

        long theoretical = base + adjustments.stream().mapToLong(PriceAdjustment::getValue).sum();
        long unit100 = settings.getCurrencyUnit();
        long lower = RevenueMath.ceilToUnit(base * (1.0 - settings.getMaxDiscountPct()), unit100);
        long upper = RevenueMath.floorToUnit(base * (1.0 + settings.getMaxMarkupPct()), unit100);
        if (lower > upper) {
            lower = (long) Math.ceil(base * (1.0 - settings.getMaxDiscountPct()));
            upper = (long) Math.floor(base * (1.0 + settings.getMaxMarkupPct()));
        }
        long finalPrice = Math.max(lower, Math.min(upper, RevenueMath.roundToUnit(theoretical, unit100)));

        List<PriceAdjustment> waterfall = new ArrayList<>();
        waterfall.add(PriceAdjustment.builder()
            .label(LABEL_BASE).value(base).measure(AdjustmentMeasure.ABSOLUTE)
            .reason("list price").build());
        waterfall.addAll(adjustments);
        if (finalPrice != theoretical) {
            waterfall.add(PriceAdjustment.builder()
                .label(LABEL_BOUNDS).value(finalPrice - theoretical).measure(AdjustmentMeasure.RELATIVE)
                .reason(String.format("rounded to ¥%,d and kept within ¥%,d–¥%,d", unit100, lower, upper))
                .build());
        }
        waterfall.add(PriceAdjustment.builder()
            .label(LABEL_FINAL).value(finalPrice).measure(AdjustmentMeasure.TOTAL)
            .reason("price offered").build());

        String justification = adjustments.stream()
            .map(PriceAdjustment::getReason)
            .collect(Collectors.joining(". ", "", "."));

        log.debug("Price computed | unitId={} | strategy={} | base={} | final={} | velocity={}",
            unit.getId(), strategy, base, finalPrice, signal);

        return PricingResult.builder()
            .unitId(unit.getId())
            .name(unit.getName())
            .kind(unit.getKind())
            .strategy(strategy)
            .basePrice(base)
            .remainingCapacity(unit.getRemainingCapacity())
            .inventoryRatio(RevenueMath.round(inventoryRatio, 3))
            .leadDays(leadDays.isPresent() ? leadDays.getAsInt() : null)
            .velocitySignal(signal)
            .brakeActive(brakeActive)
            .decayFactor(decayFactor)
            .theoreticalPrice(theoretical)
            .minPrice(lower)
            .maxPrice(upper)
            .finalPrice(finalPrice)
            .waterfall(List.copyOf(waterfall))
            .justification(justification)
            .build();
    }

    PriceAdjustment scarcityAdjustment(long base, double inventoryRatio) {
        int pct = RevenueMath.percent(inventoryRatio);
        long adj;
        String reason;
        if (inventoryRatio < 0.20) {
            adj = Math.round(base * 0.30);
            reason = pct + "% of stock left: scarcity premium (" + RevenueMath.yen(adj) + ")";
        } else if (inventoryRatio < 0.50) {
            adj = Math.round(base * 0.10);
            reason = pct + "% of stock left: demand pressure markup (" + RevenueMath.yen(adj) + ")";
        } else if (inventoryRatio < 0.70) {
            adj = 0;
            reason = pct + "% of stock left: standard price, no adjustment";
        } else {
            adj = Math.round(base * -0.15);
            reason = pct + "% of stock left: surplus discount (" + RevenueMath.yen(adj) + ")";
        }
        return relative(LABEL_SCARCITY, adj, reason);
    }

    PriceAdjustment leadTimeAdjustment(long base, OptionalInt leadDays) {
        if (leadDays.isEmpty()) {
            return PriceAdjustment.builder()
                .label(LABEL_LEAD_TIME).value(0).measure(AdjustmentMeasure.RELATIVE)
                .reason("lead-time adjustment not applicable: departure date not set")
                .applicable(false)
                .build();
        }
        int d = leadDays.getAsInt();
        if (d < 0) {
            return PriceAdjustment.builder()
                .label(LABEL_LEAD_TIME).value(0).measure(AdjustmentMeasure.RELATIVE)
                .reason("already departed: out of pricing scope")
                .applicable(false)
                .build();
        }
        long adj;
        String reason;
        if (d <= 7) {
            adj = Math.round(base * -0.15);
            reason = d + " days to departure: last-minute discount (" + RevenueMath.yen(adj) + ")";
        } else if (d <= 30) {
            adj = Math.round(base * 0.10);
            reason = d + " days to departure: peak-decision markup (" + RevenueMath.yen(adj) + ")";
        } else if (d <= 90) {
            adj = 0;
            reason = d + " days to departure: standard price, no adjustment";
        } else {
            adj = Math.round(base * -0.10);
            reason = d + " days to departure: early-bird discount (" + RevenueMath.yen(adj) + ")";
        }
        return relative(LABEL_LEAD_TIME, adj, reason);
    }

    PriceAdjustment velocityBrake(long base, VelocitySignal signal, EngineSettings settings) {
        if (!signal.isMeasured()) {
            return relative(LABEL_VELOCITY, 0, "insufficient data for velocity adjustment (" + signal.getReason() + ")");
        }
        if (signal.isAtLeast(settings.getBrakeThreshold())) {
            long adj = Math.max(1, Math.round(base * settings.getBrakeStrengthPct()));
            return relative(LABEL_VELOCITY, adj, String.format(
                "sales pace at %.1fx of plan: automatic price brake (%s)", signal.getRatio(), RevenueMath.yen(adj)));
        }
        return relative(LABEL_VELOCITY, 0, String.format("sales pace at %.1fx of plan is within range", signal.getRatio()));
    }

    private ElasticityOutcome elasticityAdjustments(InventoryUnit unit, OptionalInt leadDays, Instant referenceTime,
                                                    LocalDate referenceDate, EngineSettings settings) {
        long base = unit.getBasePrice();
        if (leadDays.isEmpty()) {
            return new ElasticityOutcome(List.of(
                notApplicable(LABEL_ELASTICITY, "demand elasticity not applicable: departure date not set"),
                notApplicable(LABEL_DECAY, "inventory decay not applicable: departure date not set")),
                null);
        }

        int lead = leadDays.getAsInt();
        double targetPace = (double) unit.getRemainingCapacity() / Math.max(lead, 1);
        double currentPace = forecastService.baselinePace(
                unit.getId(), unit.getTotalCapacity(), lead, referenceTime, settings).dailyPace()
            * ForecastScenario.BASE.multiplier(settings);
        if (currentPace <= 0) {
            currentPace = historicalPace(unit, referenceDate);
        }

        double multiplier = 1.0;
        PriceAdjustment elasticity;
        if (currentPace <= 0) {
            elasticity = relative(LABEL_ELASTICITY, 0, "no sales pace available: demand elasticity skipped");
        } else {
            double paceRatio = RevenueMath.clamp(targetPace / currentPace, MIN_PACE_RATIO, MAX_PACE_RATIO);
            double coefficient = elasticity(unit, settings);
            multiplier = Math.pow(paceRatio, 1.0 / coefficient);
            long adj = Math.round(base * (multiplier - 1.0));
            elasticity = relative(LABEL_ELASTICITY, adj, String.format(
                "target pace %.2f/day vs current %.2f/day at elasticity %.2f: multiplier %.3f (%s)",
                targetPace, currentPace, coefficient, multiplier, RevenueMath.yen(adj)));
        }

        int horizon = unit.horizonDays().isPresent() && unit.horizonDays().getAsInt() > 0
            ? unit.horizonDays().getAsInt()
            : settings.getDefaultHorizonDays();
        horizon = Math.max(horizon, lead);
        double decay = InventoryDecayCurve.factor(lead, horizon, settings.getDecaySteepness(), settings.getDecayMidpoint());
        long decayAdj = Math.round(base * multiplier * (decay - 1.0));
        PriceAdjustment decayAdjustment = relative(LABEL_DECAY, decayAdj, String.format(
            "%d of %d horizon days left: residual value %.0f%% (%s)",
            Math.max(lead, 0), horizon, decay * 100.0, RevenueMath.yen(decayAdj)));

        return new ElasticityOutcome(List.of(elasticity, decayAdjustment), RevenueMath.round(decay, 4));
    }

    private double historicalPace(InventoryUnit unit, LocalDate referenceDate) {
        if (unit.getProcurementDate() == null) {
            return 0.0;
        }
        long age = Math.max(1, ChronoUnit.DAYS.between(unit.getProcurementDate(), referenceDate));
        return (double) unit.soldCapacity() / age;
    }

    private double elasticity(InventoryUnit unit, EngineSettings settings) {
        Double coefficient = unit.getPriceElasticity();
        if (coefficient == null || coefficient == 0.0 || coefficient.isNaN()) {
            return -Math.abs(settings.getDefaultElasticity());
        }
        return -Math.abs(coefficient);
    }

    private PriceAdjustment relative(String label, long value, String reason) {
        return PriceAdjustment.builder()
            .label(label).value(value).measure(AdjustmentMeasure.RELATIVE).reason(reason).build();
    }

    private PriceAdjustment notApplicable(String label, String reason) {
        return PriceAdjustment.builder()
            .label(label).value(0).measure(AdjustmentMeasure.RELATIVE).reason(reason).applicable(false).build();
    }

    private record ElasticityOutcome(List<PriceAdjustment> adjustments, Double decayFactor) {}
}
