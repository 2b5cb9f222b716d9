package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.DemandForecast;
import com.travelrevenue.dto.ForecastResult;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.PaceSource;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.repository.BookingEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Projects end-of-horizon sales and profit under the pessimistic, base and
 * optimistic scenarios. Unsold stock is written off at cost on departure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemandForecastService {

    private static final int MIN_THEORETICAL_HORIZON = 30;

    private final BookingEventRepository eventRepository;

    public DemandForecast forecast(InventoryUnit unit, Instant referenceTime, EngineSettings settings) {
        int leadDays = unit.leadDays(referenceTime.atZone(ZoneOffset.UTC).toLocalDate()).orElse(0);
        long cost = Math.round(unit.getBasePrice() * settings.getCostRatio());
        return forecast(unit.getId(), leadDays, unit.getRemainingCapacity(), unit.getTotalCapacity(),
            unit.getBasePrice(), cost, referenceTime, settings);
    }

    public DemandForecast forecast(Long unitId, int leadDays, int remaining, int total,
                                   long price, long cost, Instant referenceTime, EngineSettings settings) {
        PaceEstimate baseline = baselinePace(unitId, total, leadDays, referenceTime, settings);
        int sellingDays = Math.max(leadDays, 0);

        Map<ForecastScenario, ForecastResult> scenarios = new EnumMap<>(ForecastScenario.class);
        for (ForecastScenario scenario : ForecastScenario.values()) {
            double pace = baseline.dailyPace() * scenario.multiplier(settings);
            double sold = Math.min(remaining, pace * sellingDays);
            double unsold = remaining - sold;
            double netProfit = sold * (price - cost) - unsold * cost;
            scenarios.put(scenario, ForecastResult.builder()
                .scenario(scenario)
                .dailyPace(RevenueMath.round(pace, 4))
                .predictedSold(RevenueMath.round(sold, 2))
                .predictedUnsold(RevenueMath.round(unsold, 2))
                .expectedNetProfit(Math.round(netProfit))
                .build());
        }

        log.debug("Forecast computed | unitId={} | lead={} | pace={} | source={}",
            unitId, leadDays, baseline.dailyPace(), baseline.source());

        return DemandForecast.builder()
            .unitId(unitId)
            .leadDays(leadDays)
            .remaining(remaining)
            .price(price)
            .cost(cost)
            .baselineDailyPace(RevenueMath.round(baseline.dailyPace(), 4))
            .paceSource(baseline.source())
            .scenarios(Collections.unmodifiableMap(scenarios))
            .build();
    }

    /** Daily pace for one scenario; the pace the simulator uses for a leg. */
    public double scenarioPace(InventoryUnit unit, ForecastScenario scenario,
                               Instant referenceTime, EngineSettings settings) {
        int leadDays = unit.leadDays(referenceTime.atZone(ZoneOffset.UTC).toLocalDate()).orElse(0);
        return baselinePace(unit.getId(), unit.getTotalCapacity(), leadDays, referenceTime, settings)
            .dailyPace() * scenario.multiplier(settings);
    }

    PaceEstimate baselinePace(Long unitId, int total, int leadDays, Instant referenceTime, EngineSettings settings) {
        int lookback = Math.max(1, settings.getForecastLookbackDays());
        long recent = eventRepository.sumQuantityBetween(
            unitId, referenceTime.minus(Duration.ofDays(lookback)), referenceTime);
        if (recent > 0) {
            return new PaceEstimate((double) recent / lookback, PaceSource.RECENT_ACTIVITY);
        }
        double theoretical = total * settings.getTheoreticalSellThrough()
            / Math.max(leadDays, MIN_THEORETICAL_HORIZON);
        return new PaceEstimate(theoretical, PaceSource.THEORETICAL);
    }

    record PaceEstimate(double dailyPace, PaceSource source) {}
}
