package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.DemandForecast;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.OptimizationReport;
import com.travelrevenue.dto.PackageOffer;
import com.travelrevenue.dto.PricingAlert;
import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.PricingStrategy;
import com.travelrevenue.dto.SimulationResult;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.PriceHistoryRecord;
import com.travelrevenue.exception.UnitNotFoundException;
import com.travelrevenue.repository.InventoryUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point for callers working with unit ids. Each call loads the inventory
 * snapshot once, fixes the reference time from the clock and runs the engine
 * with the configured settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RevenueEngineService {

    private final InventoryUnitRepository unitRepository;
    private final PricingService pricingService;
    private final DemandForecastService forecastService;
    private final SalesSimulationService simulationService;
    private final BundleOptimizerService optimizerService;
    private final PackageCatalogService catalogService;
    private final PricingAlertService alertService;
    private final EventLogService eventLogService;
    private final EngineSettings defaultEngineSettings;
    private final Clock clock;

    public PricingResult price(Long unitId, PricingStrategy strategy) {
        return price(unitId, strategy, clock.instant(), defaultEngineSettings);
    }

    public PricingResult price(Long unitId, PricingStrategy strategy, Instant referenceTime, EngineSettings settings) {
        return pricingService.price(load(unitId), settings, referenceTime, strategy);
    }

    public List<PricingResult> priceAll(PricingStrategy strategy) {
        return priceAll(unitRepository.findAllByOrderByIdAsc(), strategy, clock.instant(), defaultEngineSettings);
    }

    public DemandForecast forecast(Long unitId) {
        return forecastService.forecast(load(unitId), clock.instant(), defaultEngineSettings);
    }

    public OptimizationReport recommend(ForecastScenario scenario) {
        return optimizerService.recommend(unitRepository.findAllByOrderByIdAsc(), scenario,
            clock.instant(), defaultEngineSettings);
    }

    /** Recommendation pass over a subset; unknown ids fail the call before any computation. */
    public OptimizationReport recommend(Collection<Long> unitIds, ForecastScenario scenario,
                                        Instant referenceTime, EngineSettings settings) {
        return optimizerService.recommend(loadAll(unitIds), scenario, referenceTime, settings);
    }

    public SimulationResult simulate(Long unitA, Long unitB, long discount, int horizonDays, ForecastScenario scenario) {
        return simulate(unitA, unitB, discount, horizonDays, scenario, clock.instant(), defaultEngineSettings);
    }

    public SimulationResult simulate(Long unitA, Long unitB, long discount, int horizonDays,
                                     ForecastScenario scenario, Instant referenceTime, EngineSettings settings) {
        return simulationService.simulate(load(unitA), load(unitB), discount, horizonDays,
            scenario, referenceTime, settings);
    }

    public List<PackageOffer> packages() {
        return catalogService.rankPackages(unitRepository.findAllByOrderByIdAsc(), clock.instant(), defaultEngineSettings);
    }

    public List<PricingAlert> alerts() {
        List<InventoryUnit> units = unitRepository.findAllByOrderByIdAsc();
        Instant now = clock.instant();
        return alertService.alerts(
            priceAll(units, PricingStrategy.RULE_BASED, now, defaultEngineSettings),
            catalogService.rankPackages(units, now, defaultEngineSettings));
    }

    /** Prices every unit and appends the result to the price history. */
    @Transactional
    public List<PriceHistoryRecord> recordSnapshot(PricingStrategy strategy) {
        Instant now = clock.instant();
        List<PricingResult> results = priceAll(unitRepository.findAllByOrderByIdAsc(), strategy, now, defaultEngineSettings);
        return eventLogService.recordPriceSnapshot(results, now);
    }

    private List<PricingResult> priceAll(List<InventoryUnit> units, PricingStrategy strategy,
                                         Instant referenceTime, EngineSettings settings) {
        List<PricingResult> results = new ArrayList<>();
        for (InventoryUnit unit : units) {
            try {
                results.add(pricingService.price(unit, settings, referenceTime, strategy));
            } catch (RuntimeException ex) {
                log.warn("Unit skipped in pricing pass | unitId={} | reason={}", unit.getId(), ex.getMessage());
            }
        }
        log.info("Pricing pass | strategy={} | units={} | priced={}", strategy, units.size(), results.size());
        return results;
    }

    private InventoryUnit load(Long unitId) {
        return unitRepository.findById(unitId)
            .orElseThrow(() -> new UnitNotFoundException(unitId));
    }

    private List<InventoryUnit> loadAll(Collection<Long> unitIds) {
        List<InventoryUnit> units = unitRepository.findByIdInOrderByIdAsc(unitIds);
        if (units.size() < unitIds.size()) {
            unitIds.stream()
                .filter(id -> units.stream().noneMatch(u -> u.getId().equals(id)))
                .findFirst()
                .ifPresent(id -> {
                    throw new UnitNotFoundException(id);
                });
        }
        return units;
    }
}
