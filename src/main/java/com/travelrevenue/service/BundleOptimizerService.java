package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.BundleRecommendation;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.OptimizationReport;
import com.travelrevenue.dto.RecommendationAction;
import com.travelrevenue.dto.SimulationLeg;
import com.travelrevenue.dto.SimulationResult;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pairs hotels with same-day flights. Every candidate pair is simulated, each
 * hotel keeps its best flight, and hotels claim flights greedily in order of
 * gain. A hotel whose best flight is already taken stays standalone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BundleOptimizerService {

    private final SalesSimulationService simulationService;
    private final BundleScoringService scoringService;

    public OptimizationReport recommend(List<InventoryUnit> units, ForecastScenario scenario,
                                        Instant referenceTime, EngineSettings settings) {
        LocalDate referenceDate = referenceTime.atZone(ZoneOffset.UTC).toLocalDate();
        List<Long> excluded = new ArrayList<>();
        Map<Long, Candidate> eligible = new LinkedHashMap<>();

        units.stream()
            .sorted(Comparator.comparing(InventoryUnit::getId))
            .forEach(unit -> {
                OptionalInt lead = unit.leadDays(referenceDate);
                if (lead.isEmpty()) {
                    log.debug("Unit excluded from bundling | unitId={} | departure=unset", unit.getId());
                    excluded.add(unit.getId());
                    return;
                }
                int sellingDays = Math.max(lead.getAsInt(), 0);
                try {
                    SimulationLeg leg = simulationService.leg(unit, scenario, referenceTime, settings);
                    long standalone = simulationService.standaloneProfit(leg, sellingDays);
                    eligible.put(unit.getId(), new Candidate(unit, leg, sellingDays, standalone));
                } catch (RuntimeException ex) {
                    log.warn("Unit excluded from bundling | unitId={} | reason={}", unit.getId(), ex.getMessage());
                    excluded.add(unit.getId());
                }
            });

        Map<LocalDate, List<Candidate>> byDeparture = new TreeMap<>();
        // departing today or earlier: no selling days left, written off as standalone
        eligible.values().stream()
            .filter(c -> c.leadDays() > 0)
            .forEach(c -> byDeparture.computeIfAbsent(c.unit().getDepartureDate(), d -> new ArrayList<>()).add(c));

        List<Pairing> pairings = new ArrayList<>();
        byDeparture.values().forEach(sameDay -> pairings.addAll(bestPartners(sameDay, scenario, settings)));
        pairings.sort(Comparator.comparingLong(Pairing::gain).reversed()
            .thenComparing(p -> p.hotel().unit().getId()));

        Set<Long> claimedFlights = new HashSet<>();
        List<BundleRecommendation> recommendations = new ArrayList<>();
        long totalStandalone = eligible.values().stream().mapToLong(Candidate::standaloneProfit).sum();
        long totalOptimized = totalStandalone;

        for (Pairing pairing : pairings) {
            Long flightId = pairing.flight().unit().getId();
            boolean claimed = claimedFlights.contains(flightId);
            boolean bundle = !claimed && pairing.gain() > settings.getBundleGainThreshold();
            if (bundle) {
                claimedFlights.add(flightId);
                totalOptimized += pairing.simulation().getProfitB()
                    - pairing.hotel().standaloneProfit() - pairing.flight().standaloneProfit();
            }
            recommendations.add(toRecommendation(pairing, bundle, claimed, settings));
        }

        OptimizationReport report = OptimizationReport.builder()
            .scenario(scenario)
            .referenceTime(referenceTime)
            .recommendations(List.copyOf(recommendations))
            .totalStandaloneProfit(totalStandalone)
            .totalOptimizedProfit(totalOptimized)
            .uplift(totalOptimized - totalStandalone)
            .excludedUnitIds(List.copyOf(excluded))
            .build();

        log.info("Recommendation pass | scenario={} | units={} | bundles={} | uplift={} | excluded={}",
            scenario, units.size(), report.bundleCount(), report.getUplift(), excluded.size());
        return report;
    }

    private List<Pairing> bestPartners(List<Candidate> sameDay, ForecastScenario scenario, EngineSettings settings) {
        List<Candidate> hotels = sameDay.stream().filter(c -> c.unit().getKind() == UnitKind.HOTEL).toList();
        List<Candidate> flights = sameDay.stream().filter(c -> c.unit().getKind() == UnitKind.FLIGHT).toList();
        Map<Long, Pairing> best = new HashMap<>();
        List<Pairing> result = new ArrayList<>();

        for (Candidate hotel : hotels) {
            for (Candidate flight : flights) {
                long discount = scoringService.estimatedBundleDiscount(
                    hotel.leg().getPrice(), flight.leg().getPrice(), settings);
                try {
                    SimulationResult sim = simulationService.simulate(
                        hotel.leg(), flight.leg(), discount, hotel.leadDays(), scenario, settings);
                    Pairing current = best.get(hotel.unit().getId());
                    if (current == null || sim.getGain() > current.gain()) {
                        best.put(hotel.unit().getId(), new Pairing(hotel, flight, discount, sim));
                    }
                } catch (RuntimeException ex) {
                    log.warn("Pair skipped | hotelId={} | flightId={} | reason={}",
                        hotel.unit().getId(), flight.unit().getId(), ex.getMessage());
                }
            }
            Pairing chosen = best.get(hotel.unit().getId());
            if (chosen != null) {
                result.add(chosen);
            }
        }
        return result;
    }

    private BundleRecommendation toRecommendation(Pairing pairing, boolean bundle, boolean flightClaimed,
                                                  EngineSettings settings) {
        InventoryUnit hotel = pairing.hotel().unit();
        InventoryUnit flight = pairing.flight().unit();
        SimulationLeg hotelLeg = pairing.hotel().leg();
        SimulationLeg flightLeg = pairing.flight().leg();
        double urgency = scoringService.urgency(hotel.getRemainingCapacity(), hotel.getTotalCapacity(),
            OptionalInt.of(pairing.hotel().leadDays()));
        double score = scoringService.strategyScore(urgency, flight.getRemainingCapacity(), flight.getTotalCapacity());
        long discount = Math.abs(pairing.discount());

        String justification;
        if (bundle) {
            justification = String.format(
                "Bundle with %s: %s over standalone, %d packages at %.2f/day vs hotel pace %.2f/day",
                flight.getName(), RevenueMath.yen(pairing.gain()), pairing.simulation().getPackagesSold(),
                pairing.simulation().getPackageDailyPace(), hotelLeg.getDailyPace());
        } else if (flightClaimed) {
            justification = String.format(
                "Stay standalone: best partner %s already bundled with a higher-gain hotel; hotel pace %.2f/day",
                flight.getName(), hotelLeg.getDailyPace());
        } else {
            justification = String.format(
                "Stay standalone: best gain %s does not exceed %s; hotel pace %.2f/day, flight pace %.2f/day",
                RevenueMath.yen(pairing.gain()), RevenueMath.yen(settings.getBundleGainThreshold()),
                hotelLeg.getDailyPace(), flightLeg.getDailyPace());
        }

        return BundleRecommendation.builder()
            .hotelUnitId(hotel.getId())
            .hotelName(hotel.getName())
            .flightUnitId(flight.getId())
            .flightName(flight.getName())
            .departureDate(hotel.getDepartureDate())
            .action(bundle ? RecommendationAction.BUNDLE : RecommendationAction.STANDALONE)
            .hotelPrice(hotelLeg.getPrice())
            .flightPrice(flightLeg.getPrice())
            .discount(-discount)
            .proposedBundlePrice(hotelLeg.getPrice() + flightLeg.getPrice() - discount)
            .estimatedGain(pairing.gain())
            .strategyScore(RevenueMath.round(score, 3))
            .urgencyScore(RevenueMath.round(urgency, 3))
            .justification(justification)
            .build();
    }

    private record Candidate(InventoryUnit unit, SimulationLeg leg, int leadDays, long standaloneProfit) {}

    private record Pairing(Candidate hotel, Candidate flight, long discount, SimulationResult simulation) {
        long gain() {
            return simulation.getGain();
        }
    }
}
