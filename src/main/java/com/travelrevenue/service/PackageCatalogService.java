package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.PackageOffer;
import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.PricingStrategy;
import com.travelrevenue.entity.InventoryUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Catalog of every flight + hotel package, ranked by strategy score so the most
 * urgent hotel stock paired with the most in-demand flights comes first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackageCatalogService {

    private final PricingService pricingService;
    private final BundleScoringService scoringService;

    public List<PackageOffer> rankPackages(List<InventoryUnit> units, Instant referenceTime, EngineSettings settings) {
        LocalDate referenceDate = referenceTime.atZone(ZoneOffset.UTC).toLocalDate();
        Map<InventoryUnit, PricingResult> flights = new LinkedHashMap<>();
        Map<InventoryUnit, PricingResult> hotels = new LinkedHashMap<>();

        units.stream()
            .sorted(Comparator.comparing(InventoryUnit::getId))
            .forEach(unit -> {
                try {
                    PricingResult pricing = pricingService.price(unit, settings, referenceTime, PricingStrategy.RULE_BASED);
                    switch (unit.getKind()) {
                        case HOTEL -> hotels.put(unit, pricing);
                        case FLIGHT -> flights.put(unit, pricing);
                    }
                } catch (RuntimeException ex) {
                    log.warn("Unit left out of package catalog | unitId={} | reason={}", unit.getId(), ex.getMessage());
                }
            });

        List<PackageOffer> offers = new ArrayList<>();
        flights.forEach((flight, flightPrice) -> hotels.forEach((hotel, hotelPrice) ->
            offers.add(offer(flight, flightPrice, hotel, hotelPrice, referenceDate, settings))));

        offers.sort(Comparator.comparingDouble(PackageOffer::getStrategyScore).reversed()
            .thenComparing(PackageOffer::getFlightUnitId)
            .thenComparing(PackageOffer::getHotelUnitId));

        List<PackageOffer> ranked = IntStream.range(0, offers.size())
            .mapToObj(i -> offers.get(i).toBuilder().rank(i + 1).build())
            .toList();

        log.info("Package catalog built | flights={} | hotels={} | packages={}",
            flights.size(), hotels.size(), ranked.size());
        return ranked;
    }

    private PackageOffer offer(InventoryUnit flight, PricingResult flightPrice, InventoryUnit hotel,
                               PricingResult hotelPrice, LocalDate referenceDate, EngineSettings settings) {
        double urgency = scoringService.urgency(hotel.getRemainingCapacity(), hotel.getTotalCapacity(),
            hotel.leadDays(referenceDate));
        long discount = scoringService.bundleDiscount(hotel.getBasePrice(), hotelPrice.getFinalPrice(), urgency, settings);
        long sum = flightPrice.getFinalPrice() + hotelPrice.getFinalPrice();
        double score = scoringService.strategyScore(urgency, flight.getRemainingCapacity(), flight.getTotalCapacity());

        String reason = String.format(
            "Hotel urgency %.2f with %d%% of rooms left, hotel sales %s; flight %d%% sold, flight sales %s; package discount %s",
            urgency, RevenueMath.percent(hotel.remainingRatio()), scoringService.velocityNote(hotelPrice.getVelocitySignal()),
            RevenueMath.percent(1.0 - flight.remainingRatio()), scoringService.velocityNote(flightPrice.getVelocitySignal()),
            RevenueMath.yen(discount));

        return PackageOffer.builder()
            .flightUnitId(flight.getId())
            .flightName(flight.getName())
            .hotelUnitId(hotel.getId())
            .hotelName(hotel.getName())
            .flightBasePrice(flight.getBasePrice())
            .hotelBasePrice(hotel.getBasePrice())
            .flightDynamicPrice(flightPrice.getFinalPrice())
            .hotelDynamicPrice(hotelPrice.getFinalPrice())
            .flightVelocity(flightPrice.getVelocitySignal())
            .hotelVelocity(hotelPrice.getVelocitySignal())
            .sumDynamicPrice(sum)
            .hotelUrgencyScore(RevenueMath.round(urgency, 3))
            .bundleDiscount(discount)
            .finalPackagePrice(sum + discount)
            .strategyScore(RevenueMath.round(score, 3))
            .reason(reason)
            .build();
    }
}
