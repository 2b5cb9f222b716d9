package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.PricingStrategy;
import com.travelrevenue.dto.SimulationDay;
import com.travelrevenue.dto.SimulationLeg;
import com.travelrevenue.dto.SimulationResult;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import com.travelrevenue.exception.InvalidPairingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Day-by-day comparison of selling a hotel and a flight separately (scenario A)
 * against bundling them first and reverting to standalone once a leg runs out
 * (scenario B). Days count down from the horizon to departure at day 0, where
 * whatever is left is written off at cost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesSimulationService {

    private static final double EPS = 1e-9;

    private final PricingService pricingService;
    private final DemandForecastService forecastService;

    public SimulationResult simulate(InventoryUnit first, InventoryUnit second, long discount, int horizonDays,
                                     ForecastScenario scenario, Instant referenceTime, EngineSettings settings) {
        if (first.getKind() == second.getKind()) {
            throw new InvalidPairingException("A hotel and a flight are required, got two units of kind "
                + first.getKind() + " (ids " + first.getId() + ", " + second.getId() + ")");
        }
        InventoryUnit hotel = switch (first.getKind()) {
            case HOTEL -> first;
            case FLIGHT -> second;
        };
        InventoryUnit flight = hotel == first ? second : first;
        return simulate(leg(hotel, scenario, referenceTime, settings), leg(flight, scenario, referenceTime, settings),
            discount, horizonDays, scenario, settings);
    }

    /** Prices the unit with the rule-based strategy and attaches its scenario pace. */
    public SimulationLeg leg(InventoryUnit unit, ForecastScenario scenario, Instant referenceTime, EngineSettings settings) {
        PricingResult pricing = pricingService.price(unit, settings, referenceTime, PricingStrategy.RULE_BASED);
        return SimulationLeg.builder()
            .unitId(unit.getId())
            .name(unit.getName())
            .kind(unit.getKind())
            .remaining(Math.max(0, unit.getRemainingCapacity()))
            .price(pricing.getFinalPrice())
            .cost(Math.round(unit.getBasePrice() * settings.getCostRatio()))
            .dailyPace(forecastService.scenarioPace(unit, scenario, referenceTime, settings))
            .velocitySignal(pricing.getVelocitySignal())
            .build();
    }

    public SimulationResult simulate(SimulationLeg hotel, SimulationLeg flight, long discount, int horizonDays,
                                     ForecastScenario scenario, EngineSettings settings) {
        if (hotel.getKind() != UnitKind.HOTEL || flight.getKind() != UnitKind.FLIGHT) {
            throw new InvalidPairingException("Expected a hotel leg and a flight leg, got "
                + hotel.getKind() + " and " + flight.getKind());
        }
        int horizon = Math.max(0, horizonDays);
        long discountAmount = Math.abs(discount);
        long cannibalization = cannibalizationPerPackage(flight, settings);
        long packageUnitProfit = hotel.margin() + flight.margin() - discountAmount - cannibalization;
        double packagePace = packagePace(hotel, discountAmount, settings);

        LegState hotelA = new LegState(hotel.getRemaining());
        LegState flightA = new LegState(flight.getRemaining());
        LegState hotelB = new LegState(hotel.getRemaining());
        LegState flightB = new LegState(flight.getRemaining());
        double packageCarry = 0.0;
        long profitA = 0;
        long profitB = 0;
        int packagesSold = 0;
        List<SimulationDay> history = new ArrayList<>(horizon + 1);

        for (int t = horizon; t >= 1; t--) {
            int hotelSold = hotelA.sell(hotel.getDailyPace());
            int flightSold = flightA.sell(flight.getDailyPace());
            profitA += hotelSold * hotel.margin() + flightSold * flight.margin();

            if (hotelB.stock > 0 && flightB.stock > 0) {
                packageCarry += packagePace;
                int demand = wholeUnits(packageCarry);
                packageCarry -= demand;
                int packages = Math.min(demand, Math.min(hotelB.stock, flightB.stock));
                hotelB.take(packages);
                flightB.take(packages);
                packagesSold += packages;
                profitB += packages * packageUnitProfit;
                profitB += flightB.sell(flight.getDailyPace()) * flight.margin();
            } else {
                profitB += hotelB.sell(hotel.getDailyPace()) * hotel.margin();
                profitB += flightB.sell(flight.getDailyPace()) * flight.margin();
            }

            double decay = InventoryDecayCurve.factor(t, horizon, settings.getDecaySteepness(), settings.getDecayMidpoint());
            history.add(day(t, profitA, profitB, hotelA, flightA, hotelB, flightB, packagesSold, decay,
                Math.round((hotelB.stock * hotel.getCost() + flightB.stock * flight.getCost()) * decay)));
        }

        long wasteA = hotelA.stock * hotel.getCost() + flightA.stock * flight.getCost();
        long wasteB = hotelB.stock * hotel.getCost() + flightB.stock * flight.getCost();
        profitA -= wasteA;
        profitB -= wasteB;
        history.add(day(0, profitA, profitB, hotelA, flightA, hotelB, flightB, packagesSold, 0.0, 0));

        log.debug("Simulation complete | hotel={} | flight={} | horizon={} | profitA={} | profitB={} | packages={}",
            hotel.getUnitId(), flight.getUnitId(), horizon, profitA, profitB, packagesSold);

        return SimulationResult.builder()
            .hotelUnitId(hotel.getUnitId())
            .flightUnitId(flight.getUnitId())
            .scenario(scenario)
            .horizonDays(horizon)
            .discount(-discountAmount)
            .packageDailyPace(RevenueMath.round(packagePace, 4))
            .packageUnitProfit(packageUnitProfit)
            .cannibalizationPerPackage(cannibalization)
            .profitA(profitA)
            .profitB(profitB)
            .gain(profitB - profitA)
            .packagesSold(packagesSold)
            .wasteCostA(wasteA)
            .wasteCostB(wasteB)
            .history(List.copyOf(history))
            .build();
    }

    /** Profit of one leg selling on its own over the horizon, net of write-off. */
    public long standaloneProfit(SimulationLeg leg, int horizonDays) {
        LegState state = new LegState(leg.getRemaining());
        long profit = 0;
        for (int t = Math.max(0, horizonDays); t >= 1; t--) {
            profit += state.sell(leg.getDailyPace()) * leg.margin();
        }
        return profit - state.stock * leg.getCost();
    }

    long cannibalizationPerPackage(SimulationLeg flight, EngineSettings settings) {
        double margin = Math.max(0, flight.margin());
        if (!flight.getVelocitySignal().isMeasured()) {
            return Math.round(margin * settings.getCannibalizationBaseRate());
        }
        return Math.round(margin * Math.max(0.0, flight.getVelocitySignal().getRatio() - 1.0));
    }

    double packagePace(SimulationLeg hotel, long discountAmount, EngineSettings settings) {
        double lift = settings.getReferenceDiscount() > 0
            ? 1.0 + (double) discountAmount / settings.getReferenceDiscount()
            : 1.0;
        return Math.max(0.0, hotel.getDailyPace()) * settings.getBundleVelocityBoost() * lift;
    }

    private static SimulationDay day(int t, long profitA, long profitB, LegState hotelA, LegState flightA,
                                     LegState hotelB, LegState flightB, int packagesSold,
                                     double decay, long residual) {
        return SimulationDay.builder()
            .dayIndex(t)
            .profitA(profitA)
            .profitB(profitB)
            .hotelStockA(hotelA.stock)
            .flightStockA(flightA.stock)
            .hotelStockB(hotelB.stock)
            .flightStockB(flightB.stock)
            .hotelSoldA(hotelA.sold)
            .flightSoldA(flightA.sold)
            .packagesSold(packagesSold)
            .decayFactor(RevenueMath.round(decay, 4))
            .residualAssetValue(residual)
            .build();
    }

    private static int wholeUnits(double carry) {
        return (int) Math.floor(carry + EPS);
    }

    /** Remaining stock of one leg in one scenario, with fractional demand carried day to day. */
    private static final class LegState {
        private int stock;
        private int sold;
        private double carry;

        private LegState(int stock) {
            this.stock = stock;
        }

        int sell(double pace) {
            carry += Math.max(0.0, pace);
            int demand = wholeUnits(carry);
            carry -= demand;
            int units = Math.min(demand, stock);
            take(units);
            return units;
        }

        void take(int units) {
            stock -= units;
            sold += units;
        }
    }
}
