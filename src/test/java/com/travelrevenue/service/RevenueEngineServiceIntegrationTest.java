package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.OptimizationReport;
import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.PricingStrategy;
import com.travelrevenue.dto.RevenueLiftResponse;
import com.travelrevenue.dto.SaleRecordRequest;
import com.travelrevenue.dto.SimulationResult;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.PriceHistoryRecord;
import com.travelrevenue.entity.UnitKind;
import com.travelrevenue.exception.UnitNotFoundException;
import com.travelrevenue.repository.InventoryUnitRepository;
import com.travelrevenue.repository.PriceHistoryRepository;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class RevenueEngineServiceIntegrationTest {

    private static final Instant NOW = Instant.parse("2025-06-01T09:00:00Z");

    @Autowired RevenueEngineService engine;
    @Autowired EventLogService eventLogService;
    @Autowired PerformanceMetricsService metricsService;
    @Autowired InventoryUnitRepository unitRepository;
    @Autowired PriceHistoryRepository historyRepository;
    @Autowired EngineSettings settings;

    private InventoryUnit hotel;
    private InventoryUnit flight;

    @BeforeEach
    void setUp() {
        LocalDate departure = LocalDate.of(2025, 6, 11);
        hotel = unitRepository.save(InventoryUnit.builder()
            .kind(UnitKind.HOTEL).name("Harbor View Hotel")
            .totalCapacity(40).remainingCapacity(36).basePrice(20000)
            .departureDate(departure).procurementDate(departure.minusDays(90))
            .build());
        flight = unitRepository.save(InventoryUnit.builder()
            .kind(UnitKind.FLIGHT).name("NH 101")
            .totalCapacity(60).remainingCapacity(30).basePrice(30000)
            .departureDate(departure).procurementDate(departure.minusDays(120))
            .build());
    }

    private SaleRecordRequest.SaleRecordRequestBuilder sale(Long unitId) {
        return SaleRecordRequest.builder()
            .unitId(unitId).bookedAt(NOW.minusSeconds(3600)).quantity(2)
            .soldPrice(31500).basePriceAtSale(30000);
    }

    @Test
    void settings_boundFromConfiguration() {
        assertThat(settings.getBrakeThreshold()).isEqualTo(1.5);
        assertThat(settings.getBundleGainThreshold()).isEqualTo(5000);
        assertThat(settings.getDecayMidpoint()).isEqualTo(0.12);
    }

    @Test
    void price_readsVelocityFromAppendedSales() {
        eventLogService.appendSale(sale(flight.getId()).quantity(8).build());

        PricingResult result = engine.price(flight.getId(), PricingStrategy.RULE_BASED, NOW, settings);

        assertThat(result.getVelocitySignal().isMeasured()).isTrue();
        assertThat(result.getVelocitySignal().getRatio()).isEqualTo(1.481);
        assertThat(result.isBrakeActive()).isFalse();
        assertThat(result.getFinalPrice()).isBetween(result.getMinPrice(), result.getMaxPrice());
    }

    @Test
    void price_unknownUnit_throwsNotFound() {
        assertThatThrownBy(() -> engine.price(Long.MAX_VALUE, PricingStrategy.RULE_BASED))
            .isInstanceOf(UnitNotFoundException.class)
            .extracting("errorCode").isEqualTo("UNIT_NOT_FOUND");
    }

    @Test
    void appendSale_invalidQuantity_rejected() {
        assertThatThrownBy(() -> eventLogService.appendSale(sale(flight.getId()).quantity(0).build()))
            .isInstanceOf(ConstraintViolationException.class)
            .hasMessageContaining("quantity");
    }

    @Test
    void appendSale_feedsRevenueLift() {
        eventLogService.appendSale(sale(flight.getId()).build());

        RevenueLiftResponse lift = metricsService.revenueLift(List.of(flight.getId()));

        assertThat(lift.getTotalDynamic()).isEqualTo(63000);
        assertThat(lift.getLift()).isEqualTo(3000);
        assertThat(lift.getLiftPct()).isEqualTo(5.0);
    }

    @Test
    void simulate_byIdsInEitherOrder() {
        SimulationResult result = engine.simulate(flight.getId(), hotel.getId(), 3000, 10,
            ForecastScenario.BASE, NOW, settings);

        assertThat(result.getHotelUnitId()).isEqualTo(hotel.getId());
        assertThat(result.getPackagesSold()).isLessThanOrEqualTo(30);
        assertThat(result.getGain()).isEqualTo(result.getProfitB() - result.getProfitA());
    }

    @Test
    void recommend_subsetOfUnits() {
        OptimizationReport report = engine.recommend(List.of(hotel.getId(), flight.getId()),
            ForecastScenario.BASE, NOW, settings);

        assertThat(report.getExcludedUnitIds()).isEmpty();
        assertThat(report.getRecommendations()).hasSize(1);
        assertThat(report.getRecommendations().get(0).getFlightUnitId()).isEqualTo(flight.getId());
    }

    @Test
    void recommend_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> engine.recommend(List.of(hotel.getId(), Long.MAX_VALUE),
            ForecastScenario.BASE, NOW, settings))
            .isInstanceOf(UnitNotFoundException.class);
    }

    @Test
    void recordSnapshot_appendsPriceHistory() {
        List<PriceHistoryRecord> rows = engine.recordSnapshot(PricingStrategy.DEMAND_ELASTICITY);

        assertThat(rows).extracting(PriceHistoryRecord::getUnitId).contains(hotel.getId(), flight.getId());
        assertThat(historyRepository.findByUnitIdOrderByRecordedAtAsc(hotel.getId())).hasSize(1);
    }
}
