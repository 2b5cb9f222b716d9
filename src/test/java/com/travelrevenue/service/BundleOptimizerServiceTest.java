package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.BundleRecommendation;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.OptimizationReport;
import com.travelrevenue.dto.RecommendationAction;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import com.travelrevenue.repository.BookingEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class BundleOptimizerServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    @Mock BookingEventRepository eventRepository;

    private BundleOptimizerService optimizer;
    private final EngineSettings settings = EngineSettings.defaults();

    @BeforeEach
    void setUp() {
        lenient().when(eventRepository.sumQuantityBetween(any(), any(), any())).thenReturn(0L);
        DemandForecastService forecastService = new DemandForecastService(eventRepository);
        PricingService pricingService = new PricingService(new VelocitySignalService(eventRepository), forecastService);
        optimizer = new BundleOptimizerService(
            new SalesSimulationService(pricingService, forecastService), new BundleScoringService());
    }

    private InventoryUnit hotel(Long id, LocalDate departure) {
        return InventoryUnit.builder()
            .id(id).kind(UnitKind.HOTEL).name("Hotel " + id)
            .totalCapacity(100).remainingCapacity(90).basePrice(20000)
            .departureDate(departure)
            .build();
    }

    private InventoryUnit flight(Long id, LocalDate departure) {
        return InventoryUnit.builder()
            .id(id).kind(UnitKind.FLIGHT).name("Flight " + id)
            .totalCapacity(100).remainingCapacity(90).basePrice(30000)
            .departureDate(departure)
            .build();
    }

    @Test
    void recommend_twoHotelsOneFlight_higherRankedHotelClaimsFlight() {
        LocalDate departure = TODAY.plusDays(10);
        List<InventoryUnit> units = List.of(hotel(1L, departure), hotel(2L, departure), flight(3L, departure));

        OptimizationReport report = optimizer.recommend(units, ForecastScenario.BASE, NOW, settings);

        assertThat(report.getRecommendations()).hasSize(2);
        BundleRecommendation winner = report.getRecommendations().get(0);
        BundleRecommendation loser = report.getRecommendations().get(1);
        assertThat(winner.getHotelUnitId()).isEqualTo(1L);
        assertThat(winner.getFlightUnitId()).isEqualTo(3L);
        assertThat(winner.getAction()).isEqualTo(RecommendationAction.BUNDLE);
        assertThat(winner.getEstimatedGain()).isGreaterThan(settings.getBundleGainThreshold());
        assertThat(winner.getDiscount()).isEqualTo(-3800);
        assertThat(winner.getProposedBundlePrice()).isEqualTo(19000 + 28500 - 3800);
        assertThat(loser.getHotelUnitId()).isEqualTo(2L);
        assertThat(loser.getAction()).isEqualTo(RecommendationAction.STANDALONE);
        assertThat(loser.getJustification()).contains("already bundled");
        assertThat(report.bundleCount()).isEqualTo(1);
        assertThat(report.getUplift()).isEqualTo(winner.getEstimatedGain());
        assertThat(report.getTotalOptimizedProfit() - report.getTotalStandaloneProfit()).isEqualTo(report.getUplift());
    }

    @Test
    void recommend_inputOrderDoesNotChangeReport() {
        LocalDate d1 = TODAY.plusDays(10);
        LocalDate d2 = TODAY.plusDays(20);
        List<InventoryUnit> units = new ArrayList<>(List.of(
            hotel(1L, d1), hotel(2L, d1), flight(3L, d1), hotel(4L, d2), flight(5L, d2), flight(6L, d2)));

        OptimizationReport first = optimizer.recommend(units, ForecastScenario.BASE, NOW, settings);
        Collections.reverse(units);
        OptimizationReport second = optimizer.recommend(units, ForecastScenario.BASE, NOW, settings);

        assertThat(second).isEqualTo(first);
        assertThat(first.getRecommendations())
            .extracting(BundleRecommendation::getEstimatedGain)
            .isSortedAccordingTo(Collections.reverseOrder());
    }

    @Test
    void recommend_noSameDayFlight_returnsEmptyWithZeroUplift() {
        List<InventoryUnit> units = List.of(hotel(1L, TODAY.plusDays(10)), flight(2L, TODAY.plusDays(11)));

        OptimizationReport report = optimizer.recommend(units, ForecastScenario.BASE, NOW, settings);

        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getUplift()).isZero();
        assertThat(report.getTotalOptimizedProfit()).isEqualTo(report.getTotalStandaloneProfit());
        assertThat(report.getExcludedUnitIds()).isEmpty();
    }

    @Test
    void recommend_unitWithoutDeparture_isExcluded() {
        List<InventoryUnit> units = List.of(
            hotel(1L, null), hotel(2L, TODAY), flight(3L, TODAY.minusDays(2)), flight(4L, TODAY.plusDays(5)));

        OptimizationReport report = optimizer.recommend(units, ForecastScenario.OPTIMISTIC, NOW, settings);

        assertThat(report.getExcludedUnitIds()).containsExactly(1L);
        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getUplift()).isZero();
    }

    @Test
    void recommend_departingToday_writesOffStockInStandaloneTotal() {
        InventoryUnit hotelToday = InventoryUnit.builder()
            .id(1L).kind(UnitKind.HOTEL).name("Hotel 1")
            .totalCapacity(10).remainingCapacity(10).basePrice(10000)
            .departureDate(TODAY)
            .build();
        InventoryUnit flightToday = InventoryUnit.builder()
            .id(2L).kind(UnitKind.FLIGHT).name("Flight 2")
            .totalCapacity(10).remainingCapacity(4).basePrice(20000)
            .departureDate(TODAY)
            .build();

        OptimizationReport report = optimizer.recommend(
            List.of(hotelToday, flightToday), ForecastScenario.BASE, NOW, settings);

        assertThat(report.getExcludedUnitIds()).isEmpty();
        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getTotalStandaloneProfit()).isEqualTo(-10 * 7000 - 4 * 14000);
        assertThat(report.getTotalOptimizedProfit()).isEqualTo(report.getTotalStandaloneProfit());
        assertThat(report.getUplift()).isZero();
    }

    @Test
    void recommend_gainBelowThreshold_staysStandalone() {
        EngineSettings strict = settings.toBuilder().bundleGainThreshold(Long.MAX_VALUE).build();
        LocalDate departure = TODAY.plusDays(10);

        OptimizationReport report = optimizer.recommend(
            List.of(hotel(1L, departure), flight(2L, departure)), ForecastScenario.BASE, NOW, strict);

        assertThat(report.getRecommendations()).singleElement()
            .satisfies(r -> {
                assertThat(r.getAction()).isEqualTo(RecommendationAction.STANDALONE);
                assertThat(r.getJustification()).contains("does not exceed");
            });
        assertThat(report.bundleCount()).isZero();
        assertThat(report.getUplift()).isZero();
    }

    @Test
    void recommend_emptyInventory_returnsEmptyReport() {
        OptimizationReport report = optimizer.recommend(List.of(), ForecastScenario.BASE, NOW, settings);

        assertThat(report.getRecommendations()).isEmpty();
        assertThat(report.getTotalStandaloneProfit()).isZero();
        assertThat(report.getUplift()).isZero();
    }
}
