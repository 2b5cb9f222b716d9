package com.travelrevenue.service;

import com.travelrevenue.config.EngineSettings;
import com.travelrevenue.dto.DemandForecast;
import com.travelrevenue.dto.ForecastScenario;
import com.travelrevenue.dto.PaceSource;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import com.travelrevenue.repository.BookingEventRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DemandForecastServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @Mock BookingEventRepository eventRepository;
    @InjectMocks DemandForecastService forecastService;

    private final EngineSettings settings = EngineSettings.defaults();

    @Test
    void forecast_recentActivity_drivesScenarioPaces() {
        when(eventRepository.sumQuantityBetween(eq(1L), eq(NOW.minusSeconds(14 * 86400L)), eq(NOW))).thenReturn(28L);

        DemandForecast forecast = forecastService.forecast(1L, 10, 30, 50, 10000, 7000, NOW, settings);

        assertThat(forecast.getPaceSource()).isEqualTo(PaceSource.RECENT_ACTIVITY);
        assertThat(forecast.getBaselineDailyPace()).isEqualTo(2.0);
        assertThat(forecast.scenario(ForecastScenario.BASE).getPredictedSold()).isEqualTo(20.0);
        assertThat(forecast.scenario(ForecastScenario.BASE).getPredictedUnsold()).isEqualTo(10.0);
        assertThat(forecast.scenario(ForecastScenario.BASE).getExpectedNetProfit()).isEqualTo(-10000);
        assertThat(forecast.scenario(ForecastScenario.PESSIMISTIC).getExpectedNetProfit()).isEqualTo(-70000);
        assertThat(forecast.scenario(ForecastScenario.OPTIMISTIC).getExpectedNetProfit()).isEqualTo(50000);
    }

    @Test
    void forecast_noActivity_fallsBackToTheoreticalPace() {
        when(eventRepository.sumQuantityBetween(eq(1L), any(), any())).thenReturn(0L);

        DemandForecast forecast = forecastService.forecast(1L, 10, 50, 50, 10000, 7000, NOW, settings);

        assertThat(forecast.getPaceSource()).isEqualTo(PaceSource.THEORETICAL);
        assertThat(forecast.getBaselineDailyPace()).isCloseTo(50 * 0.7 / 30, within(1e-4));
    }

    @Test
    void forecast_profitOrderedAcrossScenarios() {
        int[] recents = {0, 3, 14, 70, 500};
        int[] leads = {-2, 0, 1, 7, 30, 120};
        for (int recent : recents) {
            for (int lead : leads) {
                when(eventRepository.sumQuantityBetween(eq(1L), any(), any())).thenReturn((long) recent);
                DemandForecast forecast = forecastService.forecast(1L, lead, 40, 60, 12000, 8400, NOW, settings);
                long pessimistic = forecast.scenario(ForecastScenario.PESSIMISTIC).getExpectedNetProfit();
                long base = forecast.scenario(ForecastScenario.BASE).getExpectedNetProfit();
                long optimistic = forecast.scenario(ForecastScenario.OPTIMISTIC).getExpectedNetProfit();
                assertThat(pessimistic).isLessThanOrEqualTo(base);
                assertThat(base).isLessThanOrEqualTo(optimistic);
            }
        }
    }

    @Test
    void forecast_departedUnit_sellsNothingAndWritesOffStock() {
        when(eventRepository.sumQuantityBetween(eq(1L), any(), any())).thenReturn(7L);

        DemandForecast forecast = forecastService.forecast(1L, -3, 5, 10, 10000, 7000, NOW, settings);

        assertThat(forecast.scenario(ForecastScenario.OPTIMISTIC).getPredictedSold()).isZero();
        assertThat(forecast.scenario(ForecastScenario.OPTIMISTIC).getExpectedNetProfit()).isEqualTo(-35000);
    }

    @Test
    void forecast_fromUnit_derivesLeadAndCost() {
        InventoryUnit unit = InventoryUnit.builder()
            .id(9L).kind(UnitKind.FLIGHT).name("NH 101")
            .totalCapacity(100).remainingCapacity(40).basePrice(30000)
            .departureDate(LocalDate.of(2025, 6, 21))
            .build();
        when(eventRepository.sumQuantityBetween(eq(9L), any(), any())).thenReturn(0L);

        DemandForecast forecast = forecastService.forecast(unit, NOW, settings);

        assertThat(forecast.getLeadDays()).isEqualTo(20);
        assertThat(forecast.getCost()).isEqualTo(21000);
        assertThat(forecast.getPrice()).isEqualTo(30000);
        assertThat(forecast.getScenarios()).hasSize(3);
    }
}
