package com.travelrevenue.service;

import com.travelrevenue.dto.InventoryRescueResponse;
import com.travelrevenue.dto.RevenueLiftResponse;
import com.travelrevenue.entity.BookingEvent;
import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import com.travelrevenue.repository.BookingEventRepository;
import com.travelrevenue.repository.InventoryUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Realised-sales metrics read from the booking log: revenue earned over fixed list
 * prices, and the share of units sold inside bundles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PerformanceMetricsService {

    private final BookingEventRepository eventRepository;
    private final InventoryUnitRepository unitRepository;

    /** Restricted to {@code unitIds}; an empty collection means every unit. */
    public RevenueLiftResponse revenueLift(Collection<Long> unitIds) {
        List<BookingEvent> events = events(unitIds);

        long totalDynamic = 0;
        long totalFixed = 0;
        long totalUnits = 0;
        Map<LocalDate, long[]> byDay = new TreeMap<>();
        for (BookingEvent event : events) {
            long dynamic = (long) event.getQuantity() * event.getSoldPrice();
            long fixed = (long) event.getQuantity() * event.getBasePriceAtSale();
            totalDynamic += dynamic;
            totalFixed += fixed;
            totalUnits += event.getQuantity();
            long[] day = byDay.computeIfAbsent(event.getBookedAt().atZone(ZoneOffset.UTC).toLocalDate(), d -> new long[2]);
            day[0] += dynamic;
            day[1] += fixed;
        }

        long lift = totalDynamic - totalFixed;
        double liftPct = totalFixed > 0 ? RevenueMath.round(lift * 100.0 / totalFixed, 1) : 0.0;

        List<RevenueLiftResponse.DailyRevenue> daily = byDay.entrySet().stream()
            .map(e -> RevenueLiftResponse.DailyRevenue.builder()
                .day(e.getKey())
                .dynamicRevenue(e.getValue()[0])
                .fixedRevenue(e.getValue()[1])
                .build())
            .toList();

        log.debug("Revenue lift computed | events={} | lift={} | liftPct={}", events.size(), lift, liftPct);
        return RevenueLiftResponse.builder()
            .totalDynamic(totalDynamic)
            .totalFixed(totalFixed)
            .lift(lift)
            .liftPct(liftPct)
            .totalUnits(totalUnits)
            .daily(daily)
            .build();
    }

    /** Restricted to {@code unitIds}; an empty collection means every unit. */
    public InventoryRescueResponse inventoryRescue(Collection<Long> unitIds) {
        List<BookingEvent> events = events(unitIds);
        Set<Long> eventUnitIds = events.stream().map(BookingEvent::getUnitId).collect(Collectors.toSet());
        Set<Long> hotelIds = unitRepository.findByIdInOrderByIdAsc(eventUnitIds).stream()
            .filter(u -> u.getKind() == UnitKind.HOTEL)
            .map(InventoryUnit::getId)
            .collect(Collectors.toSet());

        long rescued = 0;
        long total = 0;
        long hotelRescued = 0;
        long hotelTotal = 0;
        for (BookingEvent event : events) {
            total += event.getQuantity();
            if (event.isBundle()) {
                rescued += event.getQuantity();
            }
            if (hotelIds.contains(event.getUnitId())) {
                hotelTotal += event.getQuantity();
                if (event.isBundle()) {
                    hotelRescued += event.getQuantity();
                }
            }
        }

        return InventoryRescueResponse.builder()
            .overallRescueRate(rate(rescued, total))
            .rescuedUnits(rescued)
            .totalUnits(total)
            .hotelRescueRate(rate(hotelRescued, hotelTotal))
            .hotelRescuedUnits(hotelRescued)
            .hotelTotalUnits(hotelTotal)
            .build();
    }

    private List<BookingEvent> events(Collection<Long> unitIds) {
        return unitIds == null || unitIds.isEmpty()
            ? eventRepository.findAllByOrderByBookedAtAsc()
            : eventRepository.findByUnitIdInOrderByBookedAtAsc(unitIds);
    }

    private static double rate(long part, long whole) {
        return whole > 0 ? RevenueMath.round(part * 100.0 / whole, 1) : 0.0;
    }
}
