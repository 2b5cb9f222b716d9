package com.travelrevenue.service;

import com.travelrevenue.dto.VelocitySignal;
import com.travelrevenue.repository.BookingEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;

@Slf4j
@Service
@RequiredArgsConstructor
public class VelocitySignalService {

    private final BookingEventRepository eventRepository;

    /**
     * Ratio of the actual daily sales pace over the last {@code windowHours} to
     * the pace needed to sell {@code targetSellRatio} of the capacity by departure.
     */
    public VelocitySignal velocityRatio(Long unitId, int totalStock, int remainingStock,
                                        OptionalInt leadDays, Instant referenceTime,
                                        int windowHours, double targetSellRatio) {
        int window = Math.max(1, windowHours);
        long soldInWindow = eventRepository.sumQuantityBetween(
            unitId, referenceTime.minus(Duration.ofHours(window)), referenceTime);

        if (soldInWindow <= 0) {
            return VelocitySignal.noSignal("no bookings in the last " + window + "h");
        }
        if (leadDays.isEmpty() || leadDays.getAsInt() <= 0) {
            return VelocitySignal.noSignal("departure date not set or already passed");
        }

        double actualDaily = soldInWindow * (24.0 / window);
        double expectedDaily = totalStock * targetSellRatio / leadDays.getAsInt();
        if (expectedDaily <= 0) {
            return VelocitySignal.noSignal("no expected pace for zero capacity");
        }

        double ratio = RevenueMath.round(actualDaily / expectedDaily, 3);
        log.debug("Velocity measured | unitId={} | sold={} | window={}h | remaining={} | ratio={}",
            unitId, soldInWindow, window, remainingStock, ratio);
        return VelocitySignal.measured(ratio);
    }
}
