package com.travelrevenue.service;

import com.travelrevenue.dto.PricingResult;
import com.travelrevenue.dto.SaleRecordRequest;
import com.travelrevenue.entity.BookingEvent;
import com.travelrevenue.entity.PriceHistoryRecord;
import com.travelrevenue.exception.UnitNotFoundException;
import com.travelrevenue.repository.BookingEventRepository;
import com.travelrevenue.repository.InventoryUnitRepository;
import com.travelrevenue.repository.PriceHistoryRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.List;

/**
 * The engine's only writes: appending a booking event and appending price
 * snapshots. Nothing is updated in place.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class EventLogService {

    private final BookingEventRepository eventRepository;
    private final PriceHistoryRepository historyRepository;
    private final InventoryUnitRepository unitRepository;

    @Transactional
    public BookingEvent appendSale(@Valid SaleRecordRequest request) {
        if (!unitRepository.existsById(request.getUnitId())) {
            throw new UnitNotFoundException(request.getUnitId());
        }
        BookingEvent saved = eventRepository.save(BookingEvent.builder()
            .unitId(request.getUnitId())
            .partnerUnitId(request.getPartnerUnitId())
            .bookedAt(request.getBookedAt())
            .quantity(request.getQuantity())
            .soldPrice(request.getSoldPrice())
            .basePriceAtSale(request.getBasePriceAtSale())
            .bundle(request.isBundle())
            .discountAmount(request.getDiscountAmount())
            .build());
        log.info("Sale appended | id={} | unitId={} | qty={} | price={} | bundle={}",
            saved.getId(), saved.getUnitId(), saved.getQuantity(), saved.getSoldPrice(), saved.isBundle());
        return saved;
    }

    @Transactional
    public List<PriceHistoryRecord> recordPriceSnapshot(List<PricingResult> results, Instant recordedAt) {
        List<PriceHistoryRecord> records = results.stream()
            .map(r -> PriceHistoryRecord.builder()
                .unitId(r.getUnitId())
                .recordedAt(recordedAt)
                .remainingCapacity(r.getRemainingCapacity())
                .finalPrice(r.getFinalPrice())
                .leadDays(r.getLeadDays())
                .strategy(r.getStrategy().name())
                .brakeActive(r.isBrakeActive())
                .build())
            .toList();
        List<PriceHistoryRecord> saved = historyRepository.saveAll(records);
        log.info("Price snapshot recorded | rows={} | recordedAt={}", saved.size(), recordedAt);
        return saved;
    }
}
