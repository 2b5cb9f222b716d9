package com.travelrevenue.repository;

import com.travelrevenue.entity.BookingEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Append-only event log. The engine reads windowed sums and full slices; the only
 * write it performs is {@code save} of a new event.
 */
public interface BookingEventRepository extends JpaRepository<BookingEvent, Long> {

    @Query("""
        SELECT COALESCE(SUM(e.quantity), 0) FROM BookingEvent e
        WHERE e.unitId = :unitId
          AND e.bookedAt >= :from
          AND e.bookedAt <= :to
    """)
    long sumQuantityBetween(
        @Param("unitId") Long unitId,
        @Param("from")   Instant from,
        @Param("to")     Instant to
    );

    List<BookingEvent> findByUnitIdInOrderByBookedAtAsc(Collection<Long> unitIds);

    List<BookingEvent> findAllByOrderByBookedAtAsc();
}
