package com.travelrevenue.repository;

import com.travelrevenue.entity.BookingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class BookingEventRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Autowired BookingEventRepository repository;
    @Autowired JdbcTemplate jdbcTemplate;

    private BookingEvent event(Long unitId, Instant at, int qty) {
        return BookingEvent.builder()
            .unitId(unitId).bookedAt(at).quantity(qty)
            .soldPrice(10000).basePriceAtSale(10000)
            .build();
    }

    @BeforeEach
    void setUp() {
        repository.saveAll(List.of(
            event(1L, NOW.minusSeconds(3600), 2),
            event(1L, NOW.minusSeconds(23 * 3600), 3),
            event(1L, NOW.minusSeconds(30 * 3600), 5),
            event(2L, NOW.minusSeconds(600), 7)));
    }

    @Test
    void sumQuantityBetween_countsOnlyUnitInsideWindow() {
        assertThat(repository.sumQuantityBetween(1L, NOW.minusSeconds(24 * 3600), NOW)).isEqualTo(5);
        assertThat(repository.sumQuantityBetween(1L, NOW.minusSeconds(48 * 3600), NOW)).isEqualTo(10);
        assertThat(repository.sumQuantityBetween(2L, NOW.minusSeconds(24 * 3600), NOW)).isEqualTo(7);
    }

    @Test
    void sumQuantityBetween_noEvents_returnsZero() {
        assertThat(repository.sumQuantityBetween(3L, NOW.minusSeconds(24 * 3600), NOW)).isZero();
    }

    @Test
    void findByUnitIdIn_ordersByBookingTime() {
        List<BookingEvent> events = repository.findByUnitIdInOrderByBookedAtAsc(List.of(1L));

        assertThat(events).hasSize(3);
        assertThat(events).extracting(BookingEvent::getQuantity).containsExactly(5, 3, 2);
    }

    @Test
    void findByUnitIdIn_rowWithoutDiscount_loadsAsUnset() {
        jdbcTemplate.update("""
            INSERT INTO booking_events
                (unit_id, booked_at, quantity, sold_price, base_price_at_sale, is_bundle, discount_amount)
            VALUES (?, ?, 4, 12000, 10000, FALSE, NULL)
            """, 9L, Timestamp.from(NOW.minusSeconds(7200)));

        List<BookingEvent> events = repository.findByUnitIdInOrderByBookedAtAsc(List.of(9L));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getDiscountAmount()).isNull();
            assertThat(e.getQuantity()).isEqualTo(4);
        });
        assertThat(repository.sumQuantityBetween(9L, NOW.minusSeconds(24 * 3600), NOW)).isEqualTo(4);
    }
}
