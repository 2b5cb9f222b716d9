package com.travelrevenue.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Immutable
@Table(
    name = "booking_events",
    indexes = {
        @Index(name = "idx_event_unit_time", columnList = "unit_id, booked_at"),
        @Index(name = "idx_event_booked",    columnList = "booked_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class BookingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "unit_id", nullable = false, updatable = false)
    private Long unitId;

    @Column(name = "partner_unit_id", updatable = false)
    private Long partnerUnitId;

    @Column(name = "booked_at", nullable = false, updatable = false)
    private Instant bookedAt;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "sold_price", nullable = false, updatable = false)
    private long soldPrice;

    @Column(name = "base_price_at_sale", nullable = false, updatable = false)
    private long basePriceAtSale;

    @Column(name = "is_bundle", nullable = false, updatable = false)
    private boolean bundle;

    @Column(name = "discount_amount", updatable = false)
    private Long discountAmount;
}
