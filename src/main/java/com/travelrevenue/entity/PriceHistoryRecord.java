package com.travelrevenue.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Immutable
@Table(
    name = "price_history",
    indexes = {
        @Index(name = "idx_history_unit_time", columnList = "unit_id, recorded_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PriceHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "unit_id", nullable = false, updatable = false)
    private Long unitId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "remaining_capacity", updatable = false)
    private int remainingCapacity;

    @Column(name = "final_price", nullable = false, updatable = false)
    private long finalPrice;

    @Column(name = "lead_days", updatable = false)
    private Integer leadDays;

    @Column(length = 32, updatable = false)
    private String strategy;

    @Column(name = "brake_active", updatable = false)
    private boolean brakeActive;
}
