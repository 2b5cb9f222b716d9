package com.travelrevenue.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.OptionalInt;

/**
 * A sellable block of perishable inventory: the rooms of one hotel night or the
 * seats of one flight. Owned by the inventory store; the engine only reads it,
 * so the entity exposes no setters.
 */
@Entity
@Table(
    name = "inventory_units",
    indexes = {
        @Index(name = "idx_unit_kind",      columnList = "kind"),
        @Index(name = "idx_unit_departure", columnList = "departure_date"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@ToString
public class InventoryUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UnitKind kind;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(name = "total_capacity", nullable = false)
    private int totalCapacity;

    @Column(name = "remaining_capacity", nullable = false)
    private int remainingCapacity;

    @Column(name = "base_price", nullable = false)
    private long basePrice;

    @Column(name = "price_elasticity")
    private Double priceElasticity;

    @Column(name = "departure_date")
    private LocalDate departureDate;

    @Column(name = "procurement_date")
    private LocalDate procurementDate;

    public double remainingRatio() {
        return totalCapacity > 0 ? (double) remainingCapacity / totalCapacity : 0.0;
    }

    public int soldCapacity() {
        return Math.max(0, totalCapacity - remainingCapacity);
    }

    /** Whole days from {@code referenceDate} to departure; empty when no departure date is set. */
    public OptionalInt leadDays(LocalDate referenceDate) {
        if (departureDate == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) ChronoUnit.DAYS.between(referenceDate, departureDate));
    }

    /** Days between procurement and departure; empty unless both dates are set. */
    public OptionalInt horizonDays() {
        if (departureDate == null || procurementDate == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) ChronoUnit.DAYS.between(procurementDate, departureDate));
    }
}
