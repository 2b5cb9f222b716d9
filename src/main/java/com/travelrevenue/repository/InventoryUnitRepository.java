package com.travelrevenue.repository;

import com.travelrevenue.entity.InventoryUnit;
import com.travelrevenue.entity.UnitKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface InventoryUnitRepository extends JpaRepository<InventoryUnit, Long> {

    List<InventoryUnit> findAllByOrderByIdAsc();

    List<InventoryUnit> findByIdInOrderByIdAsc(Collection<Long> ids);

    List<InventoryUnit> findByKindOrderByIdAsc(UnitKind kind);
}
