package com.travelrevenue.repository;

import com.travelrevenue.entity.PriceHistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PriceHistoryRepository extends JpaRepository<PriceHistoryRecord, Long> {

    List<PriceHistoryRecord> findByUnitIdOrderByRecordedAtAsc(Long unitId);
}
