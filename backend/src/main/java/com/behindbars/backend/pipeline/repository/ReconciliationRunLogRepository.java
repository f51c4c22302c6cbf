package com.behindbars.backend.pipeline.repository;

import com.behindbars.backend.pipeline.entity.ReconciliationRunLog;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReconciliationRunLogRepository extends JpaRepository<ReconciliationRunLog, Long> {

    List<ReconciliationRunLog> findTop50ByOrderByIdDesc();

    List<ReconciliationRunLog> findByRunDateOrderByIdAsc(LocalDate runDate);
}
