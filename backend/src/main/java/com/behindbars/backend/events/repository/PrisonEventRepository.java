package com.behindbars.backend.events.repository;

import com.behindbars.backend.events.entity.PrisonEvent;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PrisonEventRepository extends JpaRepository<PrisonEvent, Long> {

    // Batch lookups for duplicate checks
    List<PrisonEvent> findByEventDateIn(Collection<LocalDate> eventDates);

    List<PrisonEvent> findBySourceUrlIn(Collection<String> sourceUrls);

    @Query("SELECT e FROM PrisonEvent e WHERE e.eventDate >= :since ORDER BY e.eventDate DESC")
    List<PrisonEvent> findRecentEvents(@Param("since") LocalDate since);

    List<PrisonEvent> findByEventTypeOrderByEventDateDesc(String eventType);

    List<PrisonEvent> findByFacilityOrderByEventDateDesc(String facility);

    List<PrisonEvent> findByRegionOrderByEventDateDesc(String region);

    // Cleanup works in insertion order so the first-seen record of a group survives
    List<PrisonEvent> findAllByOrderByIdAsc();

    // Statistics queries
    @Query("SELECT e.eventType, COUNT(e) FROM PrisonEvent e WHERE e.isAggregate = false GROUP BY e.eventType")
    List<Object[]> countByTypeExcludingAggregates();

    @Query("SELECT e.region, COUNT(e) FROM PrisonEvent e WHERE e.isAggregate = false AND e.region IS NOT NULL GROUP BY e.region")
    List<Object[]> countByRegionExcludingAggregates();

    Long countByIsAggregate(Boolean isAggregate);
}
