package com.behindbars.backend.events.repository;

import com.behindbars.backend.events.entity.FacilitySnapshot;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface FacilitySnapshotRepository extends JpaRepository<FacilitySnapshot, Long> {

    List<FacilitySnapshot> findAllByOrderByIdAsc();

    List<FacilitySnapshot> findBySnapshotDateIn(Collection<LocalDate> snapshotDates);

    List<FacilitySnapshot> findByFacilityOrderBySnapshotDateDesc(String facility);

    List<FacilitySnapshot> findByRegionOrderBySnapshotDateDesc(String region);

    // Latest snapshot per facility
    @Query("SELECT s FROM FacilitySnapshot s WHERE s.snapshotDate = "
            + "(SELECT MAX(s2.snapshotDate) FROM FacilitySnapshot s2 WHERE s2.facility = s.facility) "
            + "ORDER BY s.occupancyRate DESC NULLS LAST")
    List<FacilitySnapshot> findLatestPerFacility();
}
