package com.behindbars.backend.events.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FacilityNormalizationReport {
    private boolean dryRun;

    // Distinct facility names before and after
    private int eventFacilitiesBefore;
    private int eventFacilitiesAfter;
    private int eventsUpdated;

    private int snapshotFacilitiesBefore;
    private int snapshotFacilitiesAfter;
    private int snapshotsUpdated;
    private int snapshotsMerged; // renamed onto an already stored snapshot, removed

    @Builder.Default
    private List<FacilityRename> sampleChanges = new ArrayList<>();
}
