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
public class CleanupReport {
    private boolean dryRun;
    private int beforeCount;
    private int afterCount;
    private int aggregatesMarked;
    private int duplicatesRemoved;
    private int victimDuplicatesRemoved;

    @Builder.Default
    private List<DuplicateGroup> sampleDuplicates = new ArrayList<>();
}
