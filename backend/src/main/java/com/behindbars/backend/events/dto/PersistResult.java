package com.behindbars.backend.events.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersistResult {
    private int saved;
    private int skipped;  // duplicates of stored or same-batch records
    private int rejected; // unusable records, e.g. a snapshot without a date or an over-long column value
}
