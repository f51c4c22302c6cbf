package com.behindbars.backend.events.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FacilityRename {
    private String table;
    private Long id;
    private String from;
    private String to;
}
