package com.behindbars.backend.events.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateGroup {
    private String key;
    private Long keepId;
    private List<Long> removeIds;
}
