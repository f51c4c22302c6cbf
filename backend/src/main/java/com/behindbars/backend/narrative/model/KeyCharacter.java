package com.behindbars.backend.narrative.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A public figure of the prison and justice system tracked across runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyCharacter {

    private String name;

    private String role;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    // Append-only
    @Setter(AccessLevel.NONE)
    @JsonProperty("positions")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<CharacterPosition> positions = new ArrayList<>();

    public List<CharacterPosition> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public void addPosition(CharacterPosition position) {
        positions.add(position);
    }

    /**
     * Case-insensitive match against the name or any alias.
     */
    public boolean isKnownAs(String candidate) {
        if (candidate == null || candidate.isBlank()) return false;
        String trimmed = candidate.trim();
        if (name != null && name.equalsIgnoreCase(trimmed)) return true;
        return aliases.stream().anyMatch(alias -> alias != null && alias.equalsIgnoreCase(trimmed));
    }

    public int addAliases(Collection<String> newAliases) {
        if (newAliases == null) return 0;
        int added = 0;
        for (String alias : newAliases) {
            if (alias == null || alias.isBlank() || isKnownAs(alias)) continue;
            aliases.add(alias.trim());
            added++;
        }
        return added;
    }
}
