package com.behindbars.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.behindbars.backend.events.entity.PrisonEvent;
import com.behindbars.backend.facility.FacilityCatalogLoader;
import com.behindbars.backend.facility.FacilityNormalizer;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VictimIdentifierTest {

    private VictimIdentifier identifier;

    @BeforeEach
    void setUp() {
        identifier = new VictimIdentifier(new FacilityNormalizer(
                FacilityCatalogLoader.load(getClass().getResourceAsStream("/facilities.yml"))));
    }

    @Test
    @DisplayName("Named victims are keyed by name and age")
    void namedVictim() {
        PrisonEvent event = fatality("suicide", "Il detenuto Marco Rossi, 34 anni, si è tolto la vita in cella");

        assertThat(identifier.identify(event)).contains("name:marco rossi|34");
    }

    @Test
    @DisplayName("Named victims without an age keep a placeholder")
    void namedVictimWithoutAge() {
        assertThat(identifier.identify(fatality("death", "È morta la detenuta Anna, trovata senza vita")))
                .contains("name:anna|?");
    }

    @Test
    @DisplayName("Unnamed victims are keyed by date, facility and age")
    void contextKey() {
        PrisonEvent event = fatality("natural_death", "Un uomo di 61 anni è morto per un malore");

        assertThat(identifier.identify(event)).contains("ctx:2026-01-10|Canton Mombello (Brescia)|61");
    }

    @Test
    @DisplayName("Non-fatal events and fatalities without clues get no key")
    void noKey() {
        assertThat(identifier.identify(fatality("protest", "Il detenuto Marco Rossi, 34 anni, protesta"))).isEmpty();
        assertThat(identifier.identify(fatality("suicide", "Ennesimo suicidio in carcere"))).isEmpty();
    }

    @Test
    @DisplayName("Ages are read from Italian and English phrasings and must be plausible")
    void extractsAge() {
        assertThat(VictimIdentifier.extractAge("un 27enne di origine tunisina")).isEqualTo(27);
        assertThat(VictimIdentifier.extractAge("an inmate aged 52 died")).isEqualTo(52);
        assertThat(VictimIdentifier.extractAge("a 19-year-old prisoner")).isEqualTo(19);
        assertThat(VictimIdentifier.extractAge("condannato a 150 anni")).isNull();
        assertThat(VictimIdentifier.extractAge("nessuna età")).isNull();
    }

    @Test
    @DisplayName("Names need a capitalized word after a person reference")
    void extractsName() {
        assertThat(VictimIdentifier.extractName("La vittima, Ahmed Ben Salah, aveva 40 anni")).isEqualTo("Ahmed Ben");
        assertThat(VictimIdentifier.extractName("il detenuto di 34 anni")).isNull();
        assertThat(VictimIdentifier.isFatality("SUICIDE")).isTrue();
        assertThat(VictimIdentifier.isFatality("protest")).isFalse();
    }

    private static PrisonEvent fatality(String type, String description) {
        return PrisonEvent.builder()
                .eventType(type)
                .eventDate(LocalDate.of(2026, 1, 10))
                .facility("Brescia Canton Mombello")
                .description(description)
                .build();
    }
}
