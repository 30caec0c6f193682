package ai.rxscan.backend.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for the frequency and timing tables.
 */
class CanonicalTablesTest {

    @Test
    @DisplayName("Should map common frequency shorthand to canonical labels")
    void shouldMapFrequencyShorthand() {
        assertEquals("Once daily", CanonicalTables.frequencyOf("Atorvastatin 10mg OD"));
        assertEquals("Twice daily", CanonicalTables.frequencyOf("Metformin 500mg bid"));
        assertEquals("Three times daily", CanonicalTables.frequencyOf("Amoxicillin 500mg TDS"));
        assertEquals("Four times daily", CanonicalTables.frequencyOf("take four times a day"));
        assertEquals("Every 8 hours", CanonicalTables.frequencyOf("Ibuprofen 400mg q8h"));
        assertEquals("As needed", CanonicalTables.frequencyOf("Paracetamol 650mg as needed for fever"));
        assertEquals("At bedtime", CanonicalTables.frequencyOf("Melatonin 3mg at bedtime"));
    }

    @Test
    @DisplayName("Should not fire abbreviations inside longer words")
    void shouldRespectWordBoundaries() {
        // "od" in "food", "ac" and "am" in "Paracetamol"
        assertEquals("Twice daily", CanonicalTables.frequencyOf("Paracetamol 500mg BD after food"));
        assertEquals("", CanonicalTables.timingOf("Paracetamol 500mg"));
        assertEquals("", CanonicalTables.frequencyOf("Paracetamol 500mg"));
        assertEquals("", CanonicalTables.timingOf("skip the midnight snack"));
    }

    @Test
    @DisplayName("Should map timing phrases to canonical labels")
    void shouldMapTimingPhrases() {
        assertEquals("After meals", CanonicalTables.timingOf("Amoxicillin 500mg after food"));
        assertEquals("Before meals", CanonicalTables.timingOf("Pantoprazole 40mg on an empty stomach in the morning"));
        assertEquals("With meals", CanonicalTables.timingOf("Metformin 500mg with meals"));
        assertEquals("At bedtime", CanonicalTables.timingOf("Atorvastatin 10mg hs at night"));
        assertEquals("Morning", CanonicalTables.timingOf("Levothyroxine 50mcg every morning"));
        assertEquals("Evening", CanonicalTables.timingOf("Cetirizine 10mg at night"));
    }

    @Test
    @DisplayName("Should return empty label for blank or unmatched lines")
    void shouldReturnEmptyWhenNothingMatches() {
        assertEquals("", CanonicalTables.frequencyOf(""));
        assertEquals("", CanonicalTables.frequencyOf(null));
        assertEquals("", CanonicalTables.timingOf("Vitamin D3 60000 IU weekly"));
    }

    @Test
    @DisplayName("Tables keep their declared order and cannot be modified")
    void tablesAreOrderedAndImmutable() {
        String frequencyOrder = CanonicalTables.FREQUENCY.stream()
                .map(LabelPattern::getLabel)
                .collect(Collectors.joining(","));
        assertThat(frequencyOrder).isEqualTo("Once daily,Twice daily,Three times daily,Four times daily,"
                + "Every 4 hours,Every 6 hours,Every 8 hours,Every 12 hours,As needed,At bedtime");

        assertThat(CanonicalTables.TIMING)
                .extracting(LabelPattern::getLabel)
                .containsExactly("After meals", "Before meals", "With meals", "At bedtime", "Morning", "Evening");

        assertThatThrownBy(() -> CanonicalTables.TIMING.add(LabelPattern.of("x", "y")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
