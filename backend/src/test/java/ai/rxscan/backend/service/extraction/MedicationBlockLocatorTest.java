package ai.rxscan.backend.service.extraction;

import ai.rxscan.backend.service.extraction.MedicationBlockLocator.Strategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MedicationBlockLocator.
 */
class MedicationBlockLocatorTest {

    private final MedicationBlockLocator locator = new MedicationBlockLocator(new MedicineNameValidator());

    @Test
    @DisplayName("Numbered list wins over inline matches elsewhere in the text")
    void numberedListTakesPrecedence() {
        String text = "1. Amoxicillin 500mg TDS x 5 days\n"
                + "2. Paracetamol 650mg SOS\n"
                + "Also take Vitamin C 500mg daily";

        List<MedicationCandidate> candidates = locator.locate(text);

        assertThat(candidates)
                .extracting(MedicationCandidate::getName)
                .containsExactly("Amoxicillin", "Paracetamol");
        assertThat(candidates)
                .extracting(MedicationCandidate::getStrategy)
                .containsOnly(Strategy.NUMBERED_LIST);
        assertThat(candidates.get(0).getDosageInfo()).startsWith("500mg");
        assertThat(candidates.get(0).getFullLine()).isEqualTo("1. Amoxicillin 500mg TDS x 5 days");
    }

    @Test
    @DisplayName("Inline strategy finds name and strength pairs on plain lines")
    void inlineStrategyFindsPairs() {
        String text = "Metformin 500mg after breakfast\nAtorvastatin 10mg at night";

        List<MedicationCandidate> candidates = locator.locate(text);

        assertThat(candidates)
                .extracting(MedicationCandidate::getName)
                .containsExactly("Metformin", "Atorvastatin");
        assertThat(candidates)
                .extracting(MedicationCandidate::getStrategy)
                .containsOnly(Strategy.INLINE);
    }

    @Test
    @DisplayName("Rx section is read line by line up to the first blank line")
    void rxSectionIsUsedAsLastResort() {
        String text = "Rx:\nAmoxil500mg\nDolo650mg 10 tab\n\nNote: review after a week";

        List<MedicationCandidate> candidates = locator.locate(text);

        assertThat(candidates)
                .extracting(MedicationCandidate::getName)
                .containsExactly("Amoxil", "Dolo");
        assertThat(candidates.get(1).getQuantityInfo()).isEqualTo("10");
        assertThat(candidates.get(1).getStrategy()).isEqualTo(Strategy.RX_SECTION);
    }

    @Test
    @DisplayName("Candidates with form-label names are dropped")
    void rejectedNamesAreDropped() {
        assertThat(locator.locate("1. Date 500mg")).isEmpty();

        List<MedicationCandidate> candidates = locator.locate("1. Date 500mg\n2. Ibuprofen 400mg");
        assertThat(candidates)
                .extracting(MedicationCandidate::getName)
                .containsExactly("Ibuprofen");
    }

    @Test
    @DisplayName("A strategy that only produces rejected names does not stop the search")
    void unproductiveStrategyFallsThrough() {
        String text = "1. Patient 500mg\nCetirizine 10mg at night";

        List<MedicationCandidate> candidates = locator.locate(text);

        assertThat(locator.run(Strategy.NUMBERED_LIST, text)).hasSize(1);
        assertThat(candidates)
                .extracting(MedicationCandidate::getName)
                .containsExactly("Cetirizine");
    }

    @Test
    @DisplayName("Name and strength must share a line")
    void nameAndStrengthMustShareLine() {
        assertThat(locator.locate("Take\n500mg")).isEmpty();
    }

    @Test
    @DisplayName("Empty text yields no candidates")
    void emptyTextYieldsNothing() {
        assertThat(locator.locate("")).isEmpty();
        assertThat(locator.locate(null)).isEmpty();
    }
}
