package ai.rxscan.backend.model.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RawInput.
 */
class RawInputTest {

    @Test
    @DisplayName("Null text is treated as empty")
    void nullTextBecomesEmpty() {
        RawInput input = RawInput.of(null);

        assertThat(input.getText()).isEmpty();
        assertThat(input.getConfidence()).isEmpty();
    }

    @Test
    @DisplayName("Confidence must lie between 0 and 100")
    void confidenceIsRangeChecked() {
        assertThat(RawInput.of("x", 0.0).getConfidence()).contains(0.0);
        assertThat(RawInput.of("x", 100.0).getConfidence()).contains(100.0);

        assertThatThrownBy(() -> RawInput.of("x", 150.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RawInput.of("x", -1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RawInput.of("x", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("String form does not reveal the text")
    void toStringOmitsText() {
        assertThat(RawInput.of("Patient Name: Anita Sharma", 90.0).toString())
                .doesNotContain("Anita")
                .contains("length=26");
    }
}
