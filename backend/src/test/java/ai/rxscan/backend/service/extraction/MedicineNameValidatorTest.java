package ai.rxscan.backend.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for MedicineNameValidator.
 */
class MedicineNameValidatorTest {

    private final MedicineNameValidator validator = new MedicineNameValidator();

    @ParameterizedTest
    @ValueSource(strings = {"Paracetamol", "Dolo", "Vitamin D3", "Amoxicillin Clavulanate"})
    @DisplayName("Should accept plausible medicine names")
    void shouldAcceptMedicineNames(String name) {
        assertTrue(validator.isValid(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Date", "Patient Rx", "Doctor Visit", "Weight check", "Note to self", "Dosage"})
    @DisplayName("Should reject names containing form label words")
    void shouldRejectExcludedWords(String name) {
        assertFalse(validator.isValid(name));
    }

    @Test
    @DisplayName("Length must be strictly between 3 and 50 characters")
    void shouldEnforceExclusiveLengthBounds() {
        assertFalse(validator.isValid("abc"));
        assertTrue(validator.isValid("abcd"));
        assertTrue(validator.isValid("a".repeat(49)));
        assertFalse(validator.isValid("a".repeat(50)));
    }

    @Test
    @DisplayName("Should reject numeric, letterless and missing names")
    void shouldRejectNonNames() {
        assertFalse(validator.isValid("12345"));
        assertFalse(validator.isValid("----"));
        assertFalse(validator.isValid(""));
        assertFalse(validator.isValid(null));
    }
}
