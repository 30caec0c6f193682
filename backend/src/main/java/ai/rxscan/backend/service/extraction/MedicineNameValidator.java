package ai.rxscan.backend.service.extraction;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a candidate string can be a medicine name.
 *
 * <p>A name is accepted when its length is strictly between 3 and 50 characters, it contains
 * a letter, it is not purely numeric, and it does not contain a word that marks a form
 * label rather than a drug (patient, doctor, date, ...).
 */
public class MedicineNameValidator {

    static final int MIN_LENGTH_EXCLUSIVE = 3;
    static final int MAX_LENGTH_EXCLUSIVE = 50;

    static final List<String> EXCLUDED_WORDS = List.of(
            "patient", "doctor", "date", "prescription", "instructions", "note", "age", "weight", "height");

    private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");
    private static final Pattern ANY_LETTER = Pattern.compile("[A-Za-z]");

    public boolean isValid(String name) {
        if (name == null) {
            return false;
        }
        int length = name.length();
        if (length <= MIN_LENGTH_EXCLUSIVE || length >= MAX_LENGTH_EXCLUSIVE) {
            return false;
        }
        if (DIGITS_ONLY.matcher(name).matches() || !ANY_LETTER.matcher(name).find()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return EXCLUDED_WORDS.stream().noneMatch(lower::contains);
    }
}
