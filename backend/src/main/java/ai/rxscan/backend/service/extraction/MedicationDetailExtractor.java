package ai.rxscan.backend.service.extraction;

import ai.rxscan.backend.model.dto.Medication;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a located candidate into a {@link Medication}.
 *
 * <p>The dosage comes from the candidate's dosage span. Frequency, timing, duration and the
 * quantity fallback are read from the whole line, since qualifiers usually trail the
 * strength. The line itself is kept verbatim as the medication's instructions.
 */
public class MedicationDetailExtractor {

    private static final Pattern DOSAGE = Pattern.compile("(" + MedicationBlockLocator.DOSE + ")",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DURATION = Pattern.compile(
            "\\b(?:for|x)[ \\t]*(\\d+)[ \\t]*(days?|weeks?|months?)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> QUANTITY_PATTERNS = List.of(
            Pattern.compile("(\\d+)[ \\t]*" + MedicationBlockLocator.QUANTITY_UNIT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:quantity|qty|total)\\b\\.?[ \\t]*:?[ \\t]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:buy|purchase)[ \\t]+(\\d+)", Pattern.CASE_INSENSITIVE)
    );

    public Medication extract(MedicationCandidate candidate) {
        String line = candidate.getFullLine();
        return Medication.builder()
                .name(candidate.getName())
                .dosage(firstGroup(DOSAGE, candidate.getDosageInfo()))
                .quantity(!candidate.getQuantityInfo().isEmpty() ? candidate.getQuantityInfo() : quantityOf(line))
                .frequency(CanonicalTables.frequencyOf(line))
                .timing(CanonicalTables.timingOf(line))
                .duration(durationOf(line))
                .instructions(line)
                .build();
    }

    static String durationOf(String line) {
        Matcher matcher = DURATION.matcher(line);
        return matcher.find() ? matcher.group(1) + " " + matcher.group(2) : "";
    }

    static String quantityOf(String line) {
        for (Pattern pattern : QUANTITY_PATTERNS) {
            String quantity = firstGroup(pattern, line);
            if (!quantity.isEmpty()) {
                return quantity;
            }
        }
        return "";
    }

    private static String firstGroup(Pattern pattern, String value) {
        Matcher matcher = pattern.matcher(value);
        return matcher.find() ? matcher.group(1).trim() : "";
    }
}
