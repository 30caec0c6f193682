package ai.rxscan.backend.service.extraction;

import java.util.List;

/**
 * Ordered phrase tables that map prescription shorthand to canonical frequency and timing labels.
 *
 * <p>Lookup returns the label of the first entry, in declaration order, whose pattern occurs
 * in the line. Entries with multi-word phrases precede entries whose short tokens could fire
 * inside unrelated text, and every alternative is word-bounded so that e.g. "od" does not
 * match inside "food" and "night" does not match inside "midnight". Reordering an entry
 * changes extraction results.
 *
 * <p>Both tables are immutable.
 */
public final class CanonicalTables {

    public static final List<LabelPattern> FREQUENCY = List.of(
            LabelPattern.of("\\b(?:od|once daily|one daily|1 daily|once a day)\\b", "Once daily"),
            LabelPattern.of("\\b(?:bd|twice daily|two daily|2 daily|twice a day|bid)\\b", "Twice daily"),
            LabelPattern.of("\\b(?:tds|thrice daily|three daily|3 daily|three times|tid)\\b", "Three times daily"),
            LabelPattern.of("\\b(?:qds|four times|4 daily|four daily|qid)\\b", "Four times daily"),
            LabelPattern.of("\\b(?:q4h|every 4 hours)\\b", "Every 4 hours"),
            LabelPattern.of("\\b(?:q6h|every 6 hours)\\b", "Every 6 hours"),
            LabelPattern.of("\\b(?:q8h|every 8 hours)\\b", "Every 8 hours"),
            LabelPattern.of("\\b(?:q12h|every 12 hours)\\b", "Every 12 hours"),
            LabelPattern.of("\\b(?:prn|as needed|if needed|when required)\\b", "As needed"),
            LabelPattern.of("\\b(?:hs|at bedtime|before sleep|night time)\\b", "At bedtime")
    );

    public static final List<LabelPattern> TIMING = List.of(
            LabelPattern.of("\\b(?:after food|after meals?|pc|post meals?)\\b", "After meals"),
            LabelPattern.of("\\b(?:before food|before meals?|ac|pre meals?|empty stomach)\\b", "Before meals"),
            LabelPattern.of("\\b(?:with food|with meals?|during meals?)\\b", "With meals"),
            LabelPattern.of("\\b(?:at bedtime|bedtime|hs|before sleep)\\b", "At bedtime"),
            LabelPattern.of("\\b(?:morning|am)\\b", "Morning"),
            LabelPattern.of("\\b(?:evening|pm|night(?!\\s*time))\\b", "Evening")
    );

    private CanonicalTables() {
    }

    /**
     * @return the canonical frequency for the line, or "" when no entry matches
     */
    public static String frequencyOf(String line) {
        return lookup(FREQUENCY, line);
    }

    /**
     * @return the canonical timing for the line, or "" when no entry matches
     */
    public static String timingOf(String line) {
        return lookup(TIMING, line);
    }

    static String lookup(List<LabelPattern> table, String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        for (LabelPattern entry : table) {
            if (entry.matches(line)) {
                return entry.getLabel();
            }
        }
        return "";
    }
}
