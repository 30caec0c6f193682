package ai.rxscan.backend.service.extraction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * One line span that looks like a medication, split into the parts the locator recognized.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MedicationCandidate {

    private static final Pattern LEADING_NUMBERING = Pattern.compile("^[\\d.\\s]+");

    /**
     * Name with list numbering removed and whitespace trimmed
     */
    private final String name;

    /**
     * Span starting at the strength, e.g. "500mg"
     */
    private final String dosageInfo;

    /**
     * Quantity captured next to the strength, or ""
     */
    private final String quantityInfo;

    /**
     * Whole matched line, trimmed
     */
    private final String fullLine;

    private final MedicationBlockLocator.Strategy strategy;

    MedicationCandidate(String rawName, String dosageInfo, String quantityInfo, String fullLine,
                        MedicationBlockLocator.Strategy strategy) {
        this.name = LEADING_NUMBERING.matcher(nullToEmpty(rawName)).replaceFirst("").trim();
        this.dosageInfo = nullToEmpty(dosageInfo).trim();
        this.quantityInfo = nullToEmpty(quantityInfo).trim();
        this.fullLine = nullToEmpty(fullLine).trim();
        this.strategy = strategy;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
