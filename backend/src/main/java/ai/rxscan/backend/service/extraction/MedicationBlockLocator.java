package ai.rxscan.backend.service.extraction;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the lines of a prescription that describe medications.
 *
 * <p>Three strategies are tried in order and the first one that yields at least one candidate
 * with an acceptable name wins; later strategies are not run:
 * <ol>
 *     <li>{@link Strategy#NUMBERED_LIST}: lines such as {@code 1. Amoxicillin 500mg ...}</li>
 *     <li>{@link Strategy#INLINE}: a name followed by a strength anywhere on a line</li>
 *     <li>{@link Strategy#RX_SECTION}: every non-blank line under an {@code Rx:} /
 *     {@code Prescription:} / {@code Medicines:} heading, up to a blank line or an
 *     {@code Instructions:} / {@code Note:} heading</li>
 * </ol>
 * Candidates keep their order of appearance.
 */
@Slf4j
public class MedicationBlockLocator {

    public enum Strategy {
        NUMBERED_LIST,
        INLINE,
        RX_SECTION
    }

    static final String DOSE = "\\d+(?:\\.\\d+)?[ \\t]*(?:mg|ml|g|iu|mcg|units?)\\b";
    static final String QUANTITY_UNIT = "(?:tablets?|tabs?|capsules?|caps?|ml|drops?)\\b";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    // Groups: 1 numbering, 2 name, 3 dosage span, 4 quantity, 5 trailing text
    private static final Pattern NUMBERED_LINE = Pattern.compile(
            "^([ \\t]*\\d+[.)]?[ \\t]*)([^\\n]*?)(" + DOSE + "[^\\n]*?)"
                    + "(?:[ \\t]+(\\d+)[ \\t]*" + QUANTITY_UNIT + ")?(?:[ \\t]+([^\\n]*?))?[ \\t]*$", FLAGS);

    // Groups: 1 name, 2 dosage span, 3 quantity, 4 trailing text
    private static final Pattern INLINE_SPAN = Pattern.compile(
            "([A-Za-z][A-Za-z \\t]{2,30}?)[ \\t]+(" + DOSE + "[^\\n]*?)"
                    + "(?:[ \\t]+(\\d+)[ \\t]*" + QUANTITY_UNIT + ")?(?:[ \\t]+([^\\n]*?))?[ \\t]*$", FLAGS);

    private static final Pattern RX_HEADING = Pattern.compile(
            "\\b(?:rx|prescription|medicines?)\\b[ \\t]*:?\\s*([\\s\\S]*?)(?:\\n[ \\t]*\\n|instructions?:|notes?:|\\z)",
            Pattern.CASE_INSENSITIVE);

    // Groups: 1 numbering, 2 name, 3 dosage span, 4 quantity, 5 trailing text
    private static final Pattern SECTION_LINE = Pattern.compile(
            "(\\d+[.)]?[ \\t]*)?(.*?)(" + DOSE + ".*?)"
                    + "(?:[ \\t]+(\\d+)[ \\t]*" + QUANTITY_UNIT + ")?(?:[ \\t]+(.*?))?", Pattern.CASE_INSENSITIVE);

    private final MedicineNameValidator nameValidator;

    public MedicationBlockLocator(MedicineNameValidator nameValidator) {
        this.nameValidator = nameValidator;
    }

    /**
     * @param text OCR text, may be empty
     * @return accepted candidates of the first productive strategy, in source order; empty if none
     */
    public List<MedicationCandidate> locate(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        for (Strategy strategy : Strategy.values()) {
            List<MedicationCandidate> accepted = accept(run(strategy, text));
            if (!accepted.isEmpty()) {
                log.debug("Medication strategy {} produced {} candidate(s)", strategy, accepted.size());
                return accepted;
            }
        }
        log.debug("No medication strategy produced candidates");
        return List.of();
    }

    List<MedicationCandidate> run(Strategy strategy, String text) {
        switch (strategy) {
            case NUMBERED_LIST:
                return numberedList(text);
            case INLINE:
                return inline(text);
            case RX_SECTION:
                return rxSection(text);
            default:
                throw new IllegalArgumentException("Unknown strategy " + strategy);
        }
    }

    private List<MedicationCandidate> accept(List<MedicationCandidate> candidates) {
        List<MedicationCandidate> accepted = new ArrayList<>(candidates.size());
        for (MedicationCandidate candidate : candidates) {
            if (!candidate.getDosageInfo().isEmpty() && nameValidator.isValid(candidate.getName())) {
                accepted.add(candidate);
            } else {
                log.debug("Dropped {} candidate with rejected name", candidate.getStrategy());
            }
        }
        return accepted;
    }

    private List<MedicationCandidate> numberedList(String text) {
        List<MedicationCandidate> candidates = new ArrayList<>();
        Matcher matcher = NUMBERED_LINE.matcher(text);
        while (matcher.find()) {
            candidates.add(new MedicationCandidate(matcher.group(2), matcher.group(3), matcher.group(4),
                    matcher.group(), Strategy.NUMBERED_LIST));
        }
        return candidates;
    }

    private List<MedicationCandidate> inline(String text) {
        List<MedicationCandidate> candidates = new ArrayList<>();
        Matcher matcher = INLINE_SPAN.matcher(text);
        while (matcher.find()) {
            candidates.add(new MedicationCandidate(matcher.group(1), matcher.group(2), matcher.group(3),
                    matcher.group(), Strategy.INLINE));
        }
        return candidates;
    }

    private List<MedicationCandidate> rxSection(String text) {
        Matcher heading = RX_HEADING.matcher(text);
        if (!heading.find()) {
            return List.of();
        }
        List<MedicationCandidate> candidates = new ArrayList<>();
        for (String rawLine : heading.group(1).split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher = SECTION_LINE.matcher(line);
            if (matcher.matches()) {
                candidates.add(new MedicationCandidate(matcher.group(2), matcher.group(3), matcher.group(4),
                        line, Strategy.RX_SECTION));
            }
        }
        return candidates;
    }
}
