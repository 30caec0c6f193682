package ai.rxscan.backend.service.extraction;

import java.util.regex.Pattern;

/**
 * A raw-phrase pattern paired with the canonical label it normalizes to.
 */
public final class LabelPattern {

    private final Pattern pattern;
    private final String label;

    private LabelPattern(Pattern pattern, String label) {
        this.pattern = pattern;
        this.label = label;
    }

    /**
     * @param regex case-insensitive regex matched anywhere in a line
     * @param label canonical label returned on a match
     */
    public static LabelPattern of(String regex, String label) {
        return new LabelPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), label);
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }

    public String getLabel() {
        return label;
    }
}
