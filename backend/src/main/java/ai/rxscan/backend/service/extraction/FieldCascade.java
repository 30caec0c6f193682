package ai.rxscan.backend.service.extraction;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered sequence of extraction attempts for one scalar field.
 *
 * <p>Each step pairs a pattern with a resolver. Only the first match of a pattern is
 * considered; the resolver turns it into a value or rejects it (failed validation), in
 * which case the next step is tried. The first accepted value wins; when every step
 * fails the field is "".
 */
@Slf4j
public final class FieldCascade {

    private final String fieldName;
    private final List<Step> steps;

    private FieldCascade(String fieldName, List<Step> steps) {
        this.fieldName = fieldName;
        this.steps = List.copyOf(steps);
    }

    public static Builder named(String fieldName) {
        return new Builder(fieldName);
    }

    /**
     * Runs the cascade over the text.
     *
     * @param text text to search, may be empty
     * @return the first accepted value, or "" when no step produced one
     */
    public String extract(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            Matcher matcher = step.pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            Optional<String> value = step.resolver.apply(matcher.toMatchResult());
            if (value.isPresent()) {
                log.debug("Field {} resolved by pattern #{}", fieldName, i + 1);
                return value.get();
            }
            log.debug("Field {} pattern #{} matched but failed validation", fieldName, i + 1);
        }
        return "";
    }

    public String getFieldName() {
        return fieldName;
    }

    int size() {
        return steps.size();
    }

    private static final class Step {
        private final Pattern pattern;
        private final Function<MatchResult, Optional<String>> resolver;

        private Step(Pattern pattern, Function<MatchResult, Optional<String>> resolver) {
            this.pattern = pattern;
            this.resolver = resolver;
        }
    }

    public static final class Builder {
        private final String fieldName;
        private final List<Step> steps = new ArrayList<>();

        private Builder(String fieldName) {
            this.fieldName = fieldName;
        }

        public Builder then(Pattern pattern, Function<MatchResult, Optional<String>> resolver) {
            steps.add(new Step(pattern, resolver));
            return this;
        }

        public FieldCascade build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Cascade for " + fieldName + " has no patterns");
            }
            return new FieldCascade(fieldName, steps);
        }
    }
}
