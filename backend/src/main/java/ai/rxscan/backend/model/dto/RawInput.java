package ai.rxscan.backend.model.dto;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable OCR output handed to the extraction engine: the recognized text and,
 * when the recognizer reports one, its own confidence score (0-100).
 */
public final class RawInput {

    private final String text;
    private final Double confidence;

    private RawInput(String text, Double confidence) {
        if (confidence != null && (confidence.isNaN() || confidence < 0 || confidence > 100)) {
            throw new IllegalArgumentException("OCR confidence must be between 0 and 100");
        }
        this.text = text != null ? text : "";
        this.confidence = confidence;
    }

    /**
     * Creates an input without a confidence score; the confidence gate is skipped.
     *
     * @param text recognized text, {@code null} is treated as empty
     * @return the input
     */
    public static RawInput of(String text) {
        return new RawInput(text, null);
    }

    /**
     * Creates an input carrying the recognizer's confidence score.
     *
     * @param text       recognized text, {@code null} is treated as empty
     * @param confidence score in [0, 100], or {@code null} when unknown
     * @return the input
     * @throws IllegalArgumentException if the confidence is outside [0, 100]
     */
    public static RawInput of(String text, Double confidence) {
        return new RawInput(text, confidence);
    }

    public String getText() {
        return text;
    }

    public Optional<Double> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawInput)) {
            return false;
        }
        RawInput other = (RawInput) o;
        return text.equals(other.text) && Objects.equals(confidence, other.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, confidence);
    }

    // Text omitted: it carries patient data.
    @Override
    public String toString() {
        return "RawInput{length=" + text.length() + ", confidence=" + confidence + "}";
    }
}
