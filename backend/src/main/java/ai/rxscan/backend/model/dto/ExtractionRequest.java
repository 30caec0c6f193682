package ai.rxscan.backend.model.dto;

/**
 * DTO carrying OCR output from the scanner client to the extraction endpoint.
 */
public class ExtractionRequest {

    /**
     * Text recognized from the prescription image.
     */
    private String text;

    /**
     * Recognizer confidence (0-100), if the OCR step reported one.
     */
    private Double confidence;

    /**
     * Default constructor.
     */
    public ExtractionRequest() {
    }

    /**
     * Constructor with all fields.
     *
     * @param text       recognized text
     * @param confidence recognizer confidence, may be null
     */
    public ExtractionRequest(String text, Double confidence) {
        this.text = text;
        this.confidence = confidence;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }
}
