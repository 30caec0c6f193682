package ai.rxscan.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for prescription text extraction, bound from {@code rxscan.extraction.*}.
 */
@Validated
@ConfigurationProperties(prefix = "rxscan.extraction")
public class ExtractionProperties {

    /**
     * OCR confidences strictly below this value abort extraction.
     */
    @DecimalMin("0")
    @DecimalMax("100")
    private double minConfidence = 30;

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }
}
