package ai.rxscan.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * User feedback about an extraction: which fields were populated and a ready-made message.
 * Not authoritative; the draft itself is the source of truth.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionSummary {

    /**
     * Labels of the populated fields, in a fixed order, e.g. "Patient Email", "2 Medications"
     */
    @Builder.Default
    private List<String> extractedFields = new ArrayList<>();

    /**
     * "name|dosage" keys that occur more than once among the medications
     */
    @Builder.Default
    private List<String> duplicateMedications = new ArrayList<>();

    /**
     * Message shown to the reviewer
     */
    @Builder.Default
    private String message = "";

    @JsonIgnore
    public boolean isEmpty() {
        return extractedFields.isEmpty();
    }
}
