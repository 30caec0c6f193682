package ai.rxscan.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One medication line recovered from a scanned prescription.
 * Every field except the name may stay empty when it could not be read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Medication {

    /**
     * Medicine name as written, with any list numbering removed
     */
    @Builder.Default
    private String name = "";

    /**
     * Strength including its unit, e.g. "500mg"
     */
    @Builder.Default
    private String dosage = "";

    /**
     * Number of units to dispense
     */
    @Builder.Default
    private String quantity = "";

    /**
     * Canonical frequency label, e.g. "Twice daily"
     */
    @Builder.Default
    private String frequency = "";

    /**
     * Canonical timing label, e.g. "After meals"
     */
    @Builder.Default
    private String timing = "";

    /**
     * Treatment length, e.g. "5 days"
     */
    @Builder.Default
    private String duration = "";

    /**
     * The full source line, kept for the reviewer
     */
    @Builder.Default
    private String instructions = "";
}
