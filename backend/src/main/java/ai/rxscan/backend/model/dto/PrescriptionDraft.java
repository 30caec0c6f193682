package ai.rxscan.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort structured prescription produced from OCR text.
 *
 * The draft is advisory: a reviewer edits every field before a prescription is created
 * from it. Fields that could not be extracted keep their defaults (empty string,
 * {@code usageLimit = 1}, no medications).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionDraft {

    @Builder.Default
    private String patientEmail = "";

    @Builder.Default
    private String patientMobile = "";

    @Builder.Default
    private String patientName = "";

    /**
     * Free-text instructions for the whole prescription
     */
    @Builder.Default
    private String instructions = "";

    /**
     * Medications in order of appearance in the source text
     */
    @Builder.Default
    private List<Medication> medications = new ArrayList<>();

    @Builder.Default
    private String age = "";

    /**
     * Weight in kilograms
     */
    @Builder.Default
    private String weight = "";

    /**
     * Height in centimeters
     */
    @Builder.Default
    private String height = "";

    /**
     * Number of times the prescription may be dispensed
     */
    @Builder.Default
    private int usageLimit = 1;

    /**
     * Expiry date as YYYY-MM-DD
     */
    @Builder.Default
    private String expiresAt = "";

    @Builder.Default
    private String doctorName = "";

    @Builder.Default
    private String doctorEmail = "";

    @Builder.Default
    private String doctorMobile = "";

    @Builder.Default
    private String clinicName = "";

    @Builder.Default
    private String clinicAddress = "";
}
