package ai.rxscan.backend.service.extraction;

import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.ExtractionSummary;
import ai.rxscan.backend.model.dto.Medication;
import ai.rxscan.backend.model.dto.PrescriptionDraft;
import ai.rxscan.backend.model.dto.RawInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns OCR text into a {@link PrescriptionDraft}.
 *
 * <p>Low OCR confidence aborts the whole extraction. Otherwise every field is extracted
 * independently and degrades to its default on its own; malformed text never raises.
 * The assembler keeps no state between calls and may be shared across threads.
 */
public class DraftAssembler {

    private static final Logger logger = LoggerFactory.getLogger(DraftAssembler.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 30;

    private final double minConfidence;
    private final MedicationBlockLocator locator;
    private final MedicationDetailExtractor detailExtractor;

    /**
     * Creates an assembler with the default confidence threshold and engine components.
     */
    public DraftAssembler() {
        this(DEFAULT_MIN_CONFIDENCE, new MedicationBlockLocator(new MedicineNameValidator()),
                new MedicationDetailExtractor());
    }

    /**
     * @param minConfidence   confidences strictly below this value abort the extraction
     * @param locator         finds medication lines
     * @param detailExtractor expands a medication line into its fields
     */
    public DraftAssembler(double minConfidence, MedicationBlockLocator locator,
                          MedicationDetailExtractor detailExtractor) {
        this.minConfidence = minConfidence;
        this.locator = locator;
        this.detailExtractor = detailExtractor;
    }

    /**
     * Extracts a draft from the input.
     *
     * @param input OCR text and optional confidence
     * @return a success carrying the draft and summary, or an abort when confidence is too low
     */
    public ExtractionResult assemble(RawInput input) {
        Optional<Double> confidence = input.getConfidence();
        if (confidence.isPresent() && confidence.get() < minConfidence) {
            logger.warn("Extraction aborted: OCR confidence {} below threshold {}", confidence.get(), minConfidence);
            return ExtractionResult.aborted(String.format(Locale.ROOT,
                    "OCR confidence %.1f is below the minimum of %.1f; please rescan the prescription",
                    confidence.get(), minConfidence));
        }

        String text = input.getText();
        PrescriptionDraft draft = PrescriptionDraft.builder().build();
        for (DraftField field : DraftField.values()) {
            if (field.isScalar()) {
                field.populate(draft, text);
            }
        }
        draft.setMedications(extractMedications(text));

        ExtractionSummary summary = summarize(draft);
        logger.debug("Extracted {} field(s), {} medication(s)",
                summary.getExtractedFields().size(), draft.getMedications().size());
        return ExtractionResult.success(draft, summary);
    }

    private List<Medication> extractMedications(String text) {
        List<Medication> medications = new ArrayList<>();
        for (MedicationCandidate candidate : locator.locate(text)) {
            medications.add(detailExtractor.extract(candidate));
        }
        return medications;
    }

    ExtractionSummary summarize(PrescriptionDraft draft) {
        List<String> extracted = new ArrayList<>();
        for (DraftField field : DraftField.values()) {
            if (field.isPopulated(draft)) {
                extracted.add(field.summaryLabel(draft));
            }
        }

        List<String> duplicates = findDuplicates(draft.getMedications());
        if (!duplicates.isEmpty()) {
            logger.warn("Draft contains {} repeated medication(s); left for the reviewer", duplicates.size());
        }

        String message = extracted.isEmpty()
                ? "Automatic parsing found limited structured data. Please fill in the fields manually."
                : "Successfully extracted: " + String.join(", ", extracted) + ". Please review and edit as needed.";

        return ExtractionSummary.builder()
                .extractedFields(extracted)
                .duplicateMedications(duplicates)
                .message(message)
                .build();
    }

    /**
     * Reports "name|dosage" keys seen more than once, compared case-insensitively, in first-seen order.
     * Medications are never merged.
     */
    static List<String> findDuplicates(List<Medication> medications) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Medication medication : medications) {
            String key = (medication.getName() + "|" + medication.getDosage()).toLowerCase(Locale.ROOT);
            counts.merge(key, 1, Integer::sum);
        }
        List<String> duplicates = new ArrayList<>();
        counts.forEach((key, count) -> {
            if (count > 1) {
                duplicates.add(key);
            }
        });
        return duplicates;
    }
}
