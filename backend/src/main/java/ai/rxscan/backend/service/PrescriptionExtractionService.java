package ai.rxscan.backend.service;

import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.RawInput;

/**
 * Interface for turning OCR output of a prescription into a reviewable draft.
 */
public interface PrescriptionExtractionService {

    /**
     * Extracts a structured prescription draft from OCR text.
     *
     * @param input the recognized text and optional OCR confidence
     * @return a success with draft and summary, or an abort when the OCR confidence is too low
     */
    ExtractionResult extract(RawInput input);
}
