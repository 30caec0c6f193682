package ai.rxscan.backend;

import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.RawInput;
import ai.rxscan.backend.service.PrescriptionExtractionService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that the application context wires the extraction engine from configuration.
 */
@SpringBootTest(properties = "rxscan.extraction.min-confidence=50")
class RxScanApplicationTest {

    @Autowired
    private PrescriptionExtractionService extractionService;

    @Test
    void contextWiresConfiguredThreshold() {
        ExtractionResult lowConfidence = extractionService.extract(RawInput.of("Paracetamol 500mg", 40.0));
        ExtractionResult highConfidence = extractionService.extract(RawInput.of("Paracetamol 500mg", 90.0));

        assertThat(lowConfidence.isAborted()).isTrue();
        assertThat(highConfidence.getDraft().getMedications()).hasSize(1);
    }
}
