package ai.rxscan.backend.service;

import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.ExtractionSummary;
import ai.rxscan.backend.model.dto.Medication;
import ai.rxscan.backend.model.dto.PrescriptionDraft;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ExtractionMetricsService without a Spring context.
 */
class ExtractionMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private ExtractionMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new ExtractionMetricsService(meterRegistry);
    }

    @Test
    void shouldRecordSuccessfulExtraction() {
        PrescriptionDraft draft = PrescriptionDraft.builder()
                .medications(new ArrayList<>(List.of(
                        Medication.builder().name("Dolo").dosage("650mg").build(),
                        Medication.builder().name("Dolo").dosage("650mg").build())))
                .build();
        ExtractionSummary summary = ExtractionSummary.builder()
                .extractedFields(List.of("2 Medications"))
                .duplicateMedications(List.of("dolo|650mg"))
                .build();

        ExtractionResult result = metricsService.timeExtraction(() -> ExtractionResult.success(draft, summary));

        assertThat(result.getDraft()).isSameAs(draft);

        Timer timer = meterRegistry.find(ExtractionMetricsService.DURATION_TIMER).timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);

        Counter success = meterRegistry.find(ExtractionMetricsService.EXTRACTIONS_COUNTER)
                .tag("outcome", "success")
                .counter();
        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(1.0);

        assertThat(meterRegistry.find(ExtractionMetricsService.MEDICATIONS_COUNTER).counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.find(ExtractionMetricsService.DUPLICATES_COUNTER).counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordAbortedExtraction() {
        metricsService.timeExtraction(() -> ExtractionResult.aborted("OCR confidence too low"));

        Counter aborted = meterRegistry.find(ExtractionMetricsService.EXTRACTIONS_COUNTER)
                .tag("outcome", "aborted")
                .counter();
        assertThat(aborted).isNotNull();
        assertThat(aborted.count()).isEqualTo(1.0);
        assertThat(meterRegistry.find(ExtractionMetricsService.EXTRACTIONS_COUNTER)
                .tag("outcome", "success").counter().count()).isZero();
        assertThat(meterRegistry.find(ExtractionMetricsService.MEDICATIONS_COUNTER).counter().count())
                .isZero();
    }
}
