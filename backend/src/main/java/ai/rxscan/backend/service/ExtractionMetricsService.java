package ai.rxscan.backend.service;

import ai.rxscan.backend.model.dto.ExtractionResult;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Records prescription extraction metrics with Micrometer.
 *
 * Metrics:
 * - prescription_extraction_duration_seconds: time spent in the engine
 * - prescription_extractions_total{outcome}: successes and confidence aborts
 * - prescription_medications_extracted_total: medications found across all drafts
 * - prescription_duplicate_medications_total: repeated name/dosage pairs left for review
 */
@Slf4j
@Service
public class ExtractionMetricsService {

    static final String DURATION_TIMER = "prescription_extraction_duration_seconds";
    static final String EXTRACTIONS_COUNTER = "prescription_extractions_total";
    static final String MEDICATIONS_COUNTER = "prescription_medications_extracted_total";
    static final String DUPLICATES_COUNTER = "prescription_duplicate_medications_total";

    private final Timer extractionTimer;
    private final Counter successCounter;
    private final Counter abortedCounter;
    private final Counter medicationsCounter;
    private final Counter duplicatesCounter;

    @Autowired
    public ExtractionMetricsService(MeterRegistry meterRegistry) {
        this.extractionTimer = Timer.builder(DURATION_TIMER)
                .description("Prescription text extraction duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.successCounter = Counter.builder(EXTRACTIONS_COUNTER)
                .description("Prescription extractions by outcome")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.abortedCounter = Counter.builder(EXTRACTIONS_COUNTER)
                .description("Prescription extractions by outcome")
                .tag("outcome", "aborted")
                .register(meterRegistry);
        this.medicationsCounter = Counter.builder(MEDICATIONS_COUNTER)
                .description("Medications extracted from prescription text")
                .register(meterRegistry);
        this.duplicatesCounter = Counter.builder(DUPLICATES_COUNTER)
                .description("Repeated name/dosage pairs flagged in drafts")
                .register(meterRegistry);
        log.info("ExtractionMetricsService initialized with MeterRegistry");
    }

    /**
     * Times an extraction and records its outcome.
     *
     * @param extraction the extraction to run
     * @return the extraction result
     */
    public ExtractionResult timeExtraction(Supplier<ExtractionResult> extraction) {
        ExtractionResult result = extractionTimer.record(extraction);
        recordOutcome(result);
        return result;
    }

    private void recordOutcome(ExtractionResult result) {
        if (result == null) {
            return;
        }
        if (result.isAborted()) {
            abortedCounter.increment();
            return;
        }
        successCounter.increment();
        medicationsCounter.increment(result.getDraft().getMedications().size());
        duplicatesCounter.increment(result.getSummary().getDuplicateMedications().size());
    }
}
