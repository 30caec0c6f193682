package ai.rxscan.backend.service;

import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.RawInput;
import ai.rxscan.backend.service.extraction.DraftAssembler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Default implementation of the PrescriptionExtractionService.
 *
 * This service is responsible for:
 * <ul>
 *     <li>Running the extraction engine on each scan</li>
 *     <li>Recording extraction metrics</li>
 * </ul>
 *
 * Nothing is stored: the result is handed back to the caller, which passes it on to the review step.
 */
@Service
public class PrescriptionExtractionServiceImpl implements PrescriptionExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(PrescriptionExtractionServiceImpl.class);

    private final DraftAssembler draftAssembler;
    private final ExtractionMetricsService metricsService;

    /**
     * Constructs the service with the extraction engine and the metrics service.
     *
     * @param draftAssembler the stateless extraction engine
     * @param metricsService service for recording extraction metrics
     */
    @Autowired
    public PrescriptionExtractionServiceImpl(DraftAssembler draftAssembler, ExtractionMetricsService metricsService) {
        this.draftAssembler = draftAssembler;
        this.metricsService = metricsService;
    }

    @Override
    public ExtractionResult extract(RawInput input) {
        Objects.requireNonNull(input, "input must not be null");
        logger.info("Extracting prescription draft from {}", input);

        ExtractionResult result = metricsService.timeExtraction(() -> draftAssembler.assemble(input));

        if (result.isAborted()) {
            logger.info("Prescription extraction aborted");
        } else {
            logger.info("Prescription extraction finished with {} medication(s) and {} populated field(s)",
                    result.getDraft().getMedications().size(),
                    result.getSummary().getExtractedFields().size());
        }
        return result;
    }
}
