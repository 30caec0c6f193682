package ai.rxscan.backend.config;

import ai.rxscan.backend.service.extraction.DraftAssembler;
import ai.rxscan.backend.service.extraction.MedicationBlockLocator;
import ai.rxscan.backend.service.extraction.MedicationDetailExtractor;
import ai.rxscan.backend.service.extraction.MedicineNameValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the extraction engine. The engine classes are plain objects so they can be used
 * without a Spring context; this class only builds them from {@link ExtractionProperties}.
 */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

    @Bean
    public MedicineNameValidator medicineNameValidator() {
        return new MedicineNameValidator();
    }

    @Bean
    public MedicationBlockLocator medicationBlockLocator(MedicineNameValidator medicineNameValidator) {
        return new MedicationBlockLocator(medicineNameValidator);
    }

    @Bean
    public MedicationDetailExtractor medicationDetailExtractor() {
        return new MedicationDetailExtractor();
    }

    /**
     * @param properties extraction settings, supplies the confidence threshold
     * @return the shared, stateless draft assembler
     */
    @Bean
    public DraftAssembler draftAssembler(ExtractionProperties properties,
                                         MedicationBlockLocator medicationBlockLocator,
                                         MedicationDetailExtractor medicationDetailExtractor) {
        logger.info("Prescription extraction configured with minimum OCR confidence {}", properties.getMinConfidence());
        return new DraftAssembler(properties.getMinConfidence(), medicationBlockLocator, medicationDetailExtractor);
    }
}
