package ai.rxscan.backend.controller;

import ai.rxscan.backend.model.dto.ExtractionRequest;
import ai.rxscan.backend.model.dto.ExtractionResult;
import ai.rxscan.backend.model.dto.RawInput;
import ai.rxscan.backend.service.PrescriptionExtractionService;

import io.micrometer.core.annotation.Timed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller that turns scanned prescription text into a reviewable draft.
 * This controller is part of API version 1 and requires JWT-based authentication.
 *
 * The response is the transfer object the client carries from the scanner screen to the
 * prescription form; nothing is kept on the server.
 */
@RestController
@RequestMapping("/api/v1")
public class PrescriptionExtractionController {

    private static final Logger logger = LoggerFactory.getLogger(PrescriptionExtractionController.class);

    private final PrescriptionExtractionService extractionService;
    private final int maxTextLength;

    /**
     * Constructs the controller with the extraction service.
     *
     * @param extractionService the service that runs the extraction engine
     * @param maxTextLength     longest accepted OCR text
     */
    @Autowired
    public PrescriptionExtractionController(PrescriptionExtractionService extractionService,
                                            @Value("${rxscan.extraction.max-text-length:20000}") int maxTextLength) {
        this.extractionService = extractionService;
        this.maxTextLength = maxTextLength;
    }

    /**
     * Extracts patient details, medications, instructions and expiry date from OCR text.
     *
     * @param jwt     the decoded JWT token of the authenticated user
     * @param request OCR text and optional confidence
     * @return 200 with the draft, 422 when OCR confidence is too low, 400 on invalid input
     */
    @Timed(value = "http_request_duration_seconds", description = "Prescription extraction request duration", extraTags = {"endpoint", "/api/v1/prescriptions/extract", "operation", "prescription_extraction"})
    @PostMapping("/prescriptions/extract")
    public ResponseEntity<ExtractionResult> extract(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody ExtractionRequest request
    ) {
        // Unit tests with MockMvc run without a security context, so jwt may be null.
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        logger.info("Received /prescriptions/extract request from user: {}", userId);

        if (request == null || request.getText() == null || request.getText().isBlank()) {
            logger.warn("Invalid request received: empty or missing text field");
            return ResponseEntity.badRequest().build();
        }
        if (request.getText().length() > maxTextLength) {
            logger.warn("Invalid request received: text length {} exceeds {}", request.getText().length(), maxTextLength);
            return ResponseEntity.badRequest().build();
        }

        RawInput input;
        try {
            input = RawInput.of(request.getText(), request.getConfidence());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid request received: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        try {
            ExtractionResult result = extractionService.extract(input);
            if (result.isAborted()) {
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
            }
            return ResponseEntity.ok(result);
        } catch (RuntimeException e) {
            logger.error("Error extracting prescription for user {}: {}", userId, e.getClass().getSimpleName(), e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
