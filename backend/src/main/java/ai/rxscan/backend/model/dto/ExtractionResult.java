package ai.rxscan.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Terminal outcome of one extraction: either a draft with its summary, or an abort
 * with a reason and no partial data.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionResult {

    public enum Status {
        SUCCESS,
        ABORTED
    }

    private final Status status;
    private final PrescriptionDraft draft;
    private final ExtractionSummary summary;
    private final String reason;

    private ExtractionResult(Status status, PrescriptionDraft draft, ExtractionSummary summary, String reason) {
        this.status = status;
        this.draft = draft;
        this.summary = summary;
        this.reason = reason;
    }

    public static ExtractionResult success(PrescriptionDraft draft, ExtractionSummary summary) {
        return new ExtractionResult(Status.SUCCESS, draft, summary, null);
    }

    public static ExtractionResult aborted(String reason) {
        return new ExtractionResult(Status.ABORTED, null, null, reason);
    }

    @JsonIgnore
    public boolean isAborted() {
        return status == Status.ABORTED;
    }
}
