package de.leipzig.htwk.gitrdf.fixstrategy.model.Requests;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecordAttemptRequest {

    @Valid
    @NotNull(message = "Issue is required")
    private IssuePayload issue;

    @NotBlank(message = "Agent is required")
    private String agentUsed;

    @NotBlank(message = "Strategy is required")
    private String strategy;

    @NotNull(message = "Outcome (success) is required")
    private Boolean success;

    @DecimalMin(value = "0.0", message = "Confidence must be at least 0.0")
    @DecimalMax(value = "1.0", message = "Confidence must be at most 1.0")
    private Double confidence = 0.0;

    private String sessionId;
}
