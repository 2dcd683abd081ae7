package de.leipzig.htwk.gitrdf.fixstrategy.model.Requests;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecommendRequest {

    @Valid
    @NotNull(message = "Issue is required")
    private IssuePayload issue;

    // Optional, range-checked by RequestValidator
    private Integer k;
    private Double minConfidence;
}
