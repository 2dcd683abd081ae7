package de.leipzig.htwk.gitrdf.fixstrategy.model.Requests;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class FeedbackRequest {

    @NotBlank(message = "Strategy key (agent:strategy) is required")
    private String agentStrategy;

    @NotNull(message = "Accepted flag is required")
    private Boolean accepted;

    private Double confidence;
    private String issueType;
    private String sessionId;
}
