package de.leipzig.htwk.gitrdf.fixstrategy.model.Requests;

import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class IssuePayload {

    @NotBlank(message = "Issue type is required")
    private String type;

    @NotNull(message = "Issue message is required")
    private String message;

    private String filePath;

    @PositiveOrZero(message = "Line number must not be negative")
    private Integer lineNumber;

    private String stage;

    public Issue toIssue() {
        return new Issue(IssueType.fromString(type), message, filePath, lineNumber, stage);
    }
}
