package de.leipzig.htwk.gitrdf.fixstrategy.exception;

import java.util.List;
import java.util.Map;

import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import lombok.Getter;

/**
 * A request value that passed bean validation but makes no sense for the fix-strategy memory.
 * Carries one rejected field plus what the orchestrator should send instead.
 */
@Getter
public class RequestValidationException extends RuntimeException {

    private final String requestType;
    private final FieldRejection rejection;
    private final Map<String, Object> validExample;

    private RequestValidationException(String requestType, FieldRejection rejection, Map<String, Object> validExample) {
        super(rejection.message());
        this.requestType = requestType;
        this.rejection = rejection;
        this.validExample = validExample;
    }

    /**
     * Issue type that is not one of {@link IssueType}; lists every supported wire value
     */
    public static RequestValidationException unsupportedIssueType(String field, String provided, String closestMatch) {
        return new RequestValidationException("issue type validation",
            new FieldRejection(field, provided,
                String.format("Unsupported issue type '%s'", provided),
                IssueType.getAllValues(),
                String.format("Did you mean '%s'?", closestMatch)),
            Map.of(field, closestMatch));
    }

    /**
     * Numeric value outside the range the recommender accepts
     */
    public static RequestValidationException outOfRange(String requestType, String field, Number provided,
                                                        String range, String suggestion, Number example) {
        return new RequestValidationException(requestType,
            new FieldRejection(field, provided,
                String.format("%s %s is out of valid range %s", field, provided, range),
                List.of(range),
                suggestion),
            example != null ? Map.of(field, example) : null);
    }

    /**
     * Strategy key that is not of the form "agent:strategy"
     */
    public static RequestValidationException malformedStrategyKey(String field, String provided) {
        return new RequestValidationException("strategy key validation",
            new FieldRejection(field, provided,
                "Strategy key must have the form 'agent:strategy'",
                List.of(),
                "Use the agentStrategy value returned by /recommendations"),
            Map.of(field, "RefactoringAgent:extract_method"));
    }

    public record FieldRejection(String field, Object providedValue, String message,
                                 List<String> allowedValues, String suggestion) {
    }
}
