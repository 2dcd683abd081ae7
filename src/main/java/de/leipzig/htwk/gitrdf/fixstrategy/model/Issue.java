package de.leipzig.htwk.gitrdf.fixstrategy.model;

import java.util.Objects;

/**
 * A single quality finding as handed over by the orchestrator.
 *
 * @param type       kind of finding
 * @param message    tool message, never null
 * @param filePath   file the finding points at, may be null
 * @param lineNumber line within the file, may be null
 * @param stage      tag of the tool/stage that produced the finding
 */
public record Issue(IssueType type, String message, String filePath, Integer lineNumber, String stage) {

    public Issue {
        Objects.requireNonNull(type, "type");
        message = message != null ? message : "";
        stage = stage != null ? stage : "";
    }

    public Issue(IssueType type, String message, String filePath, String stage) {
        this(type, message, filePath, null, stage);
    }
}
