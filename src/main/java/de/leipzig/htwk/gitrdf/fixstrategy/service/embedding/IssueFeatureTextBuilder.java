package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;

/**
 * Builds the text that gets embedded for an issue.
 *
 * Only the file name is used, not the full path, so the same finding in two
 * checkouts lands on the same text.
 */
public final class IssueFeatureTextBuilder {

    static final int MAX_MESSAGE_LENGTH = 1000;

    // Sentence boundary pattern for smart truncation
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+\\s+");

    private IssueFeatureTextBuilder() {
    }

    public static String buildFeatureText(Issue issue) {
        if (issue == null) {
            throw new IllegalArgumentException("Issue cannot be null");
        }

        List<String> parts = new ArrayList<>();
        parts.add("type: " + issue.type().getValue());
        if (!issue.stage().isBlank()) {
            parts.add("stage: " + issue.stage().trim());
        }
        parts.add("message: " + messageText(issue));

        String fileName = fileName(issue.filePath());
        if (fileName != null) {
            parts.add("file: " + fileName);
        }
        if (issue.lineNumber() != null) {
            parts.add("line: " + issue.lineNumber());
        }
        return String.join(" | ", parts);
    }

    static String messageText(Issue issue) {
        return smartTruncate(issue.message().trim(), MAX_MESSAGE_LENGTH);
    }

    /**
     * Cut at the last sentence boundary before the limit, or hard-cut if there is none
     */
    static String smartTruncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }

        String head = text.substring(0, maxLength);
        var matcher = SENTENCE_BOUNDARY.matcher(head);
        int lastBoundary = -1;
        while (matcher.find()) {
            lastBoundary = matcher.start() + 1;
        }
        if (lastBoundary > maxLength / 2) {
            return head.substring(0, lastBoundary).trim();
        }
        return head.trim();
    }

    static String fileName(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return null;
        }
        try {
            Path fileName = Path.of(filePath.trim()).getFileName();
            return fileName != null ? fileName.toString() : null;
        } catch (RuntimeException e) {
            // not a valid path on this platform, keep it as reported
            return filePath.trim();
        }
    }
}
