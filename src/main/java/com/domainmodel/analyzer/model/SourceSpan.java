package com.domainmodel.analyzer.model;

import java.util.Optional;

import lombok.Value;

/**
 * Inclusive line range in the source file. Diagnostics only.
 */
@Value
public class SourceSpan {

    public static final String UNKNOWN = "unknown";

    int startLine;
    int endLine;

    public static SourceSpan of(int startLine, int endLine) {
        return new SourceSpan(Math.min(startLine, endLine), Math.max(startLine, endLine));
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public static String format(Optional<SourceSpan> span) {
        return span.map(SourceSpan::toString).orElse(UNKNOWN);
    }

    /**
     * Parses {@code "start-end"}; anything else, including {@code "unknown"}, is empty.
     */
    public static Optional<SourceSpan> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int dash = text.indexOf('-');
        if (dash <= 0 || dash == text.length() - 1) {
            return Optional.empty();
        }
        try {
            return Optional.of(of(Integer.parseInt(text.substring(0, dash)), Integer.parseInt(text.substring(dash + 1))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return startLine + "-" + endLine;
    }
}
