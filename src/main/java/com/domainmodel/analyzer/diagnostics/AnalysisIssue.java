package com.domainmodel.analyzer.diagnostics;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One reported problem. Carried by return value, never thrown.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisIssue {

    @NonNull
    IssueKind kind;

    @NonNull
    Severity severity;

    @NonNull
    String message;

    /** Class, method or call-site identity the issue is about. */
    String location;

    Throwable cause;

    public static AnalysisIssue of(IssueKind kind, String location, String message) {
        return AnalysisIssue.builder()
                .kind(kind)
                .severity(kind.getDefaultSeverity())
                .location(location)
                .message(message)
                .build();
    }

    public static AnalysisIssue of(IssueKind kind, String location, String message, Throwable cause) {
        return of(kind, location, message).toBuilder().cause(cause).build();
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public String describe() {
        return location == null
                ? kind + ": " + message
                : kind + " [" + location + "]: " + message;
    }
}
