package com.domainmodel.analyzer.result;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;

/**
 * Structural checks on an analysis document. Problems are returned as
 * {@link IssueKind#DOCUMENT_INCONSISTENCY} warnings and never thrown.
 */
public class AnalysisDocumentValidator {

    public List<AnalysisIssue> validate(AnalysisDocument document) {
        List<AnalysisIssue> issues = new ArrayList<>();

        if (isBlank(document.getVersion())) {
            issues.add(issue("document", "Missing version"));
        }
        if (isBlank(document.getTimestamp())) {
            issues.add(issue("document", "Missing timestamp"));
        } else {
            try {
                Instant.parse(document.getTimestamp());
            } catch (DateTimeParseException e) {
                issues.add(issue("document", "Timestamp is not an ISO-8601 instant: " + document.getTimestamp()));
            }
        }
        if (document.getCallGraph() == null) {
            issues.add(issue("document", "Missing callGraph"));
            return issues;
        }

        for (Map.Entry<String, AggregateRootEntry> root : document.getCallGraph().entrySet()) {
            String aggregateRoot = root.getKey();
            if (root.getValue() == null || root.getValue().getMethods() == null) {
                issues.add(issue(aggregateRoot, "Aggregate root entry without methods"));
                continue;
            }
            for (Map.Entry<String, RepositoryMethodEntry> method : root.getValue().getMethods().entrySet()) {
                String location = aggregateRoot + "#" + method.getKey();
                if (method.getValue() == null || method.getValue().getCalls() == null) {
                    issues.add(issue(location, "Repository method entry without calls"));
                    continue;
                }
                for (Map.Entry<String, CallSiteEntry> call : method.getValue().getCalls().entrySet()) {
                    validateCall(aggregateRoot, method.getKey(), call.getKey(), call.getValue(), issues);
                }
            }
        }
        return issues;
    }

    private void validateCall(String aggregateRoot, String repositoryMethodKey, String callKey,
                              CallSiteEntry call, List<AnalysisIssue> issues) {
        String location = aggregateRoot + "#" + repositoryMethodKey + "#" + callKey;
        if (call == null) {
            issues.add(issue(location, "Empty call-site entry"));
            return;
        }
        if (!aggregateRoot.equals(call.getAggregateRoot())) {
            issues.add(issue(location, "aggregateRoot '" + call.getAggregateRoot() + "' does not match its key"));
        }
        String expectedMethodKey = call.getRepositoryMethod() + call.getRepositoryMethodDescriptor();
        if (!repositoryMethodKey.equals(expectedMethodKey)) {
            issues.add(issue(location, "repositoryMethod '" + expectedMethodKey + "' does not match its key"));
        }
        if (isBlank(call.getMethodClass()) || isBlank(call.getMethod())) {
            issues.add(issue(location, "Caller class or method missing"));
        } else if (!callKey.startsWith(call.getMethodClass() + "." + call.getMethod() + "+")) {
            issues.add(issue(location, "Call-site key does not match caller " + call.getMethodClass() + "." + call.getMethod()));
        }
        if (call.getRequiredFields() == null) {
            issues.add(issue(location, "Missing requiredFields"));
        }
    }

    private static AnalysisIssue issue(String location, String message) {
        return AnalysisIssue.of(IssueKind.DOCUMENT_INCONSISTENCY, location, message);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
