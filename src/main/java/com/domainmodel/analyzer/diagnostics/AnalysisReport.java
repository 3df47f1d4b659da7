package com.domainmodel.analyzer.diagnostics;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Issues (errors/warnings/infos) accumulated during one analysis run.
 *
 * Pure structure only: no logging, no formatting, no IO. Safe to add to from
 * several worker threads.
 */
public class AnalysisReport {

    private final List<AnalysisIssue> issues = new CopyOnWriteArrayList<>();

    public void add(AnalysisIssue issue) {
        issues.add(issue);
    }

    public void addAll(Collection<AnalysisIssue> more) {
        issues.addAll(more);
    }

    public List<AnalysisIssue> getIssues() {
        return List.copyOf(issues);
    }

    public List<AnalysisIssue> getErrors() {
        return bySeverity(Severity.ERROR);
    }

    public List<AnalysisIssue> getWarnings() {
        return bySeverity(Severity.WARNING);
    }

    public List<AnalysisIssue> getInfos() {
        return bySeverity(Severity.INFO);
    }

    public List<AnalysisIssue> ofKind(IssueKind kind) {
        return issues.stream().filter(i -> i.getKind() == kind).toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.getSeverity() == Severity.ERROR);
    }

    public boolean hasRunFailingIssues() {
        return issues.stream().anyMatch(i -> i.getKind().isRunFailing());
    }

    private List<AnalysisIssue> bySeverity(Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).toList();
    }
}
