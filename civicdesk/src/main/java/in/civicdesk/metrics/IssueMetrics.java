package in.civicdesk.metrics;

import in.civicdesk.domain.issue.IssueStatus;

import java.time.Instant;

/**
 * Operational counters for intake, authentication and escalation.
 *
 * Implementations:
 * - PrometheusIssueMetrics: exposed at /metrics
 * - NOOP: for tests and embedded use
 */
public interface IssueMetrics {

    /**
     * Record a created issue with the status the intake gate assigned.
     */
    void recordIssueCreated(IssueStatus initialStatus);

    /**
     * Record media rejected by the authenticity gate.
     *
     * @param reason Rejection reason ("no media", "image too small", ...)
     */
    void recordMediaRejected(String reason);

    /**
     * Record an operator update (PATCH).
     */
    void recordIssueUpdated();

    /**
     * Record a failed authentication.
     *
     * @param operation login | token
     */
    void recordAuthFailure(String operation);

    /**
     * Record one issue escalated by the scheduler.
     */
    void recordEscalation();

    /**
     * Record one issue the scheduler failed to escalate.
     */
    void recordEscalationFailure();

    /**
     * Record completion of an escalation scan.
     */
    void recordEscalationRun(Instant completedAt);

    IssueMetrics NOOP = new IssueMetrics() {
        @Override public void recordIssueCreated(IssueStatus initialStatus) {}
        @Override public void recordMediaRejected(String reason) {}
        @Override public void recordIssueUpdated() {}
        @Override public void recordAuthFailure(String operation) {}
        @Override public void recordEscalation() {}
        @Override public void recordEscalationFailure() {}
        @Override public void recordEscalationRun(Instant completedAt) {}
    };
}
