package in.civicdesk.metrics;

import in.civicdesk.domain.issue.IssueStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.time.Instant;

/**
 * Prometheus implementation of IssueMetrics.
 *
 * Key Metrics:
 * - civicdesk_issues_created_total{status}
 * - civicdesk_media_rejections_total{reason}
 * - civicdesk_issue_updates_total
 * - civicdesk_auth_failures_total{op}
 * - civicdesk_escalations_total / civicdesk_escalation_failures_total
 * - civicdesk_escalation_last_run_seconds (unix time of last completed scan)
 */
public class PrometheusIssueMetrics implements IssueMetrics {

    private final CollectorRegistry registry;

    private final Counter issuesCreated;
    private final Counter mediaRejections;
    private final Counter issueUpdates;
    private final Counter authFailures;
    private final Counter escalations;
    private final Counter escalationFailures;
    private final Gauge escalationLastRun;

    public PrometheusIssueMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.issuesCreated = Counter.build()
            .name("civicdesk_issues_created_total")
            .help("Total number of issues created, by initial status")
            .labelNames("status")
            .register(registry);

        this.mediaRejections = Counter.build()
            .name("civicdesk_media_rejections_total")
            .help("Total number of submissions rejected by the media authenticity gate")
            .labelNames("reason")
            .register(registry);

        this.issueUpdates = Counter.build()
            .name("civicdesk_issue_updates_total")
            .help("Total number of operator updates")
            .register(registry);

        this.authFailures = Counter.build()
            .name("civicdesk_auth_failures_total")
            .help("Total number of failed authentications")
            .labelNames("op")
            .register(registry);

        this.escalations = Counter.build()
            .name("civicdesk_escalations_total")
            .help("Total number of issues escalated by the scheduler")
            .register(registry);

        this.escalationFailures = Counter.build()
            .name("civicdesk_escalation_failures_total")
            .help("Total number of issues the scheduler failed to escalate")
            .register(registry);

        this.escalationLastRun = Gauge.build()
            .name("civicdesk_escalation_last_run_seconds")
            .help("Unix time of the last completed escalation scan")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordIssueCreated(IssueStatus initialStatus) {
        issuesCreated.labels(initialStatus.wireName()).inc();
    }

    @Override
    public void recordMediaRejected(String reason) {
        mediaRejections.labels(reason != null ? reason : "unknown").inc();
    }

    @Override
    public void recordIssueUpdated() {
        issueUpdates.inc();
    }

    @Override
    public void recordAuthFailure(String operation) {
        authFailures.labels(operation).inc();
    }

    @Override
    public void recordEscalation() {
        escalations.inc();
    }

    @Override
    public void recordEscalationFailure() {
        escalationFailures.inc();
    }

    @Override
    public void recordEscalationRun(Instant completedAt) {
        escalationLastRun.set(completedAt.toEpochMilli() / 1000.0);
    }
}
