package in.civicdesk.service.escalation;

import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueFilter;
import in.civicdesk.domain.repository.IssueRepository;
import in.civicdesk.metrics.IssueMetrics;
import in.civicdesk.service.issue.IssueLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically promotes stale unresolved issues to ASSIGNED.
 *
 * An issue is stale once it is older than the staleness window (measured from
 * createdAt). Each tick scans a snapshot of the store and escalates stale
 * issues one by one through {@link IssueLifecycleService#escalate}; a failure
 * on one issue is logged and does not stop the rest of the scan.
 */
public final class EscalationScheduler {
    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(60);
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofDays(7);
    public static final String DEFAULT_DEPARTMENT = "Commissioner";

    private final IssueRepository issueRepo;
    private final IssueLifecycleService lifecycle;
    private final IssueMetrics metrics;
    private final Clock clock;
    private final Duration period;
    private final Duration staleAfter;
    private final String department;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> task;

    public EscalationScheduler(IssueRepository issueRepo, IssueLifecycleService lifecycle,
                               IssueMetrics metrics, Clock clock) {
        this(issueRepo, lifecycle, metrics, clock, DEFAULT_PERIOD, DEFAULT_STALE_AFTER, DEFAULT_DEPARTMENT);
    }

    public EscalationScheduler(IssueRepository issueRepo, IssueLifecycleService lifecycle,
                               IssueMetrics metrics, Clock clock,
                               Duration period, Duration staleAfter, String department) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.issueRepo = issueRepo;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.clock = clock;
        this.period = period;
        this.staleAfter = staleAfter;
        this.department = department;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "EscalationScheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the recurring scan. The first scan runs one period after start.
     */
    public synchronized void start() {
        if (task != null) {
            log.warn("[ESCALATION] Already started");
            return;
        }
        log.info("[ESCALATION] Starting (period: {}s, stale after: {}d, department: {})",
            period.toSeconds(), staleAfter.toDays(), department);

        task = scheduler.scheduleAtFixedRate(
            this::tick,
            period.toMillis(),  // Initial delay
            period.toMillis(),  // Period
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Scan the store once and escalate every stale unresolved issue.
     *
     * @return number of issues whose status or department this scan changed
     */
    public int runOnce() {
        Instant now = clock.instant();
        List<Issue> snapshot = issueRepo.findAll(IssueFilter.all());

        int escalated = 0;
        int failed = 0;
        for (Issue issue : snapshot) {
            try {
                if (!isStale(issue, now)) {
                    continue;
                }
                if (lifecycle.escalate(issue.id(), department).isPresent()) {
                    escalated++;
                }
            } catch (Exception e) {
                failed++;
                metrics.recordEscalationFailure();
                log.error("[ESCALATION] Failed to escalate issue {}", issue != null ? issue.id() : null, e);
            }
        }

        metrics.recordEscalationRun(clock.instant());
        if (escalated > 0 || failed > 0) {
            log.info("[ESCALATION] Scan complete: {} escalated, {} failed, {} scanned",
                escalated, failed, snapshot.size());
        } else {
            log.debug("[ESCALATION] Scan complete: nothing to escalate ({} scanned)", snapshot.size());
        }
        return escalated;
    }

    boolean isStale(Issue issue, Instant now) {
        return !issue.isResolved() && Duration.between(issue.createdAt(), now).compareTo(staleAfter) > 0;
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    /**
     * Stop the recurring scan and release the scheduler thread.
     */
    public synchronized void stop() {
        log.info("[ESCALATION] Stopping");
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Exceptions escaping a scheduleAtFixedRate task cancel all later runs.
    private void tick() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("[ESCALATION] Scan failed", e);
        }
    }
}
