package in.civicdesk.service.issue;

import in.civicdesk.domain.common.IssueNotFoundException;
import in.civicdesk.domain.common.ValidationException;
import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueFilter;
import in.civicdesk.domain.issue.IssueStatus;
import in.civicdesk.domain.issue.IssueUpdate;
import in.civicdesk.domain.issue.Media;
import in.civicdesk.domain.issue.NewIssue;
import in.civicdesk.domain.repository.IssueRepository;
import in.civicdesk.metrics.IssueMetrics;
import in.civicdesk.service.classification.IssueCategories;
import in.civicdesk.service.media.MediaAssessment;
import in.civicdesk.service.media.MediaAuthenticityGate;
import in.civicdesk.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Issue lifecycle: intake, operator updates, queries and escalation.
 *
 * STATUS RULES:
 * - Intake: REPORTED if the media gate accepts the evidence, SPAM otherwise.
 * - Operator update: any status may replace any status (administrator override).
 * - Escalation: any non-RESOLVED status becomes ASSIGNED.
 *
 * All mutations go through {@link IssueRepository#update}, so this class never
 * holds a mutable copy of an issue.
 */
public final class IssueLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(IssueLifecycleService.class);

    private final IssueRepository issueRepo;
    private final MediaAuthenticityGate mediaGate;
    private final IssueMetrics metrics;
    private final Clock clock;
    private final IdGenerator ids = new IdGenerator("I");

    public IssueLifecycleService(IssueRepository issueRepo, MediaAuthenticityGate mediaGate,
                                 IssueMetrics metrics, Clock clock) {
        this.issueRepo = issueRepo;
        this.mediaGate = mediaGate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Create an issue on behalf of an authenticated user.
     *
     * @throws ValidationException if description or priority is missing
     */
    public Issue create(String userId, NewIssue request) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (request.description() == null || request.description().isBlank() || request.priority() == null) {
            throw new ValidationException("description and priority are required");
        }

        MediaAssessment assessment = mediaGate.assess(request.media());
        IssueStatus initialStatus = assessment.accepted() ? IssueStatus.REPORTED : IssueStatus.SPAM;
        if (!assessment.accepted()) {
            metrics.recordMediaRejected(assessment.reason());
        }

        Instant now = clock.instant();
        Issue issue = new Issue(
            ids.next(now),
            userId,
            request.category() != null && !request.category().isBlank() ? request.category() : IssueCategories.OTHER,
            request.description(),
            request.priority(),
            Boolean.TRUE.equals(request.emergency()),
            initialStatus,
            request.department() != null && !request.department().isBlank() ? request.department() : null,
            request.location(),
            request.media(),
            request.voice(),
            now,
            now
        );
        issueRepo.insert(issue);
        metrics.recordIssueCreated(initialStatus);

        if (assessment.accepted()) {
            log.info("Issue created: {} by {} ({}, {})", issue.id(), userId,
                issue.category(), issue.priority().wireName());
        } else {
            log.info("Issue created as SPAM: {} by {} (media: {})", issue.id(), userId, assessment.reason());
        }
        return issue;
    }

    /**
     * Apply an operator update. Fields left null are unchanged; updatedAt is
     * refreshed even when nothing else changes.
     *
     * @throws IssueNotFoundException if the id is unknown
     */
    public Issue updateStatus(String issueId, IssueUpdate update) {
        Instant now = clock.instant();
        Issue updated = issueRepo.update(issueId, current -> current.apply(update, now))
            .orElseThrow(() -> new IssueNotFoundException(issueId));
        metrics.recordIssueUpdated();

        log.info("Issue updated: {} → status={}, department={}, priority={}", issueId,
            updated.status().wireName(), updated.department(), updated.priority().wireName());
        return updated;
    }

    /**
     * @throws IssueNotFoundException if the id is unknown
     */
    public Issue get(String issueId) {
        return issueRepo.findById(issueId).orElseThrow(() -> new IssueNotFoundException(issueId));
    }

    /**
     * Issues matching the filter, most recent first.
     */
    public List<Issue> list(IssueFilter filter) {
        return issueRepo.findAll(filter);
    }

    /**
     * Run the media gate without creating anything.
     */
    public MediaAssessment assessMedia(Media media) {
        return mediaGate.assess(media);
    }

    /**
     * Force an issue to ASSIGNED, keeping its department or filling in the
     * fallback, and refresh updatedAt. The RESOLVED check happens under the
     * store's write lock, so an issue resolved concurrently is left alone.
     *
     * @return the issue if this call changed its status or department; empty
     *         if it was already assigned with a department, is resolved, or
     *         no longer exists
     */
    public Optional<Issue> escalate(String issueId, String fallbackDepartment) {
        Instant now = clock.instant();
        AtomicBoolean changed = new AtomicBoolean(false);

        Optional<Issue> result = issueRepo.update(issueId, current -> {
            if (current.isResolved()) {
                return current;
            }
            Issue next = current.escalate(fallbackDepartment, now);
            changed.set(next.status() != current.status()
                || !Objects.equals(next.department(), current.department()));
            return next;
        });

        if (result.isEmpty() || !changed.get()) {
            return Optional.empty();
        }
        metrics.recordEscalation();
        log.info("[ESCALATION] Issue {} assigned to {}", issueId, result.get().department());
        return result;
    }
}
