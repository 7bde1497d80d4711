package in.civicdesk.domain.issue;

import java.time.Instant;

/**
 * Reported civic issue.
 *
 * Records are immutable; every mutation produces a new instance through one of
 * {@link #apply} or {@link #escalate}, which also move updatedAt forward.
 * updatedAt never goes backwards, even if the supplied clock does.
 */
public record Issue(
    String id,
    String userId,
    String category,
    String description,
    Priority priority,
    boolean emergency,
    IssueStatus status,
    String department,     // nullable
    GeoLocation location,  // nullable
    Media media,           // nullable
    Media voice,           // nullable
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isResolved() {
        return status == IssueStatus.RESOLVED;
    }

    public boolean hasDepartment() {
        return department != null && !department.isBlank();
    }

    /**
     * Apply an operator update. Unsupplied fields keep their value;
     * updatedAt is refreshed regardless.
     */
    public Issue apply(IssueUpdate update, Instant at) {
        IssueStatus newStatus = update.status() != null ? update.status() : status;
        Priority newPriority = update.priority() != null ? update.priority() : priority;
        String newDepartment = department;
        if (update.department() != null) {
            newDepartment = update.department().isBlank() ? null : update.department();
        }
        return new Issue(id, userId, category, description, newPriority, emergency, newStatus,
            newDepartment, location, media, voice, createdAt, touch(at));
    }

    /**
     * Force the issue to ASSIGNED, keeping an existing department and
     * falling back to the given one otherwise.
     */
    public Issue escalate(String fallbackDepartment, Instant at) {
        String newDepartment = hasDepartment() ? department : fallbackDepartment;
        return new Issue(id, userId, category, description, priority, emergency, IssueStatus.ASSIGNED,
            newDepartment, location, media, voice, createdAt, touch(at));
    }

    private Instant touch(Instant at) {
        return at.isAfter(updatedAt) ? at : updatedAt;
    }
}
