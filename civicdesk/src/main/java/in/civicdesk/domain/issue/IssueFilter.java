package in.civicdesk.domain.issue;

import java.time.Instant;

/**
 * Conjunctive query over issues. Null fields match everything;
 * the time bounds are inclusive and apply to createdAt.
 */
public record IssueFilter(
    String category,
    IssueStatus status,
    Priority priority,
    Instant from,
    Instant to
) {
    private static final IssueFilter ALL = new IssueFilter(null, null, null, null, null);

    public static IssueFilter all() {
        return ALL;
    }

    public boolean matches(Issue issue) {
        if (category != null && !category.equals(issue.category())) return false;
        if (status != null && status != issue.status()) return false;
        if (priority != null && priority != issue.priority()) return false;
        if (from != null && issue.createdAt().isBefore(from)) return false;
        if (to != null && issue.createdAt().isAfter(to)) return false;
        return true;
    }
}
