package in.civicdesk.domain.issue;

/**
 * Partial update applied by operators.
 *
 * A null field is left unchanged. For department, an empty string clears the
 * current assignment.
 */
public record IssueUpdate(
    IssueStatus status,
    String department,
    Priority priority
) {
    public static IssueUpdate status(IssueStatus status) {
        return new IssueUpdate(status, null, null);
    }
}
