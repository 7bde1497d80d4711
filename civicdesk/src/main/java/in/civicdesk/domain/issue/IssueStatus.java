package in.civicdesk.domain.issue;

import in.civicdesk.domain.common.ValidationException;

/**
 * Issue lifecycle status.
 */
public enum IssueStatus {
    REPORTED("Reported"),   // Accepted at intake, awaiting review
    VERIFIED("Verified"),   // Confirmed by an operator
    ASSIGNED("Assigned"),   // Handed to a department (manually or by escalation)
    RESOLVED("Resolved"),   // Closed, never escalated again
    SPAM("Spam");           // Evidence rejected at intake or flagged by an operator

    private final String wireName;

    IssueStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static IssueStatus fromWire(String value) {
        for (IssueStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown status: " + value);
    }
}
