package in.civicdesk.domain.common;

/**
 * Thrown when an issue id does not match any stored issue. Surfaced as HTTP 404.
 */
public class IssueNotFoundException extends RuntimeException {

    private final String issueId;

    public IssueNotFoundException(String issueId) {
        super("Issue not found: " + issueId);
        this.issueId = issueId;
    }

    public String getIssueId() {
        return issueId;
    }
}
