package in.civicdesk.domain.issue;

/**
 * Intake payload for a new issue. Only description and priority are required;
 * everything else may be null.
 */
public record NewIssue(
    String description,
    Priority priority,
    String category,
    Boolean emergency,
    GeoLocation location,
    Media media,
    Media voice,
    String department
) {
}
