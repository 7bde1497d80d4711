package in.civicdesk.service.media;

/**
 * Verdict of the media authenticity gate. reason is null when accepted.
 */
public record MediaAssessment(boolean accepted, String reason) {

    public static MediaAssessment accept() {
        return new MediaAssessment(true, null);
    }

    public static MediaAssessment reject(String reason) {
        return new MediaAssessment(false, reason);
    }
}
