package in.civicdesk.service.media;

import in.civicdesk.domain.issue.Media;

/**
 * Decides whether submitted media counts as credible evidence for an issue.
 *
 * Implementations must be side-effect free and must not throw: any problem
 * with the media itself is reported as a rejection.
 */
public interface MediaAuthenticityGate {

    String REASON_NO_MEDIA = "no media";
    String REASON_IMAGE_TOO_SMALL = "image too small";
    String REASON_INVALID_DATA = "invalid media data";

    /**
     * @param media submitted attachment, may be null
     */
    MediaAssessment assess(Media media);
}
