package in.civicdesk.service.media;

import in.civicdesk.domain.issue.Media;
import in.civicdesk.domain.issue.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;

/**
 * Size-based placeholder for an anti-fraud classifier.
 *
 * Photos whose decoded payload is smaller than the configured minimum are
 * rejected; any other declared type (video, audio, unknown or missing) only
 * needs to decode. The payload is the text after the first comma of a data
 * URL, or the whole string otherwise.
 */
public final class SizeHeuristicMediaGate implements MediaAuthenticityGate {
    private static final Logger log = LoggerFactory.getLogger(SizeHeuristicMediaGate.class);

    public static final int DEFAULT_MIN_PHOTO_BYTES = 10_000;

    private final int minPhotoBytes;

    public SizeHeuristicMediaGate() {
        this(DEFAULT_MIN_PHOTO_BYTES);
    }

    public SizeHeuristicMediaGate(int minPhotoBytes) {
        if (minPhotoBytes < 0) {
            throw new IllegalArgumentException("minPhotoBytes must be >= 0");
        }
        this.minPhotoBytes = minPhotoBytes;
    }

    @Override
    public MediaAssessment assess(Media media) {
        if (media == null) {
            return MediaAssessment.reject(REASON_NO_MEDIA);
        }

        int sizeBytes;
        try {
            sizeBytes = decodedSize(media.data());
        } catch (IllegalArgumentException e) {
            log.debug("Media payload rejected: {}", e.getMessage());
            return MediaAssessment.reject(REASON_INVALID_DATA);
        }

        if (media.kind() == MediaKind.PHOTO && sizeBytes < minPhotoBytes) {
            return MediaAssessment.reject(REASON_IMAGE_TOO_SMALL);
        }
        return MediaAssessment.accept();
    }

    private static int decodedSize(String data) {
        if (data == null) {
            throw new IllegalArgumentException("missing payload");
        }
        int comma = data.indexOf(',');
        String payload = comma >= 0 ? data.substring(comma + 1) : data;
        return Base64.getDecoder().decode(payload.trim()).length;
    }
}
