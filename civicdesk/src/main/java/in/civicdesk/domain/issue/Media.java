package in.civicdesk.domain.issue;

/**
 * Attachment as submitted by the client: declared type plus a Base64 payload,
 * usually in data-URL form ({@code data:image/jpeg;base64,...}).
 *
 * The declared type is kept as sent; it may be missing or unrecognised.
 */
public record Media(String type, String data) {

    public Media(MediaKind kind, String data) {
        this(kind.wireName(), data);
    }

    /**
     * @return the declared kind, or null if the type is missing or unknown
     */
    public MediaKind kind() {
        return MediaKind.fromWire(type);
    }
}
