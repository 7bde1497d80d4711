package in.civicdesk.domain.issue;

/**
 * Declared kind of an attachment. Wire form is lower case.
 */
public enum MediaKind {
    PHOTO("photo"),
    VIDEO("video"),
    AUDIO("audio");

    private final String wireName;

    MediaKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching kind, or null for a missing or unknown type
     */
    public static MediaKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (MediaKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return null;
    }
}
