package in.civicdesk.domain.issue;

import in.civicdesk.domain.common.ValidationException;

/**
 * Issue priority.
 */
public enum Priority {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Priority fromWire(String value) {
        for (Priority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new ValidationException("Unknown priority: " + value);
    }
}
