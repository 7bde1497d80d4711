package in.civicdesk.domain.user;

import in.civicdesk.domain.common.ValidationException;

/**
 * Account role. Wire form is the display name ("User", "Admin").
 */
public enum UserRole {
    USER("User"),
    ADMIN("Admin");

    private final String wireName;

    UserRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static UserRole fromWire(String value) {
        for (UserRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new ValidationException("Unknown role: " + value);
    }
}
