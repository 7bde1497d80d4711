package in.civicdesk.domain.user;

import java.time.Instant;

/**
 * Registered account. Immutable once created.
 * At least one of email / nationalId is set.
 */
public record User(
    String userId,
    String email,
    String nationalId,
    String passwordHash,
    UserRole role,
    String language,
    Instant createdAt
) {
    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
