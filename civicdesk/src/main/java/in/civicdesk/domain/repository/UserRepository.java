package in.civicdesk.domain.repository;

import in.civicdesk.domain.user.User;

import java.util.List;
import java.util.Optional;

/**
 * Store of registered users.
 */
public interface UserRepository {
    /**
     * Insert a user, enforcing uniqueness of email and national ID.
     *
     * @throws in.civicdesk.domain.common.ValidationException if either identifier is taken
     */
    void insert(User user);

    /**
     * Find user by ID.
     */
    Optional<User> findById(String userId);

    /**
     * Find every user whose email or national ID equals the identifier.
     * At most two users can match (one per identifier type).
     */
    List<User> findByIdentifier(String identifier);

    /**
     * Find user by exact email.
     */
    Optional<User> findByEmail(String email);
}
