package in.civicdesk.auth;

import in.civicdesk.domain.common.AuthenticationException;
import in.civicdesk.domain.common.ValidationException;
import in.civicdesk.domain.repository.UserRepository;
import in.civicdesk.domain.user.User;
import in.civicdesk.domain.user.UserRole;
import in.civicdesk.metrics.IssueMetrics;
import in.civicdesk.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Signup, login and token resolution.
 *
 * Identifiers (email, national ID) are matched exactly, with no
 * normalization. Passwords are stored salted and hashed.
 */
public final class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final UserRepository userRepo;
    private final Authenticator authenticator;
    private final PasswordHasher hasher;
    private final IssueMetrics metrics;
    private final Clock clock;
    private final IdGenerator ids = new IdGenerator("U");

    public AuthService(UserRepository userRepo, Authenticator authenticator, PasswordHasher hasher,
                       IssueMetrics metrics, Clock clock) {
        this.userRepo = userRepo;
        this.authenticator = authenticator;
        this.hasher = hasher;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Register a new user and issue a token for it.
     *
     * @throws ValidationException if no identifier, password or role is given,
     *         the role is unknown, or an identifier is already registered
     */
    public AuthResult signup(SignupRequest request) {
        String email = blankToNull(request.email());
        String nationalId = blankToNull(request.nationalId());
        if ((email == null && nationalId == null) || isBlank(request.password()) || isBlank(request.role())) {
            throw new ValidationException("email or aadhaar, password and role are required");
        }
        UserRole role = UserRole.fromWire(request.role());

        Instant now = clock.instant();
        User user = new User(
            ids.next(now),
            email,
            nationalId,
            hasher.hash(request.password()),
            role,
            blankToNull(request.language()),
            now
        );
        userRepo.insert(user);

        log.info("[AUTH] User registered: {} ({})", user.userId(), role.wireName());
        return new AuthResult(authenticator.issueToken(user), user);
    }

    /**
     * Log in with email or national ID.
     *
     * @throws AuthenticationException on unknown identifier or wrong password
     */
    public AuthResult login(String identifier, String password) {
        if (isBlank(identifier) || password == null) {
            metrics.recordAuthFailure("login");
            throw new AuthenticationException(INVALID_CREDENTIALS);
        }

        for (User candidate : userRepo.findByIdentifier(identifier)) {
            if (hasher.verify(password, candidate.passwordHash())) {
                log.info("[AUTH] User logged in: {}", candidate.userId());
                return new AuthResult(authenticator.issueToken(candidate), candidate);
            }
        }

        metrics.recordAuthFailure("login");
        log.info("[AUTH] Login rejected");
        throw new AuthenticationException(INVALID_CREDENTIALS);
    }

    /**
     * Map a bearer token to the id of an existing user.
     *
     * @throws AuthenticationException if the token is unusable or names an unknown user
     */
    public String resolve(String token) {
        String userId;
        try {
            userId = authenticator.resolveUserId(token);
        } catch (AuthenticationException e) {
            metrics.recordAuthFailure("token");
            throw e;
        }
        if (userRepo.findById(userId).isEmpty()) {
            metrics.recordAuthFailure("token");
            throw new AuthenticationException("Unknown user");
        }
        return userId;
    }

    /**
     * Create the bootstrap administrator unless a user with that email exists.
     *
     * @return true if a new admin was created
     */
    public boolean ensureAdmin(String email, String password) {
        if (userRepo.findByEmail(email).isPresent()) {
            log.info("[AUTH] Admin user already exists");
            return false;
        }
        AuthResult result = signup(new SignupRequest(email, null, password, UserRole.ADMIN.wireName(), null));
        log.info("[AUTH] Admin user created: {}", result.user().userId());
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    // Request / result records

    public record SignupRequest(
        String email,
        String nationalId,
        String password,
        String role,
        String language
    ) {
    }

    public record AuthResult(String token, User user) {
    }
}
