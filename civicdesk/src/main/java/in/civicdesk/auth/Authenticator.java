package in.civicdesk.auth;

import in.civicdesk.domain.common.AuthenticationException;
import in.civicdesk.domain.user.User;

/**
 * Bearer token scheme. Issues a token for a user and maps a token back to the
 * user id it was issued for.
 */
public interface Authenticator {

    /**
     * Issue a token for the user.
     */
    String issueToken(User user);

    /**
     * Validate the token and return the user id it carries.
     * A leading "Bearer " prefix is accepted in any letter case.
     *
     * @throws AuthenticationException if the token is missing, malformed, forged or expired
     */
    String resolveUserId(String token);
}
