package in.civicdesk.domain.common;

/**
 * Thrown for bad credentials or an unusable bearer token. Surfaced as HTTP 401.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
