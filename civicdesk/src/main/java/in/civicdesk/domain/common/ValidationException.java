package in.civicdesk.domain.common;

/**
 * Thrown when a request is missing a required field or carries a value
 * outside the allowed set. Surfaced as HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
