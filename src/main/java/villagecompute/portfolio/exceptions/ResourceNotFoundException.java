package villagecompute.portfolio.exceptions;

/**
 * Thrown when an admin request names a contact message that does not exist.
 *
 * <p>
 * Mapped to HTTP 404 Not Found by the admin resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
