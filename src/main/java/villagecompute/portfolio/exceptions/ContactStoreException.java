package villagecompute.portfolio.exceptions;

/**
 * Thrown when an accepted contact message could not be persisted. The submission attempt is still logged before this
 * is raised.
 */
public class ContactStoreException extends RuntimeException {

    public ContactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
