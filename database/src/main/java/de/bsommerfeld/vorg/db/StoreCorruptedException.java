package de.bsommerfeld.vorg.db;

/**
 * Thrown when an existing repository database does not have exactly the
 * expected structure, or is not a database at all. This is not retryable:
 * the file needs human attention before vorg can use it.
 */
public class StoreCorruptedException extends RepositoryException {

    public StoreCorruptedException(String message) {
        super(message);
    }

    public StoreCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
