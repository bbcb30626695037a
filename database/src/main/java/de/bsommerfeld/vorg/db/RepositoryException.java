package de.bsommerfeld.vorg.db;

/**
 * Base of all failures raised by a {@link RepositoryStore}.
 */
public class RepositoryException extends Exception {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
