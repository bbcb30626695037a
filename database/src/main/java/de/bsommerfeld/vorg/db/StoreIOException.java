package de.bsommerfeld.vorg.db;

/**
 * Thrown when the underlying database fails while opening, creating, or
 * querying a repository.
 */
public class StoreIOException extends RepositoryException {

    public StoreIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
