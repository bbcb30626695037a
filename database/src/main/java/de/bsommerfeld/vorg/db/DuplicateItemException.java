package de.bsommerfeld.vorg.db;

/**
 * Thrown when importing an item whose content hash is already stored.
 */
public class DuplicateItemException extends RepositoryException {

    private final String hash;

    public DuplicateItemException(String hash) {
        super("The item to import already exists in the repository: " + hash);
        this.hash = hash;
    }

    public String getHash() {
        return hash;
    }
}
