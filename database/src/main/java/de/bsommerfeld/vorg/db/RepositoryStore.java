package de.bsommerfeld.vorg.db;

import de.bsommerfeld.vorg.core.domain.Collection;

import java.util.List;

/**
 * Query contract of a vorg repository database. An instance only exists for a
 * database that has passed structural validation, so callers never see a
 * store of the wrong shape.
 *
 * <p>
 * Implementations hold at most one logical connection and serialize access
 * to it; they are safe to share between threads.
 *
 * @see SqlRepositoryStore#connect(java.nio.file.Path)
 */
public interface RepositoryStore extends AutoCloseable {

    /**
     * Returns every collection with its items, read from one consistent
     * snapshot. Collections are ordered by id, items by insertion.
     *
     * @throws StoreIOException if the database fails during the read; no
     *                          transaction is left open
     */
    List<Collection> getCollections() throws StoreIOException;

    /**
     * Creates a collection titled {@code title} holding a single item, in one
     * transaction.
     *
     * @return id of the new collection
     * @throws DuplicateItemException if an item with {@code hash} exists; the
     *                                store is left unchanged
     * @throws StoreIOException       if the database fails during the write
     */
    long importItem(String title, String hash, String ext) throws DuplicateItemException, StoreIOException;

    @Override
    void close() throws StoreIOException;
}
