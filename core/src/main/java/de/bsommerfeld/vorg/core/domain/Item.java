package de.bsommerfeld.vorg.core.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Content-addressed file reference. The hash is unique across the whole
 * repository; the extension only records the original file type.
 *
 * <p>
 * The on-disk object location is derived from the pair alone: the first two
 * hash characters name a shard directory, the remainder plus extension name
 * the file. Sharding keeps any single directory of the object store small.
 *
 * @param hash hex content hash (SHA-256 in practice, at least 3 characters)
 * @param ext  original file extension without the leading dot
 */
public record Item(String hash, String ext) {

    private static final int SHARD_LENGTH = 2;

    public Item {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(ext, "ext");
        if (hash.length() <= SHARD_LENGTH) {
            throw new IllegalArgumentException("Hash too short to shard: '" + hash + "'");
        }
    }

    /**
     * Returns the object path relative to the store root, e.g.
     * {@code a0/d2139f...4e.mp4}.
     */
    public Path storePath() {
        return Path.of(hash.substring(0, SHARD_LENGTH), hash.substring(SHARD_LENGTH) + "." + ext);
    }
}
