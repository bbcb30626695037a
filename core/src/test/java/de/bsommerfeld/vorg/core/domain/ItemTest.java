package de.bsommerfeld.vorg.core.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ItemTest {

    private static final String HASH_A = "a0d2139fbc5efd9174211f5ade3a2e44fec969c799f10c16fde95ee178b4f44e";
    private static final String HASH_B = "bb4208052b8abf47524be1336a002f962f518d10755c832d7a18050131e70749";
    private static final String HASH_C = "a047f9c6577a35c2ce250bffb97fc5879c4306be6c3dd2833b0c19728671ef48";

    @Test
    void storePath_shouldShardByFirstTwoHashCharacters() {
        Path path = new Item(HASH_A, "mp4").storePath();

        assertEquals(2, path.getNameCount());
        assertEquals("a0", path.getName(0).toString());
        assertEquals(HASH_A.substring(2) + ".mp4", path.getName(1).toString());
    }

    @Test
    void storePath_shouldBeStableForSameHashAndExtension() {
        assertEquals(new Item(HASH_A, "mp4").storePath(), new Item(HASH_A, "mp4").storePath());
    }

    @Test
    void storePath_shouldDifferForDifferentHashes() {
        Set<Path> paths = new HashSet<>();
        paths.add(new Item(HASH_A, "mp4").storePath());
        paths.add(new Item(HASH_B, "mp4").storePath());
        // Same shard directory, different file name
        paths.add(new Item(HASH_C, "mp4").storePath());

        assertEquals(3, paths.size());
    }

    @Test
    void storePath_shouldBeRelative() {
        assertFalse(new Item(HASH_B, "avi").storePath().isAbsolute());
    }

    @Test
    void constructor_shouldRejectHashTooShortToShard() {
        assertThrows(IllegalArgumentException.class, () -> new Item("ab", "mp4"));
    }

    @Test
    void constructor_shouldRejectNulls() {
        assertThrows(NullPointerException.class, () -> new Item(null, "mp4"));
        assertThrows(NullPointerException.class, () -> new Item(HASH_A, null));
    }

    @Test
    void equals_shouldCompareHashAndExtension() {
        assertEquals(new Item(HASH_A, "mp4"), new Item(HASH_A, "mp4"));
        assertNotEquals(new Item(HASH_A, "mp4"), new Item(HASH_A, "avi"));
    }
}
