package de.bsommerfeld.vorg.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionTest {

    private static final Item ITEM = new Item("47f9c6577a35c2ce250bffb97fc5879c4306be6c3dd2833b0c19728671ef4814", "wmv");

    @Test
    void constructor_shouldCopyItems() {
        List<Item> items = new ArrayList<>(List.of(ITEM));
        Collection collection = new Collection(1, "def", items);

        items.clear();
        assertEquals(1, collection.items().size());
    }

    @Test
    void items_shouldBeUnmodifiable() {
        Collection collection = new Collection(1, "def", List.of(ITEM));
        assertThrows(UnsupportedOperationException.class, () -> collection.items().add(ITEM));
    }

    @Test
    void equals_shouldCompareIdTitleAndItems() {
        assertEquals(new Collection(2, "def", List.of(ITEM)), new Collection(2, "def", List.of(ITEM)));
        assertNotEquals(new Collection(2, "def", List.of(ITEM)), new Collection(3, "def", List.of(ITEM)));
        assertNotEquals(new Collection(2, "def", List.of(ITEM)), new Collection(2, "def", List.of()));
    }
}
