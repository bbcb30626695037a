package de.bsommerfeld.vorg.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * Titled group of items, materialized for the duration of a single query.
 * The item list is copied on construction so a collection never changes
 * after it leaves the store.
 *
 * @param id    store-assigned identity, immutable once created
 * @param title display title, mirrored into the full-text index
 * @param items items owned exclusively by this collection
 */
public record Collection(long id, String title, List<Item> items) {

    public Collection {
        Objects.requireNonNull(title, "title");
        items = List.copyOf(items);
    }
}
