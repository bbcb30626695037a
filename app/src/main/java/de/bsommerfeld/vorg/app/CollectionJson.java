package de.bsommerfeld.vorg.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.vorg.core.domain.Collection;
import de.bsommerfeld.vorg.core.domain.Item;

import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * Wire form of collections: {@code {"title": ..., "items": [{"path": ...}]}},
 * where each path is the item's location in the object store, always
 * {@code /}-separated regardless of the platform.
 */
final class CollectionJson {

    private CollectionJson() {
    }

    static ObjectNode toJson(ObjectMapper mapper, Collection collection) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", collection.title());
        ArrayNode items = node.putArray("items");
        for (Item item : collection.items()) {
            items.add(toJson(mapper, item));
        }
        return node;
    }

    static ObjectNode toJson(ObjectMapper mapper, Item item) {
        return mapper.createObjectNode().put("path", wirePath(item));
    }

    static String wirePath(Item item) {
        StringJoiner joined = new StringJoiner("/");
        for (Path segment : item.storePath()) {
            joined.add(segment.toString());
        }
        return joined.toString();
    }
}
