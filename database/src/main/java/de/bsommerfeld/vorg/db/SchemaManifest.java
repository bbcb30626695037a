package de.bsommerfeld.vorg.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;

/**
 * The exact structure a repository database must have. Every list is sorted
 * the way SQLite's binary collation sorts names, which is the order the
 * validator reads them back in.
 */
final class SchemaManifest {

    /** Declared column as reported by {@code pragma_table_info}. */
    record Column(String name, String type) {
    }

    /** Base tables, excluding the full-text index and its shadow tables. */
    static final List<String> TABLES = ImmutableList.of(
            "collection_tag",
            "collections",
            "items",
            "tags");

    /** Columns per table, sorted by column name. Types are compared verbatim. */
    static final ImmutableMap<String, List<Column>> COLUMNS = ImmutableMap.of(
            "collection_tag", ImmutableList.of(
                    new Column("collection_id", "INTEGER"),
                    new Column("tag_id", "INTEGER")),
            "collections", ImmutableList.of(
                    new Column("collection_id", "INTEGER"),
                    new Column("title", "TEXT")),
            "items", ImmutableList.of(
                    new Column("collection_id", "INTEGER"),
                    new Column("ext", "TEXT"),
                    new Column("hash", "VARCHAR(64)"),
                    new Column("item_id", "INTEGER")),
            "tags", ImmutableList.of(
                    new Column("name", "TEXT"),
                    new Column("tag_id", "INTEGER")));

    /**
     * {@code title_fts} plus the four shadow tables FTS5 creates for an
     * external-content index: {@code _config}, {@code _data}, {@code _docsize},
     * {@code _idx}.
     */
    static final int FTS_TABLE_COUNT = 5;

    static final List<String> INDEXES = ImmutableList.of(
            "hash_index",
            "tag_index");

    static final List<String> TRIGGERS = ImmutableList.of(
            "title_delete",
            "title_insert",
            "title_update");

    private SchemaManifest() {
    }
}
