/**
 * Repository database: creation, structural validation, and queries.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [route handlers]
 *        │
 *        ▼
 *   RepositoryStore        ← query contract, the only type callers see
 *        │
 *        ▼
 *   SqlRepositoryStore     ← one SQLite connection, serialized by a lock
 *    ┌───┴──────────┐
 *    │              │
 *  SqlLoader   SchemaValidator ── SchemaManifest
 *                   │
 *              ListComparison
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │ collections                                                  │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ collection_id PK │ INTEGER                                   │
 * │ title            │ TEXT, mirrored into title_fts             │
 * └──────────────────┴───────────────────────────────────────────┘
 *
 * ┌──────────────────────────────────────────────────────────────┐
 * │ items                                                        │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ collection_id FK │ INTEGER → collections                     │
 * │ item_id PK       │ INTEGER                                   │
 * │ hash             │ VARCHAR(64), unique (hash_index)          │
 * │ ext              │ TEXT                                      │
 * └──────────────────┴───────────────────────────────────────────┘
 *
 * ┌──────────────────────────────────────────────────────────────┐
 * │ tags                     │ collection_tag                    │
 * ├──────────────────────────┼───────────────────────────────────┤
 * │ tag_id PK   INTEGER      │ collection_id FK  INTEGER         │
 * │ name        TEXT, unique │ tag_id FK         INTEGER         │
 * │             (tag_index)  │ PK (collection_id, tag_id)        │
 * └──────────────────────────┴───────────────────────────────────┘
 * </pre>
 *
 * {@code title_fts} is an external-content FTS5 index over
 * {@code collections.title} keyed by {@code collection_id}. The triggers
 * {@code title_insert}, {@code title_update} and {@code title_delete} keep it
 * in sync: insert adds the new row, delete issues the FTS5 {@code 'delete'}
 * command for the old row, update does both.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code schema.sql}: full DDL, applied once on creation</li>
 * <li>{@code select-collections.sql}, {@code select-items-for-collection.sql}:
 * collection snapshot</li>
 * <li>{@code insert-collection.sql}, {@code insert-item.sql},
 * {@code count-items-by-hash.sql}, {@code select-last-insert-id.sql}:
 * item import</li>
 * <li>{@code select-table-names.sql}, {@code select-table-columns.sql},
 * {@code count-fts-tables.sql}, {@code select-index-names.sql},
 * {@code select-trigger-names.sql}: structural validation</li>
 * </ul>
 */
package de.bsommerfeld.vorg.db;
