package de.bsommerfeld.vorg.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mutates a freshly bootstrapped database in one specific way and checks
 * that reopening it is refused. Every mutation is applied through a plain
 * JDBC connection, bypassing the store.
 */
class SchemaValidatorTest {

    @TempDir
    Path tempDir;

    private Path dbPath;

    @BeforeEach
    void setUp() throws Exception {
        dbPath = tempDir.resolve("vorg.db");
        SqlRepositoryStore.connect(dbPath).close();
    }

    static Stream<Arguments> mutations() {
        return Stream.of(
                Arguments.of("drop base table", List.of(
                        "DROP TABLE collection_tag"),
                        "Table \"collection_tag\" is missing"),
                Arguments.of("add unrelated table", List.of(
                        "CREATE TABLE notes (note_id INTEGER PRIMARY KEY, body TEXT)"),
                        "Unexpected table \"notes\""),
                Arguments.of("drop column", List.of(
                        "DROP INDEX tag_index",
                        "ALTER TABLE tags DROP COLUMN name"),
                        "Column \"name\" is missing from table \"tags\""),
                Arguments.of("add column", List.of(
                        "ALTER TABLE collections ADD COLUMN rating INTEGER"),
                        "Unexpected column \"rating\" in table \"collections\""),
                Arguments.of("change declared type", List.of(
                        "DROP INDEX hash_index",
                        "DROP TABLE items",
                        "CREATE TABLE items (collection_id INTEGER NOT NULL, item_id INTEGER PRIMARY KEY NOT NULL,"
                                + " hash VARCHAR(128) NOT NULL, ext TEXT NOT NULL)",
                        "CREATE UNIQUE INDEX hash_index ON items (hash)"),
                        "Column \"hash\" in table \"items\" should have type \"VARCHAR(64)\""),
                Arguments.of("drop full-text table", List.of(
                        "DROP TABLE title_fts"),
                        "full-text tables but found 0"),
                Arguments.of("add table with full-text prefix", List.of(
                        "CREATE TABLE title_fts_extra (x TEXT)"),
                        "full-text tables but found 6"),
                Arguments.of("drop index", List.of(
                        "DROP INDEX tag_index"),
                        "Index \"tag_index\" is missing"),
                Arguments.of("add index", List.of(
                        "CREATE INDEX title_index ON collections (title)"),
                        "Unexpected index \"title_index\""),
                Arguments.of("drop trigger", List.of(
                        "DROP TRIGGER title_update"),
                        "Trigger \"title_update\" is missing"),
                Arguments.of("add trigger", List.of(
                        "CREATE TRIGGER zz_audit AFTER INSERT ON items BEGIN SELECT 1; END"),
                        "Unexpected trigger \"zz_audit\""));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("mutations")
    void connect_shouldRejectMutatedSchema(String description, List<String> statements, String expectedMessage)
            throws Exception {
        apply(statements);

        StoreCorruptedException e = assertThrows(StoreCorruptedException.class,
                () -> SqlRepositoryStore.connect(dbPath));
        assertTrue(e.getMessage().contains(expectedMessage),
                () -> "Unexpected message for '" + description + "': " + e.getMessage());
    }

    @Test
    void connect_shouldAcceptUnmutatedSchema() throws Exception {
        SqlRepositoryStore.connect(dbPath).close();
    }

    @Test
    void connect_shouldAcceptStoreWithData() throws Exception {
        apply(List.of(
                "INSERT INTO collections(title) VALUES ('abc')",
                "INSERT INTO tags(name) VALUES ('meta:Incomplete')",
                "INSERT INTO collection_tag(collection_id, tag_id) VALUES (1, 1)"));

        SqlRepositoryStore.connect(dbPath).close();
    }

    @Test
    void connect_shouldRejectStoreOnFirstPhaseBeforeLaterOnes() throws Exception {
        // Both a table and a trigger are wrong; table names are checked first
        apply(List.of(
                "CREATE TABLE aaa (x INTEGER)",
                "DROP TRIGGER title_insert"));

        StoreCorruptedException e = assertThrows(StoreCorruptedException.class,
                () -> SqlRepositoryStore.connect(dbPath));
        assertTrue(e.getMessage().contains("\"aaa\""), e.getMessage());
    }

    @Test
    void validate_shouldPassOnBootstrappedConnection() throws Exception {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath())) {
            assertDoesNotThrow(() -> new SchemaValidator().validate(conn));
        }
    }

    private void apply(List<String> statements) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
                Statement stmt = conn.createStatement()) {
            for (String sql : statements)
                stmt.execute(sql);
        }
    }
}
