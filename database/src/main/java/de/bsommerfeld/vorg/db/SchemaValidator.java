package de.bsommerfeld.vorg.db;

import de.bsommerfeld.vorg.db.ListComparison.Result;
import de.bsommerfeld.vorg.db.SchemaManifest.Column;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that a repository database has exactly the structure described by
 * {@link SchemaManifest}. Anything extra or missing counts as corruption.
 *
 * <p>
 * Phases run in a fixed order and each stops at its first mismatch:
 * <ol>
 * <li>base table names</li>
 * <li>column names and declared types of every base table</li>
 * <li>number of full-text tables ({@code title_fts*})</li>
 * <li>index names, excluding SQLite's automatic indexes</li>
 * <li>trigger names</li>
 * </ol>
 * Table shape is confirmed before indexes and triggers because their
 * definitions refer to table columns.
 */
final class SchemaValidator {

    /**
     * @throws StoreCorruptedException describing the first mismatch found
     * @throws SQLException            if the catalog cannot be read
     */
    void validate(Connection connection) throws StoreCorruptedException, SQLException {
        validateTableNames(connection);
        for (String table : SchemaManifest.TABLES) {
            validateColumns(connection, table);
        }
        validateFtsTables(connection);
        validateNames(connection, "select-index-names", SchemaManifest.INDEXES, "Index");
        validateNames(connection, "select-trigger-names", SchemaManifest.TRIGGERS, "Trigger");
    }

    private void validateTableNames(Connection connection) throws StoreCorruptedException, SQLException {
        List<String> tables = queryNames(connection, "select-table-names");
        Result<String> result = ListComparison.compare(tables, SchemaManifest.TABLES);
        switch (result.outcome()) {
            case MISSING -> throw new StoreCorruptedException(
                    "Table \"" + result.element() + "\" is missing from the database.");
            case UNEXPECTED -> throw new StoreCorruptedException(
                    "Unexpected table \"" + result.element() + "\" exists in the database.");
            default -> {
            }
        }
    }

    private void validateColumns(Connection connection, String table) throws StoreCorruptedException, SQLException {
        List<Column> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("select-table-columns"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    columns.add(new Column(rs.getString("name"), rs.getString("type")));
            }
        }

        Result<Column> result = ListComparison.compare(
                columns,
                SchemaManifest.COLUMNS.get(table),
                Column::name,
                (actual, expected) -> actual.type().equals(expected.type()));

        Column column = result.element();
        switch (result.outcome()) {
            case MISSING -> throw new StoreCorruptedException(
                    "Column \"" + column.name() + "\" is missing from table \"" + table + "\".");
            case UNEXPECTED -> throw new StoreCorruptedException(
                    "Unexpected column \"" + column.name() + "\" in table \"" + table + "\".");
            case UNEQUAL -> throw new StoreCorruptedException(
                    "Column \"" + column.name() + "\" in table \"" + table + "\" should have type \""
                            + column.type() + "\".");
            default -> {
            }
        }
    }

    private void validateFtsTables(Connection connection) throws StoreCorruptedException, SQLException {
        int count;
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("count-fts-tables"));
                ResultSet rs = ps.executeQuery()) {
            // COUNT always yields exactly one row
            rs.next();
            count = rs.getInt("fts_count");
        }
        if (count != SchemaManifest.FTS_TABLE_COUNT) {
            throw new StoreCorruptedException("Expected " + SchemaManifest.FTS_TABLE_COUNT
                    + " full-text tables but found " + count + ".");
        }
    }

    private void validateNames(Connection connection, String query, List<String> expected, String kind)
            throws StoreCorruptedException, SQLException {
        Result<String> result = ListComparison.compare(queryNames(connection, query), expected);
        switch (result.outcome()) {
            case MISSING -> throw new StoreCorruptedException(
                    kind + " \"" + result.element() + "\" is missing from the database.");
            case UNEXPECTED -> throw new StoreCorruptedException(
                    "Unexpected " + kind.toLowerCase() + " \"" + result.element() + "\" exists in the database.");
            default -> {
            }
        }
    }

    private List<String> queryNames(Connection connection, String query) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load(query));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                names.add(rs.getString(1));
        }
        return names;
    }
}
