package de.bsommerfeld.vorg.db;

import de.bsommerfeld.vorg.core.domain.Collection;
import de.bsommerfeld.vorg.core.domain.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteOpenMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link RepositoryStore}.
 *
 * <p>
 * All SQL lives in classpath resources loaded through {@link SqlLoader}: the
 * DDL in {@code schema.sql}, every query in {@code sql/*.sql}.
 *
 * <h3>Lifecycle</h3>
 * {@link #connect(Path)} creates the database and applies the schema when the
 * file does not exist, otherwise opens it read-write without the create flag
 * and runs {@link SchemaValidator}. A freshly created database is validated
 * too, so the schema script and the manifest cannot drift apart unnoticed.
 *
 * <h3>Connection strategy</h3>
 * One {@link Connection} is held for the lifetime of the store. Every
 * operation takes {@link #lock} for its full duration, so concurrent callers
 * are serialized and a transaction is never shared between threads.
 *
 * <h3>Transaction boundaries</h3>
 * Reads that span several queries run in one transaction for a consistent
 * snapshot and commit on success. Any failure rolls back before the
 * exception leaves the store.
 */
public final class SqlRepositoryStore implements RepositoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlRepositoryStore.class);

    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final Path databasePath;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();

    private SqlRepositoryStore(Path databasePath, Connection connection) {
        this.databasePath = databasePath;
        this.connection = connection;
    }

    /**
     * Opens the repository database at {@code databasePath}, creating it first
     * if it does not exist.
     *
     * @throws StoreCorruptedException if an existing file is not a database
     *                                 or does not match the expected schema
     * @throws StoreIOException        if the file cannot be created or opened
     */
    public static SqlRepositoryStore connect(Path databasePath) throws StoreCorruptedException, StoreIOException {
        if (Files.exists(databasePath)) {
            return open(databasePath);
        }
        return create(databasePath);
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    private static SqlRepositoryStore open(Path databasePath) throws StoreCorruptedException, StoreIOException {
        LOG.info("Opening repository database at {}", databasePath.toAbsolutePath());
        Connection conn = null;
        try {
            conn = openConnection(databasePath, false);
            new SchemaValidator().validate(conn);
            return new SqlRepositoryStore(databasePath, conn);
        } catch (StoreCorruptedException e) {
            closeAfterFailure(conn, e);
            LOG.error("Repository database at {} is corrupted: {}", databasePath.toAbsolutePath(), e.getMessage());
            throw e;
        } catch (SQLException e) {
            closeAfterFailure(conn, e);
            if (isNotADatabase(e)) {
                LOG.error("File at {} is not a repository database", databasePath.toAbsolutePath());
                throw new StoreCorruptedException("The file at " + databasePath + " is not a vorg database.", e);
            }
            throw new StoreIOException("Failed to open repository database at " + databasePath, e);
        }
    }

    private static SqlRepositoryStore create(Path databasePath) throws StoreCorruptedException, StoreIOException {
        LOG.info("Creating repository database at {}", databasePath.toAbsolutePath());
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreIOException("Failed to create repository directory for " + databasePath, e);
        }

        Connection conn = null;
        try {
            conn = openConnection(databasePath, true);
            applySchema(conn);
            new SchemaValidator().validate(conn);
            LOG.info("Repository schema applied.");
            return new SqlRepositoryStore(databasePath, conn);
        } catch (SQLException e) {
            closeAfterFailure(conn, e);
            deleteAfterFailure(databasePath, e);
            throw new StoreIOException("Failed to create repository database at " + databasePath, e);
        } catch (StoreCorruptedException e) {
            closeAfterFailure(conn, e);
            deleteAfterFailure(databasePath, e);
            throw e;
        }
    }

    private static Connection openConnection(Path databasePath, boolean create) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        if (!create) {
            config.resetOpenMode(SQLiteOpenMode.CREATE);
        }
        String url = "jdbc:sqlite:" + databasePath.toAbsolutePath();
        return DriverManager.getConnection(url, config.toProperties());
    }

    /**
     * Runs every statement of {@code schema.sql} in one transaction, so a
     * failed bootstrap leaves no partial schema behind.
     */
    private static void applySchema(Connection conn) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadScript(SCHEMA_RESOURCE)) {
                stmt.execute(sql);
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackAfterFailure(conn, e);
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public List<Collection> getCollections() throws StoreIOException {
        try {
            return inTransaction(this::readCollections);
        } catch (StoreIOException e) {
            throw e;
        } catch (RepositoryException e) {
            throw new IllegalStateException("Unexpected failure while reading collections", e);
        }
    }

    private List<Collection> readCollections(Connection conn) throws SQLException {
        List<Collection> collections = new ArrayList<>();
        try (PreparedStatement collectionsStmt = conn.prepareStatement(SqlLoader.load("select-collections"));
                PreparedStatement itemsStmt = conn.prepareStatement(SqlLoader.load("select-items-for-collection"));
                ResultSet rs = collectionsStmt.executeQuery()) {
            while (rs.next()) {
                long collectionId = rs.getLong("collection_id");
                String title = rs.getString("title");
                collections.add(new Collection(collectionId, title, readItems(itemsStmt, collectionId)));
            }
        }
        LOG.debug("Loaded {} collections from {}", collections.size(), databasePath);
        return collections;
    }

    private List<Item> readItems(PreparedStatement itemsStmt, long collectionId) throws SQLException {
        List<Item> items = new ArrayList<>();
        itemsStmt.setLong(1, collectionId);
        try (ResultSet rs = itemsStmt.executeQuery()) {
            while (rs.next()) {
                items.add(new Item(rs.getString("hash"), rs.getString("ext")));
            }
        }
        return items;
    }

    @Override
    public long importItem(String title, String hash, String ext) throws DuplicateItemException, StoreIOException {
        // Validates the hash before touching the database
        Item item = new Item(hash, ext);
        try {
            long collectionId = inTransaction(conn -> insertCollectionWithItem(conn, title, item));
            LOG.debug("Imported item {} into collection {}", hash, collectionId);
            return collectionId;
        } catch (DuplicateItemException | StoreIOException e) {
            throw e;
        } catch (RepositoryException e) {
            throw new IllegalStateException("Unexpected failure while importing " + hash, e);
        }
    }

    private long insertCollectionWithItem(Connection conn, String title, Item item)
            throws SQLException, DuplicateItemException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-items-by-hash"))) {
            ps.setString(1, item.hash());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getInt(1) > 0)
                    throw new DuplicateItemException(item.hash());
            }
        }

        long collectionId;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-collection"))) {
            ps.setString(1, title);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-insert-id"));
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            collectionId = rs.getLong(1);
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-item"))) {
            ps.setLong(1, collectionId);
            ps.setString(2, item.hash());
            ps.setString(3, item.ext());
            ps.executeUpdate();
        }
        return collectionId;
    }

    @Override
    public void close() throws StoreIOException {
        lock.lock();
        try {
            if (!connection.isClosed()) {
                connection.close();
                LOG.info("Closed repository database at {}", databasePath.toAbsolutePath());
            }
        } catch (SQLException e) {
            throw new StoreIOException("Failed to close repository database at " + databasePath, e);
        } finally {
            lock.unlock();
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @FunctionalInterface
    private interface TransactionWork<T> {
        T execute(Connection conn) throws SQLException, RepositoryException;
    }

    /**
     * Runs {@code work} in one transaction under {@link #lock}. Commits on
     * success; on any failure rolls back and restores auto-commit before
     * rethrowing. {@link SQLException}s surface as {@link StoreIOException}.
     */
    private <T> T inTransaction(TransactionWork<T> work) throws RepositoryException {
        lock.lock();
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException | RepositoryException | RuntimeException e) {
                rollbackAfterFailure(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreIOException("Repository transaction failed on " + databasePath, e);
        } finally {
            lock.unlock();
        }
    }

    // =====================================================================
    // Failure helpers
    // =====================================================================

    private static boolean isNotADatabase(SQLException e) {
        int code = e.getErrorCode();
        return code == SQLiteErrorCode.SQLITE_NOTADB.code || code == SQLiteErrorCode.SQLITE_CORRUPT.code;
    }

    private static void rollbackAfterFailure(Connection conn, Exception failure) {
        try {
            if (!conn.getAutoCommit())
                conn.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static void closeAfterFailure(Connection conn, Exception failure) {
        if (conn == null)
            return;
        try {
            conn.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static void deleteAfterFailure(Path databasePath, Exception failure) {
        try {
            Files.deleteIfExists(databasePath);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
