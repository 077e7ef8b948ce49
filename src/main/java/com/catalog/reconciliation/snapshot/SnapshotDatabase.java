package com.catalog.reconciliation.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

/**
 * Handle on the embedded SQLite file holding a provider snapshot.
 *
 * <p>Create one per file, call {@link #initialize()} once, and pass it to consumers.
 * Every {@link #open()} returns a new connection with foreign keys enforced.</p>
 */
public class SnapshotDatabase {
    private static final Logger log = LoggerFactory.getLogger(SnapshotDatabase.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS snapshot_items (
              id TEXT PRIMARY KEY,
              name TEXT,
              item_type TEXT,
              rarity TEXT,
              value REAL,
              weight REAL,
              icon TEXT,
              updated_at TEXT,
              cached_at TEXT NOT NULL,
              raw_json TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS snapshot_item_links (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              item_id TEXT NOT NULL,
              relation TEXT NOT NULL,
              related_item_id TEXT,
              related_name TEXT,
              quantity REAL,
              raw_fragment TEXT NOT NULL,
              FOREIGN KEY(item_id) REFERENCES snapshot_items(id) ON DELETE CASCADE
            )""",
            "CREATE INDEX IF NOT EXISTS idx_snapshot_item_links_item ON snapshot_item_links(item_id)",
            "CREATE INDEX IF NOT EXISTS idx_snapshot_item_links_relation ON snapshot_item_links(relation)",
            """
            CREATE TABLE IF NOT EXISTS snapshot_sync_state (
              id INTEGER PRIMARY KEY CHECK (id = 1),
              last_synced_at TEXT NOT NULL,
              version TEXT NOT NULL,
              item_count INTEGER NOT NULL
            )"""
    );

    private final Path path;
    private final String url;
    private final Properties connectionProperties;

    public SnapshotDatabase(Path path) {
        this.path = path;
        this.url = "jdbc:sqlite:" + path.toAbsolutePath();

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setTempStore(SQLiteConfig.TempStore.MEMORY);
        sqlite.setBusyTimeout(5_000);
        this.connectionProperties = sqlite.toProperties();
    }

    /**
     * Creates the parent directory and the schema if absent. Idempotent.
     *
     * @throws SnapshotSyncException if the file or schema cannot be created
     */
    public void initialize() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SnapshotSyncException("Cannot create snapshot directory for " + path, e);
        }

        try (Connection connection = open(); Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new SnapshotSyncException("Cannot initialize snapshot schema at " + path, e);
        }
        log.info("snapshot.initialized path={}", path);
    }

    /**
     * Opens a new connection. Callers close it.
     */
    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, connectionProperties);
    }

    public Path getPath() {
        return path;
    }
}
