package com.catalog.reconciliation.snapshot;

import com.catalog.reconciliation.provider.FetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.catalog.reconciliation.normalize.RawValues.field;
import static com.catalog.reconciliation.normalize.RawValues.firstNumber;
import static com.catalog.reconciliation.normalize.RawValues.object;
import static com.catalog.reconciliation.normalize.RawValues.text;

/**
 * SQL access to the snapshot tables.
 */
public class SnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(SnapshotRepository.class);

    private static final String INSERT_ITEM = """
            INSERT INTO snapshot_items (id, name, item_type, rarity, value, weight, icon, updated_at, cached_at, raw_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String INSERT_LINK = """
            INSERT INTO snapshot_item_links (item_id, relation, related_item_id, related_name, quantity, raw_fragment)
            VALUES (?, ?, ?, ?, ?, ?)""";

    private static final String UPSERT_STATE = """
            INSERT INTO snapshot_sync_state (id, last_synced_at, version, item_count)
            VALUES (1, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
              last_synced_at = excluded.last_synced_at,
              version = excluded.version,
              item_count = excluded.item_count""";

    private static final String SELECT_LINKS =
            "SELECT item_id, relation, related_item_id, related_name, quantity, raw_fragment FROM snapshot_item_links";

    private final SnapshotDatabase database;
    private final ObjectMapper objectMapper;

    public SnapshotRepository(SnapshotDatabase database) {
        this(database, new ObjectMapper());
    }

    public SnapshotRepository(SnapshotDatabase database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the sync state, empty if the snapshot was never written.
     */
    public Optional<SyncState> readSyncState() {
        try (Connection connection = database.open()) {
            return querySyncState(connection);
        } catch (SQLException e) {
            throw new SnapshotSyncException("Cannot read snapshot sync state", e);
        }
    }

    /**
     * Reads the sync state and the items inside one read transaction, so both describe the
     * same committed snapshot even while a refresh replaces it.
     *
     * @throws SnapshotSyncException if the read fails
     */
    public StoredSnapshot readSnapshot() {
        try (Connection connection = database.open()) {
            connection.setAutoCommit(false);
            try {
                StoredSnapshot snapshot = new StoredSnapshot(querySyncState(connection), queryItemsRaw(connection));
                connection.commit();
                return snapshot;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SnapshotSyncException("Cannot read snapshot", e);
        }
    }

    private static Optional<SyncState> querySyncState(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                     "SELECT last_synced_at, version, item_count FROM snapshot_sync_state WHERE id = 1")) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new SyncState(rs.getString(1), rs.getString(2), rs.getInt(3)));
        }
    }

    /**
     * Replaces the whole snapshot with {@code result} in one transaction: clears links and
     * items, inserts every object item that has an id together with its links, and rewrites
     * the sync state. On any failure the transaction is rolled back and the prior snapshot
     * stays intact.
     *
     * @return number of item rows written
     * @throws SnapshotSyncException if the write fails
     */
    public int replaceAll(FetchResult result) {
        List<JsonNode> objects = new ArrayList<>();
        for (JsonNode raw : result.itemsRaw()) {
            if (raw != null && raw.isObject()) {
                objects.add(raw);
            }
        }

        try (Connection connection = database.open()) {
            connection.setAutoCommit(false);
            try {
                int written = writeSnapshot(connection, result, objects);
                connection.commit();
                return written;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                log.warn("snapshot.rolled-back provider={} error={}", result.sourceId(), e.getMessage());
                throw new SnapshotSyncException("Snapshot write failed: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new SnapshotSyncException("Snapshot write failed: " + e.getMessage(), e);
        }
    }

    private int writeSnapshot(Connection connection, FetchResult result, List<JsonNode> objects) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM snapshot_item_links");
            statement.executeUpdate("DELETE FROM snapshot_items");
        }

        int written = 0;
        try (PreparedStatement insertItem = connection.prepareStatement(INSERT_ITEM);
             PreparedStatement insertLink = connection.prepareStatement(INSERT_LINK)) {
            for (JsonNode item : objects) {
                String id = text(item.get("id"));
                if (id == null) {
                    continue;
                }
                insertItem.setString(1, id);
                insertItem.setString(2, text(item.get("name")));
                insertItem.setString(3, text(item.get("item_type")));
                insertItem.setString(4, text(item.get("rarity")));
                setNullableDouble(insertItem, 5, firstNumber(item.get("value")));
                setNullableDouble(insertItem, 6,
                        firstNumber(field(object(item, "stat_block"), "weight"), item.get("weight")));
                insertItem.setString(7, text(item.get("icon")));
                insertItem.setString(8, text(item.get("updated_at")));
                insertItem.setString(9, result.fetchedAt());
                insertItem.setString(10, item.toString());
                insertItem.executeUpdate();
                written++;

                for (ItemLink link : LinkExtractor.extract(item)) {
                    insertLink.setString(1, link.itemId());
                    insertLink.setString(2, link.relation().column());
                    insertLink.setString(3, link.relatedItemId());
                    insertLink.setString(4, link.relatedName());
                    setNullableDouble(insertLink, 5, link.quantity());
                    insertLink.setString(6, link.rawFragment());
                    insertLink.addBatch();
                }
                insertLink.executeBatch();
            }
        }

        try (PreparedStatement state = connection.prepareStatement(UPSERT_STATE)) {
            state.setString(1, result.fetchedAt());
            state.setString(2, result.versionOrCommit());
            state.setInt(3, objects.size());
            state.executeUpdate();
        }
        return written;
    }

    private List<JsonNode> queryItemsRaw(Connection connection) throws SQLException {
        List<JsonNode> items = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                     "SELECT id, raw_json FROM snapshot_items ORDER BY name COLLATE NOCASE ASC")) {
            while (rs.next()) {
                try {
                    items.add(objectMapper.readTree(rs.getString(2)));
                } catch (JsonProcessingException e) {
                    log.warn("snapshot.malformed-row id={} error={}", rs.getString(1), e.getOriginalMessage());
                }
            }
        }
        return items;
    }

    /**
     * Returns the links of one item in insertion order.
     */
    public List<ItemLink> findLinks(String itemId) {
        return queryLinks(SELECT_LINKS + " WHERE item_id = ? ORDER BY id", itemId);
    }

    /**
     * Returns every link of one relation kind in insertion order.
     */
    public List<ItemLink> findLinksByRelation(LinkRelation relation) {
        return queryLinks(SELECT_LINKS + " WHERE relation = ? ORDER BY id", relation.column());
    }

    private List<ItemLink> queryLinks(String sql, String parameter) {
        List<ItemLink> links = new ArrayList<>();
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, parameter);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    Optional<LinkRelation> relation = LinkRelation.fromColumn(rs.getString(2));
                    if (relation.isEmpty()) {
                        continue;
                    }
                    double quantity = rs.getDouble(5);
                    boolean quantityNull = rs.wasNull();
                    links.add(new ItemLink(
                            rs.getString(1),
                            relation.get(),
                            rs.getString(3),
                            rs.getString(4),
                            quantityNull ? null : quantity,
                            rs.getString(6)));
                }
            }
        } catch (SQLException e) {
            throw new SnapshotSyncException("Cannot read snapshot links", e);
        }
        return links;
    }

    private static void setNullableDouble(PreparedStatement statement, int index, Double value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.REAL);
        } else {
            statement.setDouble(index, value);
        }
    }
}
