package com.channelmerge.curator;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Sink that upserts grouped channels into PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code channels} holds one row per channel name (the {@code channel_key}) with the primary endpoint.</li>
 *   <li>{@code channel_sources} holds the overflow endpoints of a channel; each upsert replaces the previous set.</li>
 *   <li>Attribute columns come from {@link ChannelAttributeRegistry}, so a new attribute only needs a registry entry.</li>
 *   <li>Every snapshot is written in one transaction; SQL failures surface as {@link SinkWriteException} for the retrying writer.</li>
 * </ul>
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class PostgresChannelSink implements ChannelSinkInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresChannelSink.class);
    private final String url;
    private final String user;
    private final String password;

    private static final List<String> ATTRIBUTE_COLUMNS = ChannelAttributeRegistry.getAttributes().stream()
        .map(a -> a.columnName)
        .collect(Collectors.toList());

    /**
     * Constructs a sink with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresChannelSink(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Ensures the channels and channel_sources tables exist.
     * @throws SinkWriteException if the schema could not be created
     */
    public void createTables() throws SinkWriteException {
        String attributeDdl = ATTRIBUTE_COLUMNS.stream().map(c -> c + " TEXT").collect(Collectors.joining(", "));
        String channelTable = "CREATE TABLE IF NOT EXISTS channels (" +
                "id SERIAL PRIMARY KEY, " +
                "channel_key TEXT UNIQUE NOT NULL, " +
                "source_url TEXT, channel_name TEXT, stream_url TEXT, " +
                attributeDdl +
                ")";
        String sourceTable = "CREATE TABLE IF NOT EXISTS channel_sources (" +
                "id SERIAL PRIMARY KEY, " +
                "parent_channel_id INTEGER NOT NULL REFERENCES channels(id) ON DELETE CASCADE, " +
                "position INTEGER NOT NULL, " +
                "source_url TEXT, stream_url TEXT, " +
                attributeDdl +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(channelTable);
            stmt.execute(sourceTable);
            logger.info("Ensured channels and channel_sources tables exist.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
            throw new SinkWriteException("Failed to create tables", e);
        }
    }

    @Override
    public void writeBatch(SortedMap<String, ChannelGroup> groups) throws SinkWriteException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                for (ChannelGroup group : groups.values()) {
                    int id = upsertChannel(conn, group);
                    upsertAlternates(conn, id, group.overflow());
                }
                conn.commit();
                logger.info("Upserted {} channels into database.", groups.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Error writing channel batch: {}", e.getMessage());
            throw new SinkWriteException("Failed to write " + groups.size() + " channels", e);
        }
    }

    /**
     * Inserts or updates the row for a channel and returns its id.
     * @param group Channel group whose primary is stored
     * @return Channel id
     * @throws SinkWriteException if the upsert failed
     */
    public int upsertChannel(ChannelGroup group) throws SinkWriteException {
        try (Connection conn = connect()) {
            return upsertChannel(conn, group);
        } catch (SQLException e) {
            logger.error("Error upserting channel '{}': {}", group.channelName(), e.getMessage());
            throw new SinkWriteException("Failed to upsert channel " + group.channelName(), e);
        }
    }

    /**
     * Replaces the alternates stored for a channel.
     * @param channelId Channel id returned by {@link #upsertChannel(ChannelGroup)}
     * @param alternates Overflow records in order
     * @throws SinkWriteException if the replacement failed
     */
    public void upsertAlternates(int channelId, List<ChannelRecord> alternates) throws SinkWriteException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                upsertAlternates(conn, channelId, alternates);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Error upserting alternates for channel {}: {}", channelId, e.getMessage());
            throw new SinkWriteException("Failed to upsert alternates for channel " + channelId, e);
        }
    }

    private int upsertChannel(Connection conn, ChannelGroup group) throws SQLException {
        List<String> updatable = new ArrayList<>(List.of("source_url", "channel_name", "stream_url"));
        updatable.addAll(ATTRIBUTE_COLUMNS);
        String columns = "channel_key, " + String.join(", ", updatable);
        String placeholders = String.join(", ", Collections.nCopies(1 + updatable.size(), "?"));
        String updates = updatable.stream().map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", "));
        String sql = "INSERT INTO channels (" + columns + ") VALUES (" + placeholders + ") " +
                "ON CONFLICT (channel_key) DO UPDATE SET " + updates + " RETURNING id";
        ChannelRecord primary = group.primary();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, group.channelName());
            ps.setString(2, primary.sourceManifest());
            ps.setString(3, group.channelName());
            ps.setString(4, primary.endpoint());
            bindAttributes(ps, 5, primary);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new SQLException("Upsert returned no id for channel " + group.channelName());
                return rs.getInt(1);
            }
        }
    }

    private void upsertAlternates(Connection conn, int channelId, List<ChannelRecord> alternates) throws SQLException {
        try (PreparedStatement delete = conn.prepareStatement("DELETE FROM channel_sources WHERE parent_channel_id = ?")) {
            delete.setInt(1, channelId);
            delete.executeUpdate();
        }
        if (alternates.isEmpty()) return;
        String sql = "INSERT INTO channel_sources (parent_channel_id, position, source_url, stream_url, " +
                String.join(", ", ATTRIBUTE_COLUMNS) + ") VALUES (" +
                String.join(", ", Collections.nCopies(4 + ATTRIBUTE_COLUMNS.size(), "?")) + ")";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int position = 0;
            for (ChannelRecord r : alternates) {
                ps.setInt(1, channelId);
                ps.setInt(2, position++);
                ps.setString(3, r.sourceManifest());
                ps.setString(4, r.endpoint());
                bindAttributes(ps, 5, r);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void bindAttributes(PreparedStatement ps, int firstIndex, ChannelRecord record) throws SQLException {
        int i = firstIndex;
        for (ChannelAttribute a : ChannelAttributeRegistry.getAttributes()) {
            String value = record.attributes().get(a.key);
            if (value != null) ps.setString(i, value); else ps.setNull(i, Types.VARCHAR);
            i++;
        }
    }

    @Override
    public String describe() {
        return "postgres " + url;
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RuntimeException(e);
        }
    }
}
