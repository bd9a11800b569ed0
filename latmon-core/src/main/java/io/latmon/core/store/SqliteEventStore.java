package io.latmon.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.SourceKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite store in WAL mode: one writer at a time, readers see the last committed state and
 * never a partially written batch.
 */
public final class SqliteEventStore implements EventStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteEventStore.class);
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };
    private static final String COLUMNS =
        "id, timestamp, component_class, source_kind, duration_microseconds, description, metadata";

    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();

    public SqliteEventStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path absolute = dbPath.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        this.jdbcUrl = "jdbc:sqlite:" + absolute;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        init();
        LOG.info("Event store initialized at {}", absolute);
    }

    @Override
    public List<LatencyEvent> appendAll(List<LatencyEvent> events) throws IOException {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        String sql = """
            INSERT INTO latency_events
                (timestamp, component_class, source_kind, duration_microseconds, description, metadata)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        synchronized (writeLock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try (PreparedStatement insert = connection.prepareStatement(sql);
                     Statement rowId = connection.createStatement()) {
                    List<LatencyEvent> persisted = new ArrayList<>(events.size());
                    for (LatencyEvent event : events) {
                        insert.setString(1, Timestamps.format(event.timestamp()));
                        insert.setString(2, event.componentClass().wireName());
                        insert.setString(3, event.sourceKind().wireName());
                        insert.setLong(4, event.durationMicros());
                        insert.setString(5, event.description());
                        String metadata = writeMetadata(event.metadata());
                        if (metadata == null) {
                            insert.setNull(6, Types.VARCHAR);
                        } else {
                            insert.setString(6, metadata);
                        }
                        insert.executeUpdate();
                        try (ResultSet keys = rowId.executeQuery("SELECT last_insert_rowid()")) {
                            keys.next();
                            persisted.add(event.withId(keys.getLong(1)));
                        }
                    }
                    connection.commit();
                    return persisted;
                } catch (SQLException | IOException e) {
                    connection.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                throw new IOException("Failed to append " + events.size() + " latency event(s)", e);
            }
        }
    }

    @Override
    public List<LatencyEvent> recent(int limit) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM latency_events ORDER BY timestamp DESC, id DESC LIMIT ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, Math.max(0, limit));
            return readEvents(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to read recent latency events", e);
        }
    }

    @Override
    public List<LatencyEvent> range(Instant from, Instant to, ComponentClass componentClass, int limit)
        throws IOException {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM latency_events WHERE 1 = 1");
        List<String> params = new ArrayList<>();
        if (from != null) {
            sql.append(" AND timestamp >= ?");
            params.add(Timestamps.format(from));
        }
        if (to != null) {
            sql.append(" AND timestamp < ?");
            params.add(Timestamps.format(to));
        }
        if (componentClass != null) {
            sql.append(" AND component_class = ?");
            params.add(componentClass.wireName());
        }
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ?");
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            int index = 1;
            for (String param : params) {
                statement.setString(index++, param);
            }
            statement.setInt(index, Math.max(0, limit));
            return readEvents(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to query latency events by range", e);
        }
    }

    @Override
    public int purgeOlderThan(Instant cutoff) throws IOException {
        synchronized (writeLock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                     "DELETE FROM latency_events WHERE timestamp < ?")) {
                statement.setString(1, Timestamps.format(cutoff));
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw new IOException("Failed to purge latency events older than " + cutoff, e);
            }
        }
    }

    @Override
    public long count() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM latency_events")) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new IOException("Failed to count latency events", e);
        }
    }

    @Override
    public Optional<Instant> lastEventTime() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT MAX(timestamp) FROM latency_events")) {
            if (resultSet.next()) {
                String raw = resultSet.getString(1);
                return raw == null ? Optional.empty() : Optional.of(Timestamps.parse(raw));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new IOException("Failed to read last event time", e);
        }
    }

    private List<LatencyEvent> readEvents(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            List<LatencyEvent> events = new ArrayList<>();
            while (resultSet.next()) {
                events.add(new LatencyEvent(
                    resultSet.getLong("id"),
                    Timestamps.parse(resultSet.getString("timestamp")),
                    ComponentClass.fromWireName(resultSet.getString("component_class")),
                    SourceKind.fromWireName(resultSet.getString("source_kind")),
                    resultSet.getLong("duration_microseconds"),
                    resultSet.getString("description"),
                    readMetadata(resultSet.getString("metadata"))
                ));
            }
            return events;
        }
    }

    private String writeMetadata(Map<String, Object> metadata) throws IOException {
        if (metadata == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize event metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(raw, METADATA);
        } catch (JsonProcessingException e) {
            LOG.debug("Unreadable event metadata ignored: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS latency_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp TEXT NOT NULL,
                component_class TEXT NOT NULL,
                source_kind TEXT NOT NULL,
                duration_microseconds INTEGER NOT NULL CHECK (duration_microseconds >= 0),
                description TEXT NOT NULL,
                metadata TEXT
            )
            """;
        String timestampIdx = """
            CREATE INDEX IF NOT EXISTS idx_latency_events_timestamp
            ON latency_events(timestamp)
            """;
        String componentIdx = """
            CREATE INDEX IF NOT EXISTS idx_latency_events_component
            ON latency_events(component_class, timestamp)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(timestampIdx);
            statement.execute(componentIdx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite event store", e);
        }
    }
}
