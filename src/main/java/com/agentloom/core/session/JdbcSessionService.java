package com.agentloom.core.session;

import com.agentloom.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC-backed {@link SessionService}.
 * <p>
 * App, user and session state are kept in three tables as JSON documents; the event
 * log is an append-only table ordered by an identity column. Every
 * {@link #appendEvent} runs in one transaction that locks the session row, so the
 * state update and the event insert become visible together or not at all.
 * <p>
 * Tables are created by {@link #createTables()}. The SQL sticks to statements that
 * PostgreSQL and H2 (in PostgreSQL mode) both accept.
 */
public class JdbcSessionService extends AbstractSessionService {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionService.class);

    private static final String APP_STATES = "agentloom_app_states";
    private static final String USER_STATES = "agentloom_user_states";
    private static final String SESSIONS = "agentloom_sessions";
    private static final String EVENTS = "agentloom_events";

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String SERIALIZATION_FAILURE = "40001";

    /** Conflicts between concurrent commits; the transaction is replayed from the start. */
    private static final Set<String> RETRYABLE_STATES = Set.of(
            UNIQUE_VIOLATION, SERIALIZATION_FAILURE, "40P01", "90131", "HYT00");
    private static final int MAX_ATTEMPTS = 5;

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS %s (
                app_name    VARCHAR(255) NOT NULL,
                state       TEXT NOT NULL,
                update_time BIGINT NOT NULL,
                PRIMARY KEY (app_name)
            )
            """.formatted(APP_STATES),
            """
            CREATE TABLE IF NOT EXISTS %s (
                app_name    VARCHAR(255) NOT NULL,
                user_id     VARCHAR(255) NOT NULL,
                state       TEXT NOT NULL,
                update_time BIGINT NOT NULL,
                PRIMARY KEY (app_name, user_id)
            )
            """.formatted(USER_STATES),
            """
            CREATE TABLE IF NOT EXISTS %s (
                app_name    VARCHAR(255) NOT NULL,
                user_id     VARCHAR(255) NOT NULL,
                id          VARCHAR(255) NOT NULL,
                created_seq BIGINT GENERATED BY DEFAULT AS IDENTITY,
                state       TEXT NOT NULL,
                create_time BIGINT NOT NULL,
                update_time BIGINT NOT NULL,
                PRIMARY KEY (app_name, user_id, id)
            )
            """.formatted(SESSIONS),
            """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id            VARCHAR(255) NOT NULL,
                app_name      VARCHAR(255) NOT NULL,
                user_id       VARCHAR(255) NOT NULL,
                session_id    VARCHAR(255) NOT NULL,
                invocation_id VARCHAR(255) NOT NULL,
                author        VARCHAR(255) NOT NULL,
                branch        TEXT,
                turn_complete BOOLEAN NOT NULL,
                error_code    VARCHAR(255),
                error_message TEXT,
                content       TEXT,
                actions       TEXT NOT NULL,
                event_nanos   BIGINT NOT NULL,
                PRIMARY KEY (app_name, user_id, session_id, id)
            )
            """.formatted(EVENTS));

    private static final String SELECT_APP_STATE_SQL = """
            SELECT state FROM %s WHERE app_name = ?
            """.formatted(APP_STATES);

    private static final String SELECT_APP_STATE_FOR_UPDATE_SQL = """
            SELECT state FROM %s WHERE app_name = ? FOR UPDATE
            """.formatted(APP_STATES);

    private static final String UPDATE_APP_STATE_SQL = """
            UPDATE %s SET state = ?, update_time = ? WHERE app_name = ?
            """.formatted(APP_STATES);

    private static final String ENSURE_APP_STATE_SQL = """
            INSERT INTO %s (state, update_time, app_name) VALUES ('{}', ?, ?)
            ON CONFLICT DO NOTHING
            """.formatted(APP_STATES);

    private static final String SELECT_USER_STATE_SQL = """
            SELECT state FROM %s WHERE app_name = ? AND user_id = ?
            """.formatted(USER_STATES);

    private static final String SELECT_USER_STATE_FOR_UPDATE_SQL = """
            SELECT state FROM %s WHERE app_name = ? AND user_id = ? FOR UPDATE
            """.formatted(USER_STATES);

    private static final String UPDATE_USER_STATE_SQL = """
            UPDATE %s SET state = ?, update_time = ? WHERE app_name = ? AND user_id = ?
            """.formatted(USER_STATES);

    private static final String ENSURE_USER_STATE_SQL = """
            INSERT INTO %s (state, update_time, app_name, user_id) VALUES ('{}', ?, ?, ?)
            ON CONFLICT DO NOTHING
            """.formatted(USER_STATES);

    private static final String SELECT_SESSION_SQL = """
            SELECT state, update_time FROM %s WHERE app_name = ? AND user_id = ? AND id = ?
            """.formatted(SESSIONS);

    private static final String SELECT_SESSION_FOR_UPDATE_SQL = """
            SELECT state, update_time FROM %s WHERE app_name = ? AND user_id = ? AND id = ? FOR UPDATE
            """.formatted(SESSIONS);

    private static final String INSERT_SESSION_SQL = """
            INSERT INTO %s (app_name, user_id, id, state, create_time, update_time)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(SESSIONS);

    private static final String UPDATE_SESSION_SQL = """
            UPDATE %s SET state = ?, update_time = ? WHERE app_name = ? AND user_id = ? AND id = ?
            """.formatted(SESSIONS);

    private static final String LIST_SESSIONS_SQL = """
            SELECT id FROM %s WHERE app_name = ? AND user_id = ? ORDER BY created_seq ASC
            """.formatted(SESSIONS);

    private static final String DELETE_SESSION_SQL = """
            DELETE FROM %s WHERE app_name = ? AND user_id = ? AND id = ?
            """.formatted(SESSIONS);

    private static final String DELETE_EVENTS_SQL = """
            DELETE FROM %s WHERE app_name = ? AND user_id = ? AND session_id = ?
            """.formatted(EVENTS);

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO %s (id, app_name, user_id, session_id, invocation_id, author, branch,
                            turn_complete, error_code, error_message, content, actions, event_nanos)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(EVENTS);

    private static final String SELECT_EVENTS_SQL = """
            SELECT id, invocation_id, author, branch, turn_complete, error_code, error_message,
                   content, actions, event_nanos
            FROM %s
            WHERE app_name = ? AND user_id = ? AND session_id = ?
            ORDER BY seq ASC
            """.formatted(EVENTS);

    private final DataSource dataSource;
    private final EventJsonCodec codec;

    public JdbcSessionService(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = new EventJsonCodec();
    }

    /**
     * Creates the session tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Session tables {} ensured", List.of(APP_STATES, USER_STATES, SESSIONS, EVENTS));
        }
    }

    @Override
    public Session createSession(String appName, String userId, Map<String, Object> initialState, String sessionId) {
        validateIdentity(appName, userId);
        Map<String, Object> initial = initialState == null ? Map.of() : initialState;
        StateValues.validateAll(initial);

        String id = sessionId != null && !sessionId.isBlank() ? sessionId.trim() : UUID.randomUUID().toString();
        var delta = ScopedDelta.route(initial);
        long now = Instant.now().toEpochMilli();

        try (Connection conn = dataSource.getConnection()) {
            inTransaction(conn, () -> {
                if (selectSessionRow(conn, SELECT_SESSION_SQL, appName, userId, id) != null) {
                    throw new SessionAlreadyExistsException(appName, userId, id);
                }
                updateAppState(conn, appName, delta.app(), now);
                updateUserState(conn, appName, userId, delta.user(), now);

                var state = new HashMap<String, Object>();
                applyTo(state, delta.session());
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SESSION_SQL)) {
                    stmt.setString(1, appName);
                    stmt.setString(2, userId);
                    stmt.setString(3, id);
                    stmt.setString(4, codec.writeState(state));
                    stmt.setLong(5, now);
                    stmt.setLong(6, now);
                    stmt.executeUpdate();
                }
            });
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new SessionAlreadyExistsException(appName, userId, id);
            }
            throw new SessionStoreException("Failed to create session " + id, e);
        }

        log.info("Created session {} for app '{}' user '{}'", id, appName, userId);
        return getSession(appName, userId, id, GetSessionConfig.all())
                .orElseThrow(() -> new SessionNotFoundException(appName, userId, id));
    }

    @Override
    public Optional<Session> getSession(String appName, String userId, String sessionId, GetSessionConfig config) {
        try (Connection conn = dataSource.getConnection()) {
            SessionRow row = selectSessionRow(conn, SELECT_SESSION_SQL, appName, userId, sessionId);
            if (row == null) {
                return Optional.empty();
            }
            Map<String, Object> appState = readState(conn, SELECT_APP_STATE_SQL, appName);
            Map<String, Object> userState = readState(conn, SELECT_USER_STATE_SQL, appName, userId);
            List<Event> events = selectEvents(conn, appName, userId, sessionId);

            return Optional.of(new Session(sessionId, appName, userId,
                    mergeState(appState, userState, row.state()),
                    filterEvents(events, config),
                    Instant.ofEpochMilli(row.updateTime())));
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public List<String> listSessionIds(String appName, String userId) {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LIST_SESSIONS_SQL)) {
            stmt.setString(1, appName);
            stmt.setString(2, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list sessions for user " + userId, e);
        }
        return ids;
    }

    @Override
    public void deleteSession(String appName, String userId, String sessionId) {
        try (Connection conn = dataSource.getConnection()) {
            inTransaction(conn, () -> {
                int events = executeUpdate(conn, DELETE_EVENTS_SQL, appName, userId, sessionId);
                int sessions = executeUpdate(conn, DELETE_SESSION_SQL, appName, userId, sessionId);
                if (sessions > 0) {
                    log.info("Deleted session {} ({} events) for app '{}' user '{}'",
                            sessionId, events, appName, userId);
                }
            });
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to delete session " + sessionId, e);
        } finally {
            releaseLock(new SessionKey(appName, userId, sessionId));
        }
    }

    @Override
    protected void persistEvent(SessionKey key, Event event, ScopedDelta delta, Instant updateTime) {
        long now = updateTime.toEpochMilli();
        try (Connection conn = dataSource.getConnection()) {
            inTransaction(conn, () -> {
                SessionRow row = selectSessionRow(conn, SELECT_SESSION_FOR_UPDATE_SQL,
                        key.appName(), key.userId(), key.sessionId());
                if (row == null) {
                    throw new SessionNotFoundException(key.appName(), key.userId(), key.sessionId());
                }
                updateAppState(conn, key.appName(), delta.app(), now);
                updateUserState(conn, key.appName(), key.userId(), delta.user(), now);

                Map<String, Object> sessionState = row.state();
                applyTo(sessionState, delta.session());
                try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SESSION_SQL)) {
                    stmt.setString(1, codec.writeState(sessionState));
                    stmt.setLong(2, now);
                    stmt.setString(3, key.appName());
                    stmt.setString(4, key.userId());
                    stmt.setString(5, key.sessionId());
                    stmt.executeUpdate();
                }
                insertEvent(conn, key, event);
            });
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to append event " + event.id() + " to session " + key.sessionId(), e);
        }
    }

    // ── Scoped state ─────────────────────────────────────────────────────

    private void updateAppState(Connection conn, String appName, Map<String, Object> delta, long now)
            throws SQLException {
        if (delta.isEmpty()) {
            return;
        }
        ensureRow(conn, ENSURE_APP_STATE_SQL, now, appName);
        Map<String, Object> state = readState(conn, SELECT_APP_STATE_FOR_UPDATE_SQL, appName);
        applyTo(state, delta);
        writeState(conn, UPDATE_APP_STATE_SQL, codec.writeState(state), now, appName);
    }

    private void updateUserState(Connection conn, String appName, String userId, Map<String, Object> delta, long now)
            throws SQLException {
        if (delta.isEmpty()) {
            return;
        }
        ensureRow(conn, ENSURE_USER_STATE_SQL, now, appName, userId);
        Map<String, Object> state = readState(conn, SELECT_USER_STATE_FOR_UPDATE_SQL, appName, userId);
        applyTo(state, delta);
        writeState(conn, UPDATE_USER_STATE_SQL, codec.writeState(state), now, appName, userId);
    }

    /**
     * Creates an empty state row unless one exists, so that the following
     * {@code SELECT ... FOR UPDATE} always has a row to lock. Sessions committing their
     * first scoped write at the same time then queue on that lock instead of racing
     * on the primary key.
     */
    private static void ensureRow(Connection conn, String ensureSql, long now, String... keys) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(ensureSql)) {
            stmt.setLong(1, now);
            for (int i = 0; i < keys.length; i++) {
                stmt.setString(2 + i, keys[i]);
            }
            stmt.executeUpdate();
        }
    }

    /** Statement takes {@code (state, update_time, key columns...)} in that order. */
    private static void writeState(Connection conn, String updateSql, String stateJson, long now, String... keys)
            throws SQLException {
        try (PreparedStatement update = conn.prepareStatement(updateSql)) {
            bindState(update, stateJson, now, keys);
            if (update.executeUpdate() == 0) {
                // row inserted by a transaction this one cannot see yet
                throw new SQLException("State row " + List.of(keys) + " not visible", SERIALIZATION_FAILURE);
            }
        }
    }

    private static void bindState(PreparedStatement stmt, String stateJson, long now, String... keys)
            throws SQLException {
        stmt.setString(1, stateJson);
        stmt.setLong(2, now);
        for (int i = 0; i < keys.length; i++) {
            stmt.setString(3 + i, keys[i]);
        }
    }

    private Map<String, Object> readState(Connection conn, String sql, String... keys) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < keys.length; i++) {
                stmt.setString(1 + i, keys[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? codec.readState(rs.getString("state")) : new HashMap<>();
            }
        }
    }

    // ── Sessions and events ──────────────────────────────────────────────

    private SessionRow selectSessionRow(Connection conn, String sql, String appName, String userId, String id)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, appName);
            stmt.setString(2, userId);
            stmt.setString(3, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new SessionRow(codec.readState(rs.getString("state")), rs.getLong("update_time"));
            }
        }
    }

    private void insertEvent(Connection conn, SessionKey key, Event event) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT_SQL)) {
            stmt.setString(1, event.id());
            stmt.setString(2, key.appName());
            stmt.setString(3, key.userId());
            stmt.setString(4, key.sessionId());
            stmt.setString(5, event.invocationId());
            stmt.setString(6, event.author());
            stmt.setString(7, event.branch());
            stmt.setBoolean(8, event.turnComplete());
            stmt.setString(9, event.errorCode());
            stmt.setString(10, event.errorMessage());
            stmt.setString(11, codec.writeContent(event.content()));
            stmt.setString(12, codec.writeActions(event.actions()));
            stmt.setLong(13, toEpochNanos(event.timestamp()));
            stmt.executeUpdate();
        }
    }

    private List<Event> selectEvents(Connection conn, String appName, String userId, String sessionId)
            throws SQLException {
        List<Event> events = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_EVENTS_SQL)) {
            stmt.setString(1, appName);
            stmt.setString(2, userId);
            stmt.setString(3, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(Event.builder()
                            .id(rs.getString("id"))
                            .invocationId(rs.getString("invocation_id"))
                            .author(rs.getString("author"))
                            .branch(rs.getString("branch"))
                            .turnComplete(rs.getBoolean("turn_complete"))
                            .errorCode(rs.getString("error_code"))
                            .errorMessage(rs.getString("error_message"))
                            .content(codec.readContent(rs.getString("content")))
                            .actions(codec.readActions(rs.getString("actions")))
                            .timestamp(fromEpochNanos(rs.getLong("event_nanos")))
                            .build());
                }
            }
        }
        return events;
    }

    /** Full-precision event time; a signed long of nanoseconds covers the years 1677 to 2262. */
    static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    private static int executeUpdate(Connection conn, String sql, String... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(1 + i, params[i]);
            }
            return stmt.executeUpdate();
        }
    }

    // ── Transactions ─────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }

    /**
     * Runs the work in a transaction, replaying it when it lost a race against a
     * concurrent commit. Any other failure is rethrown after rollback.
     */
    private static void inTransaction(Connection conn, SqlWork work) throws SQLException {
        for (int attempt = 1; ; attempt++) {
            try {
                runOnce(conn, work);
                return;
            } catch (SQLException e) {
                if (attempt >= MAX_ATTEMPTS || !RETRYABLE_STATES.contains(e.getSQLState())) {
                    throw e;
                }
                log.debug("Transaction conflict ({}), attempt {} of {}: {}",
                        e.getSQLState(), attempt, MAX_ATTEMPTS, e.getMessage());
            }
        }
    }

    private static void runOnce(Connection conn, SqlWork work) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            work.run();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(conn, e);
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.warn("Rollback failed after '{}'", cause.getMessage(), rollbackFailure);
        }
    }

    private record SessionRow(Map<String, Object> state, long updateTime) {}
}
