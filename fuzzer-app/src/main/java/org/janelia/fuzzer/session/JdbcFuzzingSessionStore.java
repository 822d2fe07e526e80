package org.janelia.fuzzer.session;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relational {@link FuzzingSessionStore} that talks plain JDBC.
 *
 * Tables are created on open if they do not already exist.
 * Access is serialized through a single connection.
 */
public class JdbcFuzzingSessionStore
        implements FuzzingSessionStore {

    static final String CREATE_SESSION_TABLE_SQL =
            "CREATE TABLE IF NOT EXISTS FeatureDetectionFuzzingSession (" +
            "Id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "StartTime TIMESTAMP NOT NULL, " +
            "EndTime TIMESTAMP NULL)";

    static final String CREATE_RESULT_TABLE_SQL =
            "CREATE TABLE IF NOT EXISTS FeatureDetectionResult (" +
            "Id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "InputFileName VARCHAR(1024) NOT NULL, " +
            "Algorithm VARCHAR(16) NOT NULL, " +
            "Iteration INT NOT NULL, " +
            "InlierCount INT NOT NULL, " +
            "TotalCount INT NOT NULL, " +
            "InlierOutlierRatio REAL NOT NULL, " +
            "ExecutionTimeMs BIGINT NOT NULL, " +
            "Parameters VARCHAR(2048) NOT NULL, " +
            "FuzzingSessionId BIGINT NOT NULL, " +
            "CONSTRAINT FK_FeatureDetectionResult_Session " +
            "FOREIGN KEY (FuzzingSessionId) REFERENCES FeatureDetectionFuzzingSession(Id))";

    private static final String INSERT_SESSION_SQL =
            "INSERT INTO FeatureDetectionFuzzingSession (StartTime, EndTime) VALUES (?, ?)";

    private static final String UPDATE_SESSION_END_SQL =
            "UPDATE FeatureDetectionFuzzingSession SET EndTime = ? WHERE Id = ?";

    private static final String SELECT_SESSION_SQL =
            "SELECT Id, StartTime, EndTime FROM FeatureDetectionFuzzingSession WHERE Id = ?";

    private static final String INSERT_RESULT_SQL =
            "INSERT INTO FeatureDetectionResult (InputFileName, Algorithm, Iteration, InlierCount, TotalCount, " +
            "InlierOutlierRatio, ExecutionTimeMs, Parameters, FuzzingSessionId) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_RESULTS_SQL =
            "SELECT InputFileName, Algorithm, Iteration, InlierCount, TotalCount, InlierOutlierRatio, " +
            "ExecutionTimeMs, Parameters FROM FeatureDetectionResult WHERE FuzzingSessionId = ? ORDER BY Id";

    private final DbConfig dbConfig;
    private final Connection connection;

    /**
     * Opens a connection and creates any missing tables.
     *
     * @throws FuzzingSessionStoreException
     *   if the database cannot be reached or the schema cannot be created.
     */
    public JdbcFuzzingSessionStore(final DbConfig dbConfig)
            throws FuzzingSessionStoreException {

        this.dbConfig = dbConfig;

        try {
            if (dbConfig.hasCredentials()) {
                this.connection = DriverManager.getConnection(dbConfig.getUrl(),
                                                              dbConfig.getUserName(),
                                                              dbConfig.getPassword());
            } else {
                this.connection = DriverManager.getConnection(dbConfig.getUrl());
            }
        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to connect to " + dbConfig, e);
        }

        try (final Statement statement = connection.createStatement()) {
            statement.execute(CREATE_SESSION_TABLE_SQL);
            statement.execute(CREATE_RESULT_TABLE_SQL);
        } catch (final SQLException e) {
            closeQuietly();
            throw new FuzzingSessionStoreException("failed to create schema in " + dbConfig, e);
        }

        LOG.info("JdbcFuzzingSessionStore: connected to {}", dbConfig);
    }

    @Override
    public synchronized void startSession(final FuzzingSession session)
            throws FuzzingSessionStoreException {

        try (final PreparedStatement statement =
                     connection.prepareStatement(INSERT_SESSION_SQL, Statement.RETURN_GENERATED_KEYS)) {

            statement.setTimestamp(1, toTimestamp(session.getStartTime()));
            statement.setTimestamp(2, toTimestamp(session.getEndTime()));
            statement.executeUpdate();

            try (final ResultSet keys = statement.getGeneratedKeys()) {
                if (! keys.next()) {
                    throw new FuzzingSessionStoreException("no id generated for new session", null);
                }
                session.setId(keys.getLong(1));
            }

        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to start session", e);
        }

        LOG.info("startSession: started {}", session);
    }

    @Override
    public synchronized void saveRecords(final FuzzingSession session,
                                         final List<FeatureDetectionRecord> records)
            throws FuzzingSessionStoreException {

        final long sessionId = getRequiredId(session);

        try {
            connection.setAutoCommit(false);
            try (final PreparedStatement statement = connection.prepareStatement(INSERT_RESULT_SQL)) {
                for (final FeatureDetectionRecord record : records) {
                    statement.setString(1, record.getInputFileName());
                    statement.setString(2, record.getAlgorithm());
                    statement.setInt(3, record.getIteration());
                    statement.setInt(4, record.getInlierCount());
                    statement.setInt(5, record.getTotalCount());
                    statement.setFloat(6, record.getInlierOutlierRatio());
                    statement.setLong(7, record.getExecutionTimeMs());
                    statement.setString(8, record.getParameters());
                    statement.setLong(9, sessionId);
                    statement.addBatch();
                }
                statement.executeBatch();
            }
            connection.commit();
        } catch (final SQLException e) {
            rollback();
            throw new FuzzingSessionStoreException("failed to save " + records.size() +
                                                   " records for " + session, e);
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public synchronized void completeSession(final FuzzingSession session)
            throws FuzzingSessionStoreException {

        final long sessionId = getRequiredId(session);

        try (final PreparedStatement statement = connection.prepareStatement(UPDATE_SESSION_END_SQL)) {
            statement.setTimestamp(1, toTimestamp(session.getEndTime()));
            statement.setLong(2, sessionId);
            if (statement.executeUpdate() != 1) {
                throw new FuzzingSessionStoreException(session + " does not exist in " + dbConfig, null);
            }
        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to complete " + session, e);
        }

        LOG.info("completeSession: completed {}", session);
    }

    @Override
    public synchronized FuzzingSession getSession(final long sessionId)
            throws FuzzingSessionStoreException {

        FuzzingSession session = null;

        try (final PreparedStatement statement = connection.prepareStatement(SELECT_SESSION_SQL)) {
            statement.setLong(1, sessionId);
            try (final ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    session = new FuzzingSession(resultSet.getLong(1),
                                                 toDate(resultSet.getTimestamp(2)),
                                                 toDate(resultSet.getTimestamp(3)));
                }
            }
        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to retrieve session " + sessionId, e);
        }

        return session;
    }

    @Override
    public synchronized List<FeatureDetectionRecord> getRecords(final long sessionId)
            throws FuzzingSessionStoreException {

        final List<FeatureDetectionRecord> records = new ArrayList<>();

        try (final PreparedStatement statement = connection.prepareStatement(SELECT_RESULTS_SQL)) {
            statement.setLong(1, sessionId);
            try (final ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    records.add(new FeatureDetectionRecord(resultSet.getString(1),
                                                           resultSet.getString(2),
                                                           resultSet.getInt(3),
                                                           resultSet.getInt(4),
                                                           resultSet.getInt(5),
                                                           resultSet.getFloat(6),
                                                           resultSet.getLong(7),
                                                           resultSet.getString(8)));
                }
            }
        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to retrieve records for session " + sessionId, e);
        }

        return records;
    }

    @Override
    public synchronized void close()
            throws FuzzingSessionStoreException {
        try {
            connection.close();
        } catch (final SQLException e) {
            throw new FuzzingSessionStoreException("failed to close connection to " + dbConfig, e);
        }
    }

    @Override
    public String toString() {
        return "store " + dbConfig;
    }

    private long getRequiredId(final FuzzingSession session)
            throws FuzzingSessionStoreException {
        if (session.getId() == null) {
            throw new FuzzingSessionStoreException("session has not been started in " + dbConfig, null);
        }
        return session.getId();
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (final SQLException e) {
            LOG.warn("rollback: failed to roll back transaction, ignoring error", e);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (final SQLException e) {
            LOG.warn("restoreAutoCommit: failed to restore auto commit, ignoring error", e);
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (final SQLException e) {
            LOG.warn("closeQuietly: failed to close connection to " + dbConfig + ", ignoring error", e);
        }
    }

    private static Timestamp toTimestamp(final Date date) {
        return date == null ? null : new Timestamp(date.getTime());
    }

    private static Date toDate(final Timestamp timestamp) {
        return timestamp == null ? null : new Date(timestamp.getTime());
    }

    private static final Logger LOG = LoggerFactory.getLogger(JdbcFuzzingSessionStore.class);
}
