package com.pgfga.reconciler.session;

import com.pgfga.reconciler.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Holds one session per database of the cluster for the lifetime of the run.
 * Not thread-safe: a reconciliation pass is single-threaded.
 */
@Slf4j
public class SessionManager implements AutoCloseable {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final ConnectionParameters parameters;
    private final CredentialMaterializer credentialMaterializer;
    private final ConnectionOpener connectionOpener;

    private final Map<String, Connection> sessions = new HashMap<>();
    private final Map<String, JdbcTemplate> templates = new HashMap<>();

    public SessionManager(ConnectionParameters parameters,
                          CredentialMaterializer credentialMaterializer,
                          ConnectionOpener connectionOpener) {
        this.parameters = parameters;
        this.credentialMaterializer = credentialMaterializer;
        this.connectionOpener = connectionOpener;
    }

    /**
     * Returns the cached session for the database if it is still usable, otherwise opens a new one.
     *
     * @throws ConnectionException if the engine rejects the parameters or cannot be reached
     */
    public Connection connect(String database) {
        Connection cached = sessions.get(database);
        if (isHealthy(cached)) {
            return cached;
        }
        if (cached != null) {
            log.info("Session to database '{}' is no longer usable, reconnecting", database);
            closeQuietly(database, cached);
            sessions.remove(database);
            templates.remove(database);
        }

        Properties properties = parameters.toDriverProperties();
        MaterializedCredential key = materializeKey(properties);
        try {
            Connection connection = connectionOpener.open(parameters.jdbcUrl(database), properties);
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                closeQuietly(database, connection);
                throw e;
            }
            sessions.put(database, connection);
            log.info("Connected to database '{}' ({})", database, parameters.dsn());
            return connection;
        } catch (SQLException e) {
            throw new ConnectionException(database,
                    "Cannot connect to database '" + database + "' (" + parameters.dsn() + "): " + e.getMessage(), e);
        } finally {
            credentialMaterializer.cleanup(key);
        }
    }

    /**
     * A {@link JdbcTemplate} bound to the cached session of the database.
     */
    public JdbcTemplate jdbcTemplate(String database) {
        Connection connection = connect(database);
        JdbcTemplate template = templates.get(database);
        if (template == null) {
            template = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            templates.put(database, template);
        }
        return template;
    }

    /**
     * Closes and forgets the session to one database, if any.
     */
    public void disconnect(String database) {
        templates.remove(database);
        Connection connection = sessions.remove(database);
        if (connection != null) {
            closeQuietly(database, connection);
            log.debug("Disconnected from database '{}'", database);
        }
    }

    public ConnectionParameters getParameters() {
        return parameters;
    }

    @Override
    public void close() {
        sessions.forEach(this::closeQuietly);
        sessions.clear();
        templates.clear();
    }

    private MaterializedCredential materializeKey(Properties properties) {
        String sslKey = parameters.sslKey();
        if (sslKey == null) {
            return null;
        }
        try {
            MaterializedCredential key = credentialMaterializer.materialize(Path.of(sslKey));
            properties.setProperty(ConnectionParameters.SSLKEY, key.getPath().toString());
            return key;
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Could not prepare key file {}, connecting without sslkey: {}", sslKey, e.getMessage());
            properties.remove(ConnectionParameters.SSLKEY);
            return null;
        }
    }

    private boolean isHealthy(Connection connection) {
        if (connection == null) {
            return false;
        }
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debug("Session validation failed: {}", e.getMessage());
            return false;
        }
    }

    private void closeQuietly(String database, Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Error closing session to database '{}': {}", database, e.getMessage());
        }
    }
}
