package com.pgfga.reconciler.catalog;

import com.pgfga.reconciler.exception.QueryException;
import com.pgfga.reconciler.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;

import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

/**
 * Runs statements against one database of the cluster and returns rows as ordered
 * column name to value maps.
 */
@Slf4j
public class CatalogQueryExecutor {

    public static final List<Object> NO_PARAMETERS = List.of();

    private final SessionManager sessionManager;

    public CatalogQueryExecutor(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Executes a statement with bound parameters.
     *
     * @return the rows, or {@code null} when the statement produced no result set
     * @throws QueryException when the engine rejects the statement
     */
    public List<Map<String, Object>> execute(String database, String statement, List<?> parameters) {
        JdbcTemplate jdbcTemplate = sessionManager.jdbcTemplate(database);
        log.debug("query on {}: {}", database, statement);
        try {
            return jdbcTemplate.execute(statement, (PreparedStatementCallback<List<Map<String, Object>>>) ps -> {
                new ArgumentPreparedStatementSetter(parameters.toArray()).setValues(ps);
                if (!ps.execute()) {
                    return null;
                }
                try (ResultSet resultSet = ps.getResultSet()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(resultSet);
                }
            });
        } catch (DataAccessException e) {
            log.error("Statement failed on {}: {}", database, e.getMostSpecificCause().getMessage());
            throw new QueryException(database, statement, e.getMostSpecificCause());
        }
    }

    /**
     * Like {@link #execute}, but never returns {@code null}.
     */
    public List<Map<String, Object>> query(String database, String statement, List<?> parameters) {
        List<Map<String, Object>> rows = execute(database, statement, parameters);
        return rows != null ? rows : List.of();
    }

    public boolean exists(String database, String statement, List<?> parameters) {
        return !query(database, statement, parameters).isEmpty();
    }

    /**
     * Values of one column, in row order.
     */
    public List<String> column(String database, String statement, List<?> parameters, String column) {
        return query(database, statement, parameters).stream()
                .map(row -> (String) row.get(column))
                .toList();
    }

    /**
     * Drops the cached session to a database, e.g. before that database is dropped.
     */
    public void release(String database) {
        sessionManager.disconnect(database);
    }

    public boolean isStandby(String database) {
        List<Map<String, Object>> rows = query(database, CatalogStatements.IS_IN_RECOVERY, NO_PARAMETERS);
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0).get("recovery"));
    }
}
