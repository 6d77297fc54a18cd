package com.example.importer.gateway;

import com.example.importer.dialect.DatabaseDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC gateway holding one connection in manual-commit mode for its whole lifetime.
 * <p>
 * Each batch runs behind a savepoint, so a failed batch is undone on its own and may be retried or skipped while
 * earlier uncommitted batches stay in place.
 */
@Slf4j
public class JdbcDatabaseGateway implements DatabaseGateway {

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;
    private final DatabaseDialect dialect;

    public JdbcDatabaseGateway(DataSource dataSource, DatabaseDialect dialect) {
        this.dialect = dialect;
        try {
            this.connection = dataSource.getConnection();
            this.connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Failed to open import connection", e);
        }
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public boolean tableExists(String tableName) {
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            String catalog = connection.getCatalog();
            String schema = getSchema();
            try (ResultSet rs = metaData.getTables(catalog, schema, tableName.toUpperCase(), new String[]{"TABLE"})) {
                if (rs.next()) return true;
            }
            try (ResultSet rs = metaData.getTables(catalog, schema, tableName.toLowerCase(), new String[]{"TABLE"})) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw translate("tableExists " + tableName, e);
        }
    }

    @Override
    public BatchWriteResult writeBatch(String tableName, List<String> columns, List<List<Object>> rows) {
        String sql = dialect.insertSql(tableName, columns);
        List<Object[]> args = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            args.add(row.toArray());
        }
        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint();
        } catch (SQLException e) {
            return WriteFailureClassifier.toResult(translate("setSavepoint", e));
        }
        try {
            jdbcTemplate.batchUpdate(sql, args);
            return BatchWriteResult.success(rows.size());
        } catch (DataAccessException e) {
            rollbackTo(savepoint, tableName);
            return WriteFailureClassifier.toResult(e);
        }
    }

    private void rollbackTo(Savepoint savepoint, String tableName) {
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            log.warn("Could not roll back failed batch for table {}: {}", tableName, e.getMessage());
        }
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw translate("commit", e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw translate("rollback", e);
        }
    }

    @Override
    public void executeDdl(String sql) {
        log.info("Executing DDL: {}", sql);
        jdbcTemplate.execute(sql);
    }

    @Override
    public void close() {
        try {
            if (connection.isClosed()) {
                return;
            }
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback before closing the import connection failed: {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw translate("close", e);
        }
    }

    private String getSchema() {
        try {
            return connection.getSchema();
        } catch (AbstractMethodError | SQLException e) {
            return null;
        }
    }

    private DataAccessException translate(String task, SQLException e) {
        DataAccessException translated = jdbcTemplate.getExceptionTranslator().translate(task, null, e);
        return translated != null ? translated : new UncategorizedSQLException(task, null, e);
    }
}
