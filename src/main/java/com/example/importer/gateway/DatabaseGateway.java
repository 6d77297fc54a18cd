package com.example.importer.gateway;

import java.util.List;

/**
 * Destination of imported rows. One instance owns one connection (or output) and is closed on every exit path.
 */
public interface DatabaseGateway extends AutoCloseable {

    boolean tableExists(String tableName);

    /**
     * Writes all rows as one unit. A failed write leaves nothing of this batch behind.
     */
    BatchWriteResult writeBatch(String tableName, List<String> columns, List<List<Object>> rows);

    void commit();

    void rollback();

    void executeDdl(String sql);

    @Override
    void close();
}
