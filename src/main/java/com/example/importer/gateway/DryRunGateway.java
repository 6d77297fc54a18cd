package com.example.importer.gateway;

import java.util.List;

/**
 * Stand-in destination for validation-only runs. Any write reaching it is a programming error.
 */
public class DryRunGateway implements DatabaseGateway {

    @Override
    public boolean tableExists(String tableName) {
        throw new IllegalStateException("Dry run must not query table " + tableName);
    }

    @Override
    public BatchWriteResult writeBatch(String tableName, List<String> columns, List<List<Object>> rows) {
        throw new IllegalStateException("Dry run must not write to " + tableName);
    }

    @Override
    public void commit() {
        throw new IllegalStateException("Dry run must not commit");
    }

    @Override
    public void rollback() {
        // nothing was written
    }

    @Override
    public void executeDdl(String sql) {
        throw new IllegalStateException("Dry run must not execute DDL");
    }

    @Override
    public void close() {
        // no resources held
    }
}
