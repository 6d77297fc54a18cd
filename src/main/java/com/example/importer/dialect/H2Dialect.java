package com.example.importer.dialect;

import java.sql.Timestamp;

/**
 * H2 running in Oracle compatibility mode; only timestamp literals differ.
 */
public class H2Dialect extends OracleDialect {

    @Override
    protected String timestampLiteral(Timestamp value) {
        return "TIMESTAMP '" + value.toLocalDateTime().format(TIMESTAMP_FORMAT) + "'";
    }

    @Override
    public String getName() {
        return "h2";
    }
}
