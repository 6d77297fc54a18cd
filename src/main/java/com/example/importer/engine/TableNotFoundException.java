package com.example.importer.engine;

import lombok.Getter;

/**
 * The destination table of a file does not exist. Fatal to that file only.
 */
@Getter
public class TableNotFoundException extends RuntimeException {

    private final String tableName;
    private final String fileName;
    private final String suggestedDdl;
    private final String ddlDocument;

    public TableNotFoundException(String tableName, String fileName, String suggestedDdl, String ddlDocument) {
        super(buildMessage(tableName, fileName, suggestedDdl, ddlDocument));
        this.tableName = tableName;
        this.fileName = fileName;
        this.suggestedDdl = suggestedDdl;
        this.ddlDocument = ddlDocument;
    }

    private static String buildMessage(String tableName, String fileName, String suggestedDdl, String ddlDocument) {
        StringBuilder sb = new StringBuilder("Table ").append(tableName).append(" does not exist (file ")
                .append(fileName).append(")");
        if (suggestedDdl != null) {
            sb.append(". Create it from ").append(ddlDocument).append(":\n").append(suggestedDdl);
        } else {
            sb.append(". No DDL document declares it");
        }
        return sb.toString();
    }
}
