package com.example.importer.model;

import lombok.Value;

import java.util.List;

/**
 * Column names zipped positionally against every data row of one file.
 */
@Value
public class EffectiveColumnList {

    public enum Source {
        HEADER_ROW,
        SCHEMA
    }

    List<String> columns;
    Source source;

    public EffectiveColumnList(List<String> columns, Source source) {
        this.columns = List.copyOf(columns);
        this.source = source;
    }

    public int size() {
        return columns.size();
    }
}
