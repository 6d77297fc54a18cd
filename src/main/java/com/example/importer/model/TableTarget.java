package com.example.importer.model;

import lombok.Value;

import java.io.Serializable;

@Value
public class TableTarget implements Serializable {
    String tableName;
    String sourceFile;
    boolean explicitOverride;
}
