package com.example.importer.model;

public enum SchemaFormat {
    SQL,
    MARKDOWN
}
