package com.example.importer.header;

public enum HeaderDecision {
    HEADER_PRESENT,
    HEADER_ABSENT
}
