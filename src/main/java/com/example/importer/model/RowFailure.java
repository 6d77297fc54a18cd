package com.example.importer.model;

import lombok.Value;

import java.io.Serializable;

/**
 * A row that was not written, with the 1-based line it came from.
 */
@Value
public class RowFailure implements Serializable {
    int rowNumber;
    String reason;
}
