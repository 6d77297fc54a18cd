package com.example.importer.schema;

/**
 * A schema document that cannot be turned into column metadata. Fatal to that document only.
 */
public class DdlParseException extends Exception {

    public DdlParseException(String documentPath, String message) {
        super(documentPath + ": " + message);
    }
}
