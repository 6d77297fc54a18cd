package com.example.importer.schema;

import com.example.importer.model.SchemaDocument;
import com.example.importer.model.SchemaFormat;

/**
 * Entry point for turning a raw schema document into a {@link SchemaDocument}.
 */
public class DdlParser {

    private final SqlDdlParser sqlParser = new SqlDdlParser();
    private final MarkdownDdlParser markdownParser = new MarkdownDdlParser();

    public SchemaDocument parse(String document, SchemaFormat format, String sourcePath) throws DdlParseException {
        if (document == null || document.isBlank()) {
            throw new DdlParseException(sourcePath, "document is empty");
        }
        return switch (format) {
            case SQL -> sqlParser.parse(document, sourcePath);
            case MARKDOWN -> markdownParser.parse(document, sourcePath, stemOf(sourcePath));
        };
    }

    private static String stemOf(String sourcePath) {
        String name = sourcePath.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
