package com.example.importer.schema;

import com.example.importer.model.SchemaDocument;
import com.example.importer.model.SchemaFormat;
import com.example.importer.naming.TableNameResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every {@code .sql} and {@code .md} document of a DDL folder into a {@link SchemaCatalog}.
 */
@Slf4j
public class SchemaCatalogLoader {

    private final DdlParser parser;
    private final TableNameResolver tableNameResolver;

    public SchemaCatalogLoader(DdlParser parser, TableNameResolver tableNameResolver) {
        this.parser = parser;
        this.tableNameResolver = tableNameResolver;
    }

    public SchemaCatalog load(Path folder, Set<String> auditColumns) {
        SchemaCatalog catalog = SchemaCatalog.empty();
        if (folder == null) {
            return catalog;
        }
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("DDL folder does not exist: " + folder);
        }
        for (Path document : listDocuments(folder)) {
            SchemaFormat format = formatOf(document);
            try {
                String text = Files.readString(document, StandardCharsets.UTF_8);
                SchemaDocument schema = parser.parse(text, format, document.toString()).withAuditColumns(auditColumns);
                catalog.add(schema, name -> tableNameResolver.resolveName(name, true));
                log.info("Loaded schema for table {} from {} ({} columns)",
                        schema.getTableName(), document, schema.getColumns().size());
            } catch (DdlParseException e) {
                log.warn("Skipping schema document: {}", e.getMessage());
                catalog.addError(e);
            } catch (IOException e) {
                DdlParseException error = new DdlParseException(document.toString(), "cannot read document: " + e.getMessage());
                log.warn("Skipping schema document: {}", error.getMessage());
                catalog.addError(error);
            }
        }
        log.info("Schema catalog holds {} documents, {} rejected", catalog.size(), catalog.getErrors().size());
        return catalog;
    }

    private List<Path> listDocuments(Path folder) {
        try (Stream<Path> paths = Files.walk(folder)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> formatOf(path) != null)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list DDL folder " + folder, e);
        }
    }

    private static SchemaFormat formatOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".sql")) {
            return SchemaFormat.SQL;
        }
        if (name.endsWith(".md")) {
            return SchemaFormat.MARKDOWN;
        }
        return null;
    }
}
