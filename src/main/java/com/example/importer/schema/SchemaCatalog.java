package com.example.importer.schema;

import com.example.importer.model.SchemaDocument;
import com.example.importer.model.TableTarget;
import lombok.extern.slf4j.Slf4j;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Parsed schema documents keyed by normalized table name, plus the documents that failed to parse.
 * <p>
 * The join key is the table name declared inside each document, normalized the same way file stems are.
 */
@Slf4j
public class SchemaCatalog implements Serializable {

    private final Map<String, List<SchemaDocument>> documentsByTable = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    public static SchemaCatalog empty() {
        return new SchemaCatalog();
    }

    public void add(SchemaDocument document, UnaryOperator<String> normalizer) {
        String key = normalizer.apply(document.getTableName());
        documentsByTable.computeIfAbsent(key, k -> new ArrayList<>()).add(document);
    }

    public void addError(DdlParseException error) {
        errors.add(error.getMessage());
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int size() {
        return documentsByTable.values().stream().mapToInt(List::size).sum();
    }

    public List<SchemaDocument> candidates(TableTarget target) {
        return documentsByTable.getOrDefault(target.getTableName(), List.of());
    }

    /**
     * The single document declaring the target table. Zero or several candidates yield empty; several are logged
     * with their paths rather than guessed between.
     */
    public Optional<SchemaDocument> match(TableTarget target) {
        List<SchemaDocument> candidates = candidates(target);
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        if (candidates.size() > 1) {
            List<String> paths = new ArrayList<>();
            candidates.forEach(doc -> paths.add(doc.getSourcePath()));
            log.warn("Table {} (file {}) is declared by {} schema documents, ignoring all of them: {}",
                    target.getTableName(), target.getSourceFile(), candidates.size(), paths);
        }
        return Optional.empty();
    }
}
