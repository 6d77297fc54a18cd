package com.example.importer.gateway;

import com.example.importer.dialect.DatabaseDialect;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders batches as INSERT statements into {@code <output>/<TABLE>_insert.sql} instead of executing them.
 * <p>
 * Statements are buffered until {@link #commit()}; {@link #rollback()} drops them. A script is truncated the first
 * time a run writes to it and appended to afterwards. Table existence is answered by the delegate gateway when
 * one is given, otherwise every table is assumed to exist.
 */
@Slf4j
public class SqlScriptGateway implements DatabaseGateway {

    private final DatabaseDialect dialect;
    private final Path outputDirectory;
    private final DatabaseGateway delegate;
    private final Set<String> startedScripts;
    private final Map<String, List<String>> pending = new LinkedHashMap<>();

    public SqlScriptGateway(DatabaseDialect dialect, Path outputDirectory, DatabaseGateway delegate,
                            Set<String> startedScripts) {
        this.dialect = dialect;
        this.outputDirectory = outputDirectory;
        this.delegate = delegate;
        this.startedScripts = startedScripts;
    }

    public SqlScriptGateway(DatabaseDialect dialect, Path outputDirectory, DatabaseGateway delegate) {
        this(dialect, outputDirectory, delegate, new HashSet<>());
    }

    public static Path scriptPath(Path outputDirectory, String tableName) {
        return outputDirectory.resolve(tableName + "_insert.sql");
    }

    @Override
    public boolean tableExists(String tableName) {
        return delegate == null || delegate.tableExists(tableName);
    }

    @Override
    public BatchWriteResult writeBatch(String tableName, List<String> columns, List<List<Object>> rows) {
        String prefix = "INSERT INTO " + tableName + " (" + String.join(", ", columns) + ") VALUES (";
        List<String> statements = pending.computeIfAbsent(tableName, t -> new ArrayList<>());
        for (List<Object> row : rows) {
            statements.add(prefix + row.stream().map(dialect::literal).collect(Collectors.joining(", ")) + ");");
        }
        return BatchWriteResult.success(rows.size());
    }

    @Override
    public void commit() {
        for (Map.Entry<String, List<String>> entry : pending.entrySet()) {
            append(entry.getKey(), entry.getValue());
        }
        pending.clear();
    }

    @Override
    public void rollback() {
        pending.clear();
    }

    @Override
    public void executeDdl(String sql) {
        if (delegate != null) {
            delegate.executeDdl(sql);
        }
    }

    @Override
    public void close() {
        pending.clear();
        if (delegate != null) {
            delegate.close();
        }
    }

    private void append(String tableName, List<String> statements) {
        if (statements.isEmpty()) {
            return;
        }
        Path script = scriptPath(outputDirectory, tableName);
        try {
            Files.createDirectories(outputDirectory);
            boolean first;
            synchronized (startedScripts) {
                first = startedScripts.add(tableName);
            }
            List<String> lines = new ArrayList<>();
            if (first) {
                lines.add("-- Generated INSERT statements for " + tableName);
                lines.add("-- Generated at: " + LocalDateTime.now());
                lines.add("");
            }
            lines.addAll(statements);
            if (first) {
                Files.write(script, lines, StandardCharsets.UTF_8);
            } else {
                Files.write(script, lines, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            log.debug("Wrote {} statements to {}", statements.size(), script);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write SQL script " + script, e);
        }
    }
}
