package com.example.importer.config;

import com.example.importer.header.HeaderDetectionConfig;
import com.example.importer.model.SchemaDocument;
import com.example.importer.util.SqlIdentifierValidator;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Immutable settings of one import run: file-based configuration with command line overrides applied.
 * Core operations receive it as an argument and never read global state.
 */
@Value
@Builder(toBuilder = true)
public class ImportRunConfig {

    public static final int MIN_BATCH_SIZE = 1;
    public static final int MAX_BATCH_SIZE = 10_000;
    public static final int MAX_RETRIES_LIMIT = 10;

    Path dataFolder;
    Path ddlFolder;
    @Builder.Default
    List<String> tables = List.of();
    boolean keepDateSuffix;
    boolean dryRun;
    boolean createSql;

    @Builder.Default
    int batchSize = 1000;
    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    long retryBackoffMs = 500;
    @Builder.Default
    boolean autoCommit = true;
    boolean createTableIfNotExists;
    @Builder.Default
    int parallelism = 1;
    boolean strictRowShape;

    @Builder.Default
    HeaderDetectionConfig headerDetection = HeaderDetectionConfig.auto();
    @Builder.Default
    Set<String> auditColumns = SchemaDocument.DEFAULT_AUDIT_COLUMNS;
    @Builder.Default
    Path outputDirectory = Path.of("output");

    /**
     * @throws ConfigException on the first invalid setting found
     */
    public ImportRunConfig validate() {
        if (dataFolder == null) {
            throw new ConfigException("--datafolder is required");
        }
        if (!Files.isDirectory(dataFolder)) {
            throw new ConfigException("Data folder does not exist: " + dataFolder);
        }
        if (ddlFolder != null && !Files.isDirectory(ddlFolder)) {
            throw new ConfigException("DDL folder does not exist: " + ddlFolder);
        }
        if (batchSize < MIN_BATCH_SIZE || batchSize > MAX_BATCH_SIZE) {
            throw new ConfigException("batch-size must be between " + MIN_BATCH_SIZE + " and " + MAX_BATCH_SIZE
                    + ", got " + batchSize);
        }
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new ConfigException("max-retries must be between 0 and " + MAX_RETRIES_LIMIT + ", got " + maxRetries);
        }
        if (retryBackoffMs < 0) {
            throw new ConfigException("retry-backoff-ms must not be negative, got " + retryBackoffMs);
        }
        if (parallelism < 1) {
            throw new ConfigException("parallelism must be at least 1, got " + parallelism);
        }
        for (String table : tables) {
            if (!SqlIdentifierValidator.isValid(table.trim())) {
                throw new ConfigException("Invalid table name: '" + table + "'");
            }
        }
        return this;
    }
}
