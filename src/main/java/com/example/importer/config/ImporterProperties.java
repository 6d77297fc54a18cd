package com.example.importer.config;

import com.example.importer.header.HeaderDetectionConfig;
import com.example.importer.model.SchemaDocument;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * File-based settings under the {@code importer} prefix. Relaxed binding also accepts the snake_case keys
 * ({@code importer.import_settings.batch_size}).
 */
@Data
@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

    private ImportSettings importSettings = new ImportSettings();
    private HeaderDetection headerDetection = new HeaderDetection();
    private Schema schema = new Schema();
    private Files files = new Files();
    private Output output = new Output();
    private Database database = new Database();

    @Data
    public static class ImportSettings {
        private int batchSize = 1000;
        private int maxRetries = 3;
        private long retryBackoffMs = 500;
        private boolean autoCommit = true;
        private boolean createTableIfNotExists = false;
        private int parallelism = 1;
        private boolean strictRowShape = false;
    }

    @Data
    public static class HeaderDetection {
        private String headerKeywords = "";
        private String headerDetectionMode = "auto";
        private String matchPolicy = "exact";
    }

    @Data
    public static class Schema {
        private List<String> auditColumns = new ArrayList<>(SchemaDocument.DEFAULT_AUDIT_COLUMNS);
    }

    @Data
    public static class Files {
        private String encoding = "UTF-8";
        private List<String> extensions = new ArrayList<>(List.of("csv", "xls", "xlsx"));
    }

    @Data
    public static class Output {
        private String directory = "output";
    }

    @Data
    public static class Database {
        private String type = "oracle";
    }

    /**
     * Builder pre-filled from these properties; callers add the command line values.
     *
     * @throws ConfigException when the header detection settings cannot be parsed
     */
    public ImportRunConfig.ImportRunConfigBuilder toRunConfigBuilder() {
        HeaderDetectionConfig detection;
        try {
            detection = HeaderDetectionConfig.of(headerDetection.getHeaderKeywords(),
                    headerDetection.getHeaderDetectionMode(), headerDetection.getMatchPolicy());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid header detection settings: " + e.getMessage(), e);
        }
        return ImportRunConfig.builder()
                .batchSize(importSettings.getBatchSize())
                .maxRetries(importSettings.getMaxRetries())
                .retryBackoffMs(importSettings.getRetryBackoffMs())
                .autoCommit(importSettings.isAutoCommit())
                .createTableIfNotExists(importSettings.isCreateTableIfNotExists())
                .parallelism(importSettings.getParallelism())
                .strictRowShape(importSettings.isStrictRowShape())
                .headerDetection(detection)
                .auditColumns(Set.copyOf(schema.getAuditColumns()))
                .outputDirectory(Path.of(output.getDirectory()));
    }
}
