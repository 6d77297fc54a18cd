package com.example.importer.step;

import com.example.importer.config.ConfigException;
import com.example.importer.config.ImportRunConfig;
import com.example.importer.config.ImporterProperties;
import org.springframework.batch.core.JobParameters;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Job parameter names of {@code dataImportJob} and their translation into an {@link ImportRunConfig}.
 */
public final class ImportJobParameters {

    public static final String DATA_FOLDER = "dataFolder";
    public static final String DDL_FOLDER = "ddlFolder";
    public static final String TABLES = "tables";
    public static final String KEEP_DATE_SUFFIX = "keepDateSuffix";
    public static final String DRY_RUN = "dryRun";
    public static final String CREATE_SQL = "createSql";
    public static final String BATCH_SIZE = "batchSize";
    public static final String MAX_RETRIES = "maxRetries";
    public static final String RUN_ID = "runId";

    public static final String SCHEMA_CATALOG_KEY = "schemaCatalog";
    public static final String RUN_SUMMARY_KEY = "importSummary";

    private ImportJobParameters() {
    }

    public static ImportRunConfig toRunConfig(JobParameters parameters, ImporterProperties properties) {
        return toRunConfig(parameters.getParameters().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().getValue())), properties);
    }

    /**
     * @throws ConfigException when a parameter or a configured setting is invalid
     */
    public static ImportRunConfig toRunConfig(Map<String, Object> parameters, ImporterProperties properties) {
        ImportRunConfig.ImportRunConfigBuilder builder = properties.toRunConfigBuilder();
        String dataFolder = string(parameters, DATA_FOLDER);
        if (!StringUtils.hasText(dataFolder)) {
            throw new ConfigException("--datafolder is required");
        }
        builder.dataFolder(Path.of(dataFolder));
        String ddlFolder = string(parameters, DDL_FOLDER);
        if (StringUtils.hasText(ddlFolder)) {
            builder.ddlFolder(Path.of(ddlFolder));
        }
        builder.tables(tableList(string(parameters, TABLES)));
        builder.keepDateSuffix(flag(parameters, KEEP_DATE_SUFFIX));
        builder.dryRun(flag(parameters, DRY_RUN));
        builder.createSql(flag(parameters, CREATE_SQL));
        Integer batchSize = number(parameters, BATCH_SIZE);
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        Integer maxRetries = number(parameters, MAX_RETRIES);
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        return builder.build().validate();
    }

    static List<String> tableList(String value) {
        if (!StringUtils.hasText(value)) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(name -> name.toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    private static String string(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        return value == null ? null : value.toString();
    }

    private static boolean flag(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static Integer number(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        long parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(key + " must be a whole number, got '" + value + "'", e);
            }
        }
        try {
            return Math.toIntExact(parsed);
        } catch (ArithmeticException e) {
            throw new ConfigException(key + " is out of range, got " + value, e);
        }
    }
}
