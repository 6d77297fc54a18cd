package com.example.importer.step;

import com.example.importer.config.ConfigException;
import com.example.importer.config.ImportRunConfig;
import com.example.importer.config.ImporterProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportJobParametersTest {

    @TempDir
    Path dataFolder;

    private final ImporterProperties properties = new ImporterProperties();

    @Test
    void commandLineValuesOverrideProperties() {
        properties.getImportSettings().setBatchSize(500);
        JobParameters parameters = new JobParametersBuilder()
                .addString(ImportJobParameters.DATA_FOLDER, dataFolder.toString())
                .addString(ImportJobParameters.TABLES, " users, orders ,")
                .addString(ImportJobParameters.DRY_RUN, "true")
                .addString(ImportJobParameters.KEEP_DATE_SUFFIX, "false")
                .addString(ImportJobParameters.BATCH_SIZE, "25")
                .addLong(ImportJobParameters.RUN_ID, 1L)
                .toJobParameters();

        ImportRunConfig config = ImportJobParameters.toRunConfig(parameters, properties);

        assertThat(config.getDataFolder()).isEqualTo(dataFolder);
        assertThat(config.getTables()).containsExactly("USERS", "ORDERS");
        assertThat(config.isDryRun()).isTrue();
        assertThat(config.isKeepDateSuffix()).isFalse();
        assertThat(config.isCreateSql()).isFalse();
        assertThat(config.getBatchSize()).isEqualTo(25);
        assertThat(config.getDdlFolder()).isNull();
    }

    @Test
    void propertiesApplyWhenNoOverrideIsGiven() {
        properties.getImportSettings().setMaxRetries(7);

        ImportRunConfig config = ImportJobParameters.toRunConfig(
                Map.of(ImportJobParameters.DATA_FOLDER, dataFolder.toString()), properties);

        assertThat(config.getMaxRetries()).isEqualTo(7);
        assertThat(config.getBatchSize()).isEqualTo(1000);
    }

    @Test
    void dataFolderIsRequired() {
        assertThatThrownBy(() -> ImportJobParameters.toRunConfig(Map.of(), properties))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("--datafolder");
    }

    @Test
    void nonNumericBatchSizeIsAConfigurationError() {
        Map<String, Object> parameters = Map.of(
                ImportJobParameters.DATA_FOLDER, dataFolder.toString(),
                ImportJobParameters.BATCH_SIZE, "lots");

        assertThatThrownBy(() -> ImportJobParameters.toRunConfig(parameters, properties))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("batchSize");
    }

    @Test
    void batchSizeBeyondIntRangeIsNotWrappedAround() {
        Map<String, Object> parameters = Map.of(
                ImportJobParameters.DATA_FOLDER, dataFolder.toString(),
                ImportJobParameters.BATCH_SIZE, "4294967297");

        assertThatThrownBy(() -> ImportJobParameters.toRunConfig(parameters, properties))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("batchSize")
                .hasMessageContaining("out of range");
    }

    @Test
    void outOfRangeRetriesAreRejected() {
        Map<String, Object> parameters = Map.of(
                ImportJobParameters.DATA_FOLDER, dataFolder.toString(),
                ImportJobParameters.MAX_RETRIES, 11L);

        assertThatThrownBy(() -> ImportJobParameters.toRunConfig(parameters, properties))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("max-retries");
    }

    @Test
    void blankTableListMeansDerivedNames() {
        assertThat(ImportJobParameters.tableList(null)).isEmpty();
        assertThat(ImportJobParameters.tableList("  ")).isEmpty();
        assertThat(ImportJobParameters.tableList("a")).containsExactly("A");
    }
}
