package com.example.importer.step;

import com.example.importer.config.ImportRunConfig;
import com.example.importer.config.ImporterProperties;
import com.example.importer.schema.SchemaCatalog;
import com.example.importer.schema.SchemaCatalogLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

/**
 * Validates the run configuration and loads the DDL folder into the job context. A bad configuration fails the
 * job here, before any data file is touched.
 */
@Slf4j
public class SchemaCatalogTasklet implements Tasklet {

    private final SchemaCatalogLoader loader;
    private final ImporterProperties properties;

    public SchemaCatalogTasklet(SchemaCatalogLoader loader, ImporterProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        ImportRunConfig config = ImportJobParameters.toRunConfig(
                chunkContext.getStepContext().getStepExecution().getJobParameters(), properties);

        SchemaCatalog catalog = SchemaCatalog.empty();
        if (config.getDdlFolder() != null) {
            log.info("Loading DDL documents from {}", config.getDdlFolder());
            catalog = loader.load(config.getDdlFolder(), config.getAuditColumns());
        } else {
            log.info("No DDL folder given, headerless files cannot be mapped");
        }

        chunkContext.getStepContext().getStepExecution().getJobExecution()
                .getExecutionContext().put(ImportJobParameters.SCHEMA_CATALOG_KEY, catalog);
        return RepeatStatus.FINISHED;
    }
}
