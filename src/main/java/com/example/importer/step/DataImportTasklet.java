package com.example.importer.step;

import com.example.importer.config.ImportRunConfig;
import com.example.importer.config.ImporterProperties;
import com.example.importer.engine.ImportRunner;
import com.example.importer.model.ImportRunSummary;
import com.example.importer.schema.SchemaCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;

@Slf4j
public class DataImportTasklet implements Tasklet {

    public static final String COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";

    private final ImportRunner runner;
    private final ImporterProperties properties;

    public DataImportTasklet(ImportRunner runner, ImporterProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        ImportRunConfig config = ImportJobParameters.toRunConfig(
                chunkContext.getStepContext().getStepExecution().getJobParameters(), properties);
        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution().getJobExecution()
                .getExecutionContext();
        SchemaCatalog catalog = (SchemaCatalog) jobContext.get(ImportJobParameters.SCHEMA_CATALOG_KEY);
        if (catalog == null) {
            catalog = SchemaCatalog.empty();
        }

        ImportRunSummary summary = runner.run(config, catalog);
        jobContext.put(ImportJobParameters.RUN_SUMMARY_KEY, summary);
        summary.getResults().forEach(result -> log.info("  {}", result));

        if (summary.hasFailures()) {
            contribution.setExitStatus(new ExitStatus(COMPLETED_WITH_FAILURES,
                    "One or more files failed or were only partially imported"));
        }
        return RepeatStatus.FINISHED;
    }
}
