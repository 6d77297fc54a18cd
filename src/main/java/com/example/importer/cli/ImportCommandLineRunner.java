package com.example.importer.cli;

import com.example.importer.step.DataImportTasklet;
import com.example.importer.step.ImportJobParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line entry point:
 * <pre>
 * import --datafolder=DIR [--table=A,B] [--ddl-folder=DIR] [--keep-date-suffix] [--dry-run] [--create-sql]
 *        [--batch-size=N] [--max-retries=N]
 * </pre>
 * Exit code 0 when every file imported cleanly, 1 when some file failed or partially failed, 2 when the run
 * itself could not complete.
 */
@Slf4j
@Component
public class ImportCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String IMPORT_COMMAND = "import";

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_FAILURES = 1;
    static final int EXIT_RUN_FAILED = 2;

    private final JobLauncher jobLauncher;
    private final Job dataImportJob;
    private int exitCode = EXIT_OK;

    public ImportCommandLineRunner(JobLauncher jobLauncher, Job dataImportJob) {
        this.jobLauncher = jobLauncher;
        this.dataImportJob = dataImportJob;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.info("No command given. Usage: import --datafolder=DIR [--table=A,B] [--ddl-folder=DIR] "
                    + "[--keep-date-suffix] [--dry-run] [--create-sql] [--batch-size=N] [--max-retries=N]");
            return;
        }
        if (!IMPORT_COMMAND.equals(commands.get(0))) {
            log.error("Unknown command '{}', expected '{}'", commands.get(0), IMPORT_COMMAND);
            exitCode = EXIT_RUN_FAILED;
            return;
        }

        JobExecution execution = jobLauncher.run(dataImportJob, toJobParameters(args));
        exitCode = exitCodeOf(execution);
        log.info("Job {} finished with status {} / {}", execution.getJobInstance().getJobName(),
                execution.getStatus(), execution.getExitStatus().getExitCode());
    }

    static JobParameters toJobParameters(ApplicationArguments args) {
        JobParametersBuilder builder = new JobParametersBuilder();
        putString(builder, args, "datafolder", ImportJobParameters.DATA_FOLDER);
        putString(builder, args, "ddl-folder", ImportJobParameters.DDL_FOLDER);
        putString(builder, args, "table", ImportJobParameters.TABLES);
        putString(builder, args, "batch-size", ImportJobParameters.BATCH_SIZE);
        putString(builder, args, "max-retries", ImportJobParameters.MAX_RETRIES);
        builder.addString(ImportJobParameters.KEEP_DATE_SUFFIX, String.valueOf(args.containsOption("keep-date-suffix")));
        builder.addString(ImportJobParameters.DRY_RUN, String.valueOf(args.containsOption("dry-run")));
        builder.addString(ImportJobParameters.CREATE_SQL, String.valueOf(args.containsOption("create-sql")));
        builder.addLong(ImportJobParameters.RUN_ID, System.currentTimeMillis());
        return builder.toJobParameters();
    }

    private static void putString(JobParametersBuilder builder, ApplicationArguments args, String option, String key) {
        List<String> values = args.getOptionValues(option);
        if (values != null && !values.isEmpty()) {
            builder.addString(key, String.join(",", values));
        }
    }

    static int exitCodeOf(JobExecution execution) {
        if (execution.getStatus() != BatchStatus.COMPLETED) {
            return EXIT_RUN_FAILED;
        }
        if (DataImportTasklet.COMPLETED_WITH_FAILURES.equals(execution.getExitStatus().getExitCode())) {
            return EXIT_FILE_FAILURES;
        }
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
