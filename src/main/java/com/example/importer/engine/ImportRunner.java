package com.example.importer.engine;

import com.example.importer.config.ImportRunConfig;
import com.example.importer.dialect.DatabaseDialect;
import com.example.importer.gateway.DatabaseGateway;
import com.example.importer.gateway.DatabaseGatewayFactory;
import com.example.importer.gateway.DryRunGateway;
import com.example.importer.gateway.SqlScriptGateway;
import com.example.importer.model.DataFile;
import com.example.importer.model.ImportResult;
import com.example.importer.model.ImportRunSummary;
import com.example.importer.model.ImportStatus;
import com.example.importer.model.SchemaDocument;
import com.example.importer.model.TableTarget;
import com.example.importer.naming.TableNameResolver;
import com.example.importer.reader.DataFileScanner;
import com.example.importer.reader.FileReadException;
import com.example.importer.schema.SchemaCatalog;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the Batch Import Engine over every file of a data folder.
 * <p>
 * Files are grouped by target table. Each group is imported in file order by a single worker holding its own
 * gateway, so no two workers ever write the same table. File-level failures are recorded and the run moves on;
 * failures to open a database connection abort the run.
 */
@Slf4j
public class ImportRunner {

    private final DataFileScanner scanner;
    private final TableNameResolver tableNameResolver;
    private final BatchImportEngine engine;
    private final DatabaseGatewayFactory gatewayFactory;
    private final DatabaseDialect dialect;

    public ImportRunner(DataFileScanner scanner, TableNameResolver tableNameResolver, BatchImportEngine engine,
                        DatabaseGatewayFactory gatewayFactory, DatabaseDialect dialect) {
        this.scanner = scanner;
        this.tableNameResolver = tableNameResolver;
        this.engine = engine;
        this.gatewayFactory = gatewayFactory;
        this.dialect = dialect;
    }

    public ImportRunSummary run(ImportRunConfig config, SchemaCatalog catalog) {
        ImportRunSummary summary = new ImportRunSummary();
        summary.addSchemaErrors(catalog.getErrors());

        Map<String, List<PlannedFile>> groups = plan(config, catalog);
        Set<String> startedScripts = Collections.synchronizedSet(new HashSet<>());

        if (config.getParallelism() <= 1 || groups.size() <= 1) {
            groups.values().forEach(group -> importGroup(group, config, summary, startedScripts));
        } else {
            runInParallel(groups, config, summary, startedScripts);
        }

        log.info("Import finished: {} files, {} succeeded, {} partially failed, {} failed, {} dry run; rows attempted={}, committed={}, failed={}",
                summary.getResults().size(),
                summary.count(ImportStatus.SUCCEEDED),
                summary.count(ImportStatus.PARTIALLY_FAILED),
                summary.count(ImportStatus.FAILED),
                summary.count(ImportStatus.SKIPPED_DRY_RUN),
                summary.totalRowsAttempted(), summary.totalRowsCommitted(), summary.totalRowsFailed());
        if (!summary.getSchemaErrors().isEmpty()) {
            log.warn("{} DDL documents were rejected: {}", summary.getSchemaErrors().size(), summary.getSchemaErrors());
        }
        return summary;
    }

    /**
     * Resolves the table of every scanned file. Explicit table names apply to files by position; files beyond
     * the given names are skipped.
     */
    Map<String, List<PlannedFile>> plan(ImportRunConfig config, SchemaCatalog catalog) {
        List<Path> files = scanner.scan(config.getDataFolder());
        List<String> overrides = config.getTables();
        Map<String, List<PlannedFile>> groups = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            Path path = files.get(i);
            if (!overrides.isEmpty() && i >= overrides.size()) {
                log.info("Skipping {}: no table name given for it", path.getFileName());
                continue;
            }
            String override = overrides.isEmpty() ? null : overrides.get(i);
            TableTarget target = tableNameResolver.resolve(DataFileScanner.stemOf(path), config.isKeepDateSuffix(), override);
            Optional<SchemaDocument> schema = catalog.match(target);
            if (config.getDdlFolder() != null && catalog.candidates(target).isEmpty()) {
                log.warn("No DDL document in {} declares table {} (file {}), importing without one",
                        config.getDdlFolder(), target.getTableName(), path.getFileName());
            }
            log.info("{} -> {}{}{}", path.getFileName(), target.getTableName(),
                    target.isExplicitOverride() ? " (explicit)" : "",
                    schema.map(doc -> ", DDL " + doc.getSourcePath()).orElse(""));
            groups.computeIfAbsent(target.getTableName(), t -> new ArrayList<>()).add(new PlannedFile(path, target, schema));
        }
        return groups;
    }

    private void runInParallel(Map<String, List<PlannedFile>> groups, ImportRunConfig config,
                               ImportRunSummary summary, Set<String> startedScripts) {
        int threads = Math.min(config.getParallelism(), groups.size());
        log.info("Importing {} tables on {} threads", groups.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (List<PlannedFile> group : groups.values()) {
                futures.add(executor.submit(() -> importGroup(group, config, summary, startedScripts)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Import interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Import worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void importGroup(List<PlannedFile> group, ImportRunConfig config, ImportRunSummary summary,
                             Set<String> startedScripts) {
        try (DatabaseGateway gateway = openGateway(config, startedScripts)) {
            for (PlannedFile planned : group) {
                summary.add(importOne(planned, config, gateway));
            }
        }
    }

    private ImportResult importOne(PlannedFile planned, ImportRunConfig config, DatabaseGateway gateway) {
        String fileName = planned.getPath().getFileName().toString();
        String table = planned.getTarget().getTableName();
        try {
            DataFile file = scanner.read(planned.getPath());
            return engine.importFile(file, planned.getTarget(), planned.getSchema(), config, gateway);
        } catch (TableNotFoundException | ColumnMismatchException | FileReadException e) {
            log.error("Import of {} into {} failed: {}", fileName, table, e.getMessage());
            return ImportResult.failed(fileName, table, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Import of {} into {} failed on the database: {}", fileName, table, e.getMessage());
            rollbackAfterFailure(gateway, fileName);
            return ImportResult.failed(fileName, table, e.getMessage());
        }
    }

    private void rollbackAfterFailure(DatabaseGateway gateway, String fileName) {
        try {
            gateway.rollback();
        } catch (DataAccessException e) {
            log.error("Rollback after failed import of {} failed: {}", fileName, e.getMessage());
        }
    }

    private DatabaseGateway openGateway(ImportRunConfig config, Set<String> startedScripts) {
        if (config.isDryRun()) {
            return config.isCreateSql()
                    ? new SqlScriptGateway(dialect, config.getOutputDirectory(), null, startedScripts)
                    : new DryRunGateway();
        }
        DatabaseGateway database = gatewayFactory.open();
        return config.isCreateSql()
                ? new SqlScriptGateway(dialect, config.getOutputDirectory(), database, startedScripts)
                : database;
    }

    @Value
    static class PlannedFile {
        Path path;
        TableTarget target;
        Optional<SchemaDocument> schema;
    }
}
