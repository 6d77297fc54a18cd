package com.example.importer.engine;

import com.example.importer.config.ImportRunConfig;
import com.example.importer.dialect.DatabaseDialect;
import com.example.importer.gateway.BatchWriteResult;
import com.example.importer.gateway.DatabaseGateway;
import com.example.importer.header.HeaderDecision;
import com.example.importer.header.HeaderDetector;
import com.example.importer.model.DataFile;
import com.example.importer.model.EffectiveColumnList;
import com.example.importer.model.ImportBatch;
import com.example.importer.model.ImportResult;
import com.example.importer.model.RowFailure;
import com.example.importer.model.SchemaDocument;
import com.example.importer.model.TableTarget;
import com.example.importer.processor.RowValueConverter;
import com.example.importer.processor.ValueConversionException;
import com.example.importer.util.IdentifierSanitizer;
import com.example.importer.util.SqlIdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Imports one {@link DataFile} into its target table in batches.
 * <p>
 * Row-level problems (wrong cell count, unconvertible values) are recorded and the row is skipped, unless
 * {@code strictRowShape} is set, in which case a wrong cell count aborts the file. Batches are written in row
 * order. Transient write errors are retried with the same rows; fatal ones fail the batch and the file moves on,
 * except when {@code autoCommit} is off, where the first failed batch rolls back the whole file.
 * <p>
 * A dry run never touches the gateway and always ends as skipped; mapping problems it finds are reported as
 * messages. When it is combined with SQL generation the caller hands in a script-only gateway and the rendered
 * script is the sole output.
 */
@Slf4j
public class BatchImportEngine {

    static final int DUPLICATE_DETECTION_MIN_BATCH = 10;

    private static final List<String> DUPLICATE_SIGNATURES = List.of(
            "ora-00001",
            "unique constraint",
            "unique key",
            "duplicate key",
            "primary key violation");

    private final HeaderDetector headerDetector;
    private final DatabaseDialect dialect;

    public BatchImportEngine(HeaderDetector headerDetector, DatabaseDialect dialect) {
        this.headerDetector = headerDetector;
        this.dialect = dialect;
    }

    /**
     * @throws TableNotFoundException   when the table is missing and cannot be created
     * @throws ColumnMismatchException  when no column mapping can be established
     */
    public ImportResult importFile(DataFile file, TableTarget target, Optional<SchemaDocument> schema,
                                   ImportRunConfig config, DatabaseGateway gateway) {
        String table = target.getTableName();
        FileImport run = new FileImport(file.getFileName(), table);
        log.info("Importing {} into {}{}", file.getFileName(), table, config.isDryRun() ? " (dry run)" : "");

        try {
            run.moveTo(FileImportState.VALIDATING);
            if (!config.isDryRun()) {
                ensureTableExists(file, target, schema, config, gateway);
            }
            if (file.isEmpty()) {
                log.warn("File {} has no rows, nothing to import into {}", file.getFileName(), table);
                run.result.addMessage("file has no rows");
                return run.finish(config.isDryRun());
            }

            EffectiveColumnList columns = resolveColumns(file, target, schema, config);
            int firstDataRow = columns.getSource() == EffectiveColumnList.Source.HEADER_ROW ? 1 : 0;
            List<List<Object>> dataRows = file.getRows().subList(firstDataRow, file.getRows().size());
            run.result.recordAttempted(dataRows.size());
            log.info("File {} maps {} columns from {} onto {}: {}", file.getFileName(), columns.size(),
                    columns.getSource() == EffectiveColumnList.Source.HEADER_ROW ? "its header row" : "the DDL",
                    table, columns.getColumns());

            List<List<Object>> validRows = validateRows(file, target, schema, columns, dataRows, firstDataRow, config, run);
            List<ImportBatch> batches = partition(validRows, config.getBatchSize());

            if (config.isDryRun()) {
                renderDryRun(table, columns, batches, config, gateway);
                return run.finish(true);
            }

            run.moveTo(FileImportState.WRITING);
            writeBatches(file, table, columns, batches, config, gateway, run);
            return run.finish(false);
        } catch (ColumnMismatchException e) {
            if (config.isDryRun()) {
                log.warn("Dry run: {}", e.getMessage());
                run.result.addMessage(e.getMessage());
                return run.finish(true);
            }
            run.moveTo(FileImportState.FAILED);
            throw e;
        } catch (RuntimeException e) {
            run.moveTo(FileImportState.FAILED);
            throw e;
        }
    }

    private void ensureTableExists(DataFile file, TableTarget target, Optional<SchemaDocument> schema,
                                   ImportRunConfig config, DatabaseGateway gateway) {
        String table = target.getTableName();
        if (gateway.tableExists(table)) {
            return;
        }
        if (config.isCreateTableIfNotExists() && schema.isPresent()) {
            String ddl = dialect.createTableSql(schema.get());
            log.info("Table {} does not exist, creating it from {}", table, schema.get().getSourcePath());
            gateway.executeDdl(ddl);
            return;
        }
        throw new TableNotFoundException(table, file.getFileName(),
                schema.map(dialect::createTableSql).orElse(null),
                schema.map(SchemaDocument::getSourcePath).orElse(null));
    }

    EffectiveColumnList resolveColumns(DataFile file, TableTarget target, Optional<SchemaDocument> schema,
                                       ImportRunConfig config) {
        HeaderDecision decision = headerDetector.detect(file.firstRowAsText(), config.getHeaderDetection());
        if (decision == HeaderDecision.HEADER_PRESENT) {
            List<String> columns = headerColumns(file, target, file.firstRowAsText());
            schema.ifPresent(doc -> requireDeclared(file, target, doc, columns));
            return new EffectiveColumnList(columns, EffectiveColumnList.Source.HEADER_ROW);
        }
        SchemaDocument doc = schema.orElseThrow(() -> new ColumnMismatchException(target.getTableName(),
                file.getFileName(), "the file has no header row and no DDL document declares the table"));
        List<String> columns = doc.dataColumnNames();
        if (columns.isEmpty()) {
            throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                    doc.getSourcePath() + " declares only audit columns");
        }
        return new EffectiveColumnList(columns, EffectiveColumnList.Source.SCHEMA);
    }

    private List<String> headerColumns(DataFile file, TableTarget target, List<String> cells) {
        List<String> columns = new ArrayList<>(cells.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < cells.size(); i++) {
            String name = IdentifierSanitizer.columnName(cells.get(i));
            if (name.isEmpty()) {
                throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                        "header cell " + (i + 1) + " is blank");
            }
            if (!SqlIdentifierValidator.isValid(name)) {
                throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                        "header '" + cells.get(i) + "' is not a valid column name");
            }
            if (!seen.add(name)) {
                throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                        "header column " + name + " appears more than once");
            }
            columns.add(name);
        }
        return columns;
    }

    private void requireDeclared(DataFile file, TableTarget target, SchemaDocument doc, List<String> columns) {
        List<String> unknown = new ArrayList<>();
        for (String column : columns) {
            if (doc.findColumn(column).isEmpty()) {
                unknown.add(column);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                    "columns " + unknown + " are not declared in " + doc.getSourcePath());
        }
    }

    private List<List<Object>> validateRows(DataFile file, TableTarget target, Optional<SchemaDocument> schema,
                                            EffectiveColumnList columns, List<List<Object>> dataRows,
                                            int firstDataRow, ImportRunConfig config, FileImport run) {
        RowValueConverter converter = new RowValueConverter(columns.getColumns(), schema);
        List<List<Object>> valid = new ArrayList<>(dataRows.size());
        for (int i = 0; i < dataRows.size(); i++) {
            int rowNumber = firstDataRow + i + 1;
            List<Object> row = dataRows.get(i);
            if (row.size() != columns.size()) {
                String reason = "row has " + row.size() + " cells, expected " + columns.size();
                if (config.isStrictRowShape()) {
                    throw new ColumnMismatchException(target.getTableName(), file.getFileName(),
                            "row " + rowNumber + ": " + reason);
                }
                rowFailure(file, run, rowNumber, reason);
                continue;
            }
            try {
                valid.add(converter.convert(row));
            } catch (ValueConversionException e) {
                rowFailure(file, run, rowNumber, e.getMessage());
            }
        }
        return valid;
    }

    private void rowFailure(DataFile file, FileImport run, int rowNumber, String reason) {
        log.warn("{} row {}: {}", file.getFileName(), rowNumber, reason);
        run.result.recordRowFailure(new RowFailure(rowNumber, reason));
    }

    static List<ImportBatch> partition(List<List<Object>> rows, int batchSize) {
        List<ImportBatch> batches = new ArrayList<>();
        for (int start = 0, number = 1; start < rows.size(); start += batchSize, number++) {
            int end = Math.min(start + batchSize, rows.size());
            batches.add(new ImportBatch(number, start, List.copyOf(rows.subList(start, end))));
        }
        return batches;
    }

    private void renderDryRun(String table, EffectiveColumnList columns, List<ImportBatch> batches,
                              ImportRunConfig config, DatabaseGateway gateway) {
        for (ImportBatch batch : batches) {
            log.debug("Dry run: batch {} of {} validated ({} rows)", batch.getNumber(), table, batch.size());
            if (config.isCreateSql()) {
                gateway.writeBatch(table, columns.getColumns(), batch.getRows());
            }
        }
        if (config.isCreateSql()) {
            gateway.commit();
        }
    }

    private void writeBatches(DataFile file, String table, EffectiveColumnList columns, List<ImportBatch> batches,
                              ImportRunConfig config, DatabaseGateway gateway, FileImport run) {
        ImportResult result = run.result;
        int uncommittedRows = 0;
        String abortReason = null;

        for (ImportBatch batch : batches) {
            if (abortReason != null) {
                result.recordBatchFailed(batch.size(), null);
                continue;
            }
            BatchWriteResult outcome = writeWithRetry(table, columns, batch, config, gateway, run);
            if (outcome.isSuccess()) {
                if (!config.isAutoCommit()) {
                    result.recordBatchWritten(batch.size());
                    uncommittedRows += batch.size();
                } else if (commit(gateway, file, table)) {
                    result.recordBatchWritten(batch.size());
                } else {
                    rollbackQuietly(gateway, file, table);
                    result.recordBatchFailed(batch.size(), "batch " + batch.getNumber() + ": commit failed");
                }
                log.debug("{}: batch {} written to {} ({} rows)", file.getFileName(), batch.getNumber(), table,
                        batch.size());
                continue;
            }

            String message = "batch " + batch.getNumber() + " (rows from " + (batch.getFirstRowIndex() + 1) + "): "
                    + outcome.getMessage();
            log.warn("{} -> {}: {} failed: {}", file.getFileName(), table, outcome.getOutcome(), message);
            result.recordBatchFailed(batch.size(), message);

            if (isDuplicateImport(outcome, batch)) {
                abortReason = "probable re-import of " + file.getFileName() + " into " + table
                        + ", remaining batches skipped";
                log.warn("{}", abortReason);
                result.markDuplicateImport(abortReason);
            }
            if (!config.isAutoCommit()) {
                rollbackQuietly(gateway, file, table);
                result.revokeCommitted(uncommittedRows, "auto-commit is off, rolled back all batches of "
                        + file.getFileName());
                uncommittedRows = 0;
                if (abortReason == null) {
                    abortReason = "rolled back";
                }
            }
        }

        if (!config.isAutoCommit() && abortReason == null && uncommittedRows > 0) {
            if (!commit(gateway, file, table)) {
                rollbackQuietly(gateway, file, table);
                result.revokeCommitted(uncommittedRows, "commit of " + file.getFileName() + " failed");
            }
        }
    }

    private BatchWriteResult writeWithRetry(String table, EffectiveColumnList columns, ImportBatch batch,
                                            ImportRunConfig config, DatabaseGateway gateway, FileImport run) {
        int retries = 0;
        while (true) {
            BatchWriteResult outcome = gateway.writeBatch(table, columns.getColumns(), batch.getRows());
            if (outcome.getOutcome() != BatchWriteResult.Outcome.TRANSIENT_ERROR || retries >= config.getMaxRetries()) {
                return outcome;
            }
            retries++;
            run.moveTo(FileImportState.RETRYING);
            run.result.recordRetry(batch.getNumber());
            log.warn("Transient error on batch {} of {}, retry {}/{}: {}", batch.getNumber(), table, retries,
                    config.getMaxRetries(), outcome.getMessage());
            if (!backoff(config.getRetryBackoffMs())) {
                run.moveTo(FileImportState.WRITING);
                return outcome;
            }
            run.moveTo(FileImportState.WRITING);
        }
    }

    private boolean backoff(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry, giving up on the batch");
            return false;
        }
    }

    private boolean isDuplicateImport(BatchWriteResult outcome, ImportBatch batch) {
        if (outcome.getOutcome() != BatchWriteResult.Outcome.FATAL_ERROR
                || batch.size() < DUPLICATE_DETECTION_MIN_BATCH
                || outcome.getMessage() == null) {
            return false;
        }
        String message = outcome.getMessage().toLowerCase(Locale.ROOT);
        return DUPLICATE_SIGNATURES.stream().anyMatch(message::contains);
    }

    private boolean commit(DatabaseGateway gateway, DataFile file, String table) {
        try {
            gateway.commit();
            return true;
        } catch (DataAccessException e) {
            log.warn("Commit of {} into {} failed: {}", file.getFileName(), table, e.getMessage());
            return false;
        }
    }

    private void rollbackQuietly(DatabaseGateway gateway, DataFile file, String table) {
        try {
            gateway.rollback();
        } catch (DataAccessException e) {
            log.error("Rollback of {} into {} failed: {}", file.getFileName(), table, e.getMessage());
        }
    }

    private static final class FileImport {
        private final ImportResult result;
        private FileImportState state = FileImportState.PENDING;

        private FileImport(String fileName, String tableName) {
            this.result = new ImportResult(fileName, tableName);
        }

        private void moveTo(FileImportState next) {
            if (state == next) {
                return;
            }
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException("Illegal import state change " + state + " -> " + next
                        + " for " + result.getFileName());
            }
            state = next;
        }

        private ImportResult finish(boolean dryRun) {
            switch (result.finish(dryRun)) {
                case SKIPPED_DRY_RUN -> moveTo(FileImportState.SKIPPED);
                case SUCCEEDED -> moveTo(FileImportState.SUCCEEDED);
                case PARTIALLY_FAILED -> moveTo(FileImportState.PARTIALLY_FAILED);
                default -> moveTo(FileImportState.FAILED);
            }
            log.info("{}", result);
            return result;
        }
    }
}
