package com.example.importer.engine;

import com.example.importer.config.ImportRunConfig;
import com.example.importer.engine.ImportRunner.PlannedFile;
import com.example.importer.dialect.H2Dialect;
import com.example.importer.gateway.DatabaseGatewayFactory;
import com.example.importer.header.HeaderDetector;
import com.example.importer.model.ImportResult;
import com.example.importer.model.ImportRunSummary;
import com.example.importer.model.ImportStatus;
import com.example.importer.naming.DateSuffixAnalyzer;
import com.example.importer.naming.TableNameResolver;
import com.example.importer.reader.DataFileScanner;
import com.example.importer.reader.DelimitedFileReader;
import com.example.importer.schema.DdlParseException;
import com.example.importer.schema.SchemaCatalog;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ImportRunnerTest {

    @TempDir
    Path dataFolder;

    private final List<RecordingGateway> opened = Collections.synchronizedList(new ArrayList<>());
    private final DatabaseGatewayFactory factory = () -> {
        RecordingGateway gateway = new RecordingGateway().withTable("USERS").withTable("CUSTOMERS");
        opened.add(gateway);
        return gateway;
    };

    private ImportRunner runner(DatabaseGatewayFactory gatewayFactory) {
        TableNameResolver resolver = new TableNameResolver(new DateSuffixAnalyzer());
        DataFileScanner scanner = new DataFileScanner(List.of(new DelimitedFileReader()), Set.of("csv"));
        return new ImportRunner(scanner, resolver, new BatchImportEngine(new HeaderDetector(), new H2Dialect()),
                gatewayFactory, new H2Dialect());
    }

    private ImportRunConfig.ImportRunConfigBuilder config() {
        return ImportRunConfig.builder().dataFolder(dataFolder).batchSize(10).retryBackoffMs(0);
    }

    private void csv(String name, int order, String... lines) throws IOException {
        Path file = dataFolder.resolve(name);
        Files.write(file, List.of(lines));
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2025-01-01T00:00:00Z").plusSeconds(order)));
    }

    private static Map<String, ImportStatus> statuses(ImportRunSummary summary) {
        return summary.getResults().stream().collect(Collectors.toMap(ImportResult::getFileName, ImportResult::getStatus));
    }

    @Test
    void datedFilesOfOneFeedShareOneGateway() throws IOException {
        csv("users20250821.csv", 1, "ID,NAME", "1,alice", "2,bob");
        csv("users20250822.csv", 2, "ID,NAME", "3,carol");
        csv("customers.csv", 3, "ID,NAME", "10,acme");

        ImportRunSummary summary = runner(factory).run(config().build(), SchemaCatalog.empty());

        assertThat(summary.getResults()).extracting(ImportResult::getTableName)
                .containsExactly("USERS", "USERS", "CUSTOMERS");
        assertThat(summary.getResults()).allMatch(result -> result.getStatus() == ImportStatus.SUCCEEDED);
        assertThat(summary.totalRowsCommitted()).isEqualTo(4);
        assertThat(summary.hasFailures()).isFalse();
        assertThat(opened).hasSize(2);
        assertThat(opened).allMatch(gateway -> gateway.closed);
        assertThat(opened.get(0).committed).hasSize(3);
    }

    @Test
    void explicitTablesApplyByPositionAndExtraFilesAreSkipped() throws IOException {
        csv("first.csv", 1, "ID,NAME", "1,alice");
        csv("second.csv", 2, "ID,NAME", "2,bob");

        ImportRunSummary summary = runner(factory).run(config().tables(List.of("CUSTOMERS")).build(), SchemaCatalog.empty());

        assertThat(summary.getResults()).singleElement().satisfies(result -> {
            assertThat(result.getFileName()).isEqualTo("first.csv");
            assertThat(result.getTableName()).isEqualTo("CUSTOMERS");
            assertThat(result.getStatus()).isEqualTo(ImportStatus.SUCCEEDED);
        });
    }

    @Test
    void fileLevelFailureIsRecordedAndTheRunContinues() throws IOException {
        csv("orders.csv", 1, "ID,NAME", "1,widget");
        csv("users.csv", 2, "ID,NAME", "1,alice");

        ImportRunSummary summary = runner(factory).run(config().build(), SchemaCatalog.empty());

        assertThat(statuses(summary)).containsEntry("orders.csv", ImportStatus.FAILED)
                .containsEntry("users.csv", ImportStatus.SUCCEEDED);
        ImportResult orders = summary.getResults().get(0);
        assertThat(orders.getMessages()).singleElement().asString().contains("Table ORDERS does not exist");
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.count(ImportStatus.FAILED)).isEqualTo(1);
    }

    @Test
    void dryRunNeverOpensADatabaseConnection() throws IOException {
        csv("orders.csv", 1, "ID,NAME", "1,widget", "2,gadget");
        DatabaseGatewayFactory untouchable = mock(DatabaseGatewayFactory.class);

        ImportRunSummary summary = runner(untouchable).run(config().dryRun(true).build(), SchemaCatalog.empty());

        verifyNoInteractions(untouchable);
        assertThat(summary.getResults()).singleElement().satisfies(result -> {
            assertThat(result.getStatus()).isEqualTo(ImportStatus.SKIPPED_DRY_RUN);
            assertThat(result.getRowsAttempted()).isEqualTo(2);
            assertThat(result.getRowsCommitted()).isZero();
        });
    }

    @Test
    void tablesAreImportedInParallelWhenConfigured() throws IOException {
        csv("users.csv", 1, "ID,NAME", "1,alice", "2,bob");
        csv("customers.csv", 2, "ID,NAME", "10,acme");

        ImportRunSummary summary = runner(factory).run(config().parallelism(4).build(), SchemaCatalog.empty());

        assertThat(statuses(summary)).containsOnly(
                Map.entry("users.csv", ImportStatus.SUCCEEDED),
                Map.entry("customers.csv", ImportStatus.SUCCEEDED));
        assertThat(opened).hasSize(2);
        assertThat(summary.totalRowsCommitted()).isEqualTo(3);
    }

    @Test
    void rejectedDdlDocumentsAreReportedInTheSummary() throws IOException {
        csv("users.csv", 1, "ID,NAME", "1,alice");
        SchemaCatalog catalog = SchemaCatalog.empty();
        catalog.addError(new DdlParseException("ddl/broken.sql", "no CREATE TABLE statement found"));

        ImportRunSummary summary = runner(factory).run(config().build(), catalog);

        assertThat(summary.getSchemaErrors()).singleElement().asString().contains("broken.sql");
        assertThat(summary.hasFailures()).isFalse();
    }

    @Test
    void tableWithoutADdlDocumentIsReportedWhenADdlFolderIsConfigured() throws IOException {
        csv("users.csv", 1, "ID,NAME", "1,alice");
        Logger logger = (Logger) LoggerFactory.getLogger(ImportRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Map<String, List<PlannedFile>> groups = runner(factory).plan(config().ddlFolder(dataFolder).build(), SchemaCatalog.empty());

            assertThat(groups.get("USERS")).singleElement().satisfies(planned -> assertThat(planned.getSchema()).isEmpty());
            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(event -> assertThat(event.getFormattedMessage())
                            .contains("No DDL document")
                            .contains("USERS")
                            .contains("users.csv"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void missingDdlDocumentIsNotReportedWithoutADdlFolder() throws IOException {
        csv("users.csv", 1, "ID,NAME", "1,alice");
        Logger logger = (Logger) LoggerFactory.getLogger(ImportRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            runner(factory).plan(config().build(), SchemaCatalog.empty());

            assertThat(appender.list).noneMatch(event -> event.getLevel() == Level.WARN);
        } finally {
            logger.detachAppender(appender);
        }
    }
}
