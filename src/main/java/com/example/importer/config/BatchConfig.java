package com.example.importer.config;

import com.example.importer.dialect.DatabaseDialect;
import com.example.importer.dialect.H2Dialect;
import com.example.importer.dialect.OracleDialect;
import com.example.importer.engine.BatchImportEngine;
import com.example.importer.engine.ImportRunner;
import com.example.importer.gateway.DatabaseGatewayFactory;
import com.example.importer.gateway.JdbcDatabaseGateway;
import com.example.importer.header.HeaderDetector;
import com.example.importer.naming.DateSuffixAnalyzer;
import com.example.importer.naming.TableNameResolver;
import com.example.importer.reader.DataFileScanner;
import com.example.importer.reader.DelimitedFileReader;
import com.example.importer.reader.SpreadsheetFileReader;
import com.example.importer.schema.DdlParser;
import com.example.importer.schema.SchemaCatalogLoader;
import com.example.importer.step.DataImportTasklet;
import com.example.importer.step.SchemaCatalogTasklet;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(ImporterProperties.class)
public class BatchConfig {

    @Bean
    public DatabaseDialect databaseDialect(ImporterProperties properties) {
        String type = properties.getDatabase().getType();
        return switch (type == null ? "" : type.trim().toLowerCase(Locale.ROOT)) {
            case "oracle" -> new OracleDialect();
            case "h2" -> new H2Dialect();
            default -> throw new ConfigException("Unsupported importer.database.type: " + type
                    + " (expected oracle or h2)");
        };
    }

    @Bean
    public Job dataImportJob(JobRepository jobRepository, Step schemaCatalogStep, Step dataImportStep) {
        return new JobBuilder("dataImportJob", jobRepository)
                .start(schemaCatalogStep)
                .next(dataImportStep)
                .build();
    }

    @Bean
    public Step schemaCatalogStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                  SchemaCatalogLoader schemaCatalogLoader, ImporterProperties properties) {
        return new StepBuilder("schemaCatalogStep", jobRepository)
                .tasklet(new SchemaCatalogTasklet(schemaCatalogLoader, properties), transactionManager)
                .build();
    }

    @Bean
    public Step dataImportStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                               ImportRunner importRunner, ImporterProperties properties) {
        return new StepBuilder("dataImportStep", jobRepository)
                .tasklet(new DataImportTasklet(importRunner, properties), transactionManager)
                .build();
    }

    @Bean
    public TableNameResolver tableNameResolver() {
        return new TableNameResolver(new DateSuffixAnalyzer());
    }

    @Bean
    public SchemaCatalogLoader schemaCatalogLoader(TableNameResolver tableNameResolver) {
        return new SchemaCatalogLoader(new DdlParser(), tableNameResolver);
    }

    @Bean
    public DataFileScanner dataFileScanner(ImporterProperties properties) {
        Charset charset;
        try {
            charset = Charset.forName(properties.getFiles().getEncoding());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException("Unsupported importer.files.encoding: " + properties.getFiles().getEncoding(), e);
        }
        return new DataFileScanner(List.of(new DelimitedFileReader(charset), new SpreadsheetFileReader()),
                new HashSet<>(properties.getFiles().getExtensions()));
    }

    @Bean
    public BatchImportEngine batchImportEngine(DatabaseDialect dialect) {
        return new BatchImportEngine(new HeaderDetector(), dialect);
    }

    @Bean
    public DatabaseGatewayFactory databaseGatewayFactory(DataSource dataSource, DatabaseDialect dialect) {
        return () -> new JdbcDatabaseGateway(dataSource, dialect);
    }

    @Bean
    public ImportRunner importRunner(DataFileScanner dataFileScanner, TableNameResolver tableNameResolver,
                                     BatchImportEngine batchImportEngine, DatabaseGatewayFactory databaseGatewayFactory,
                                     DatabaseDialect dialect) {
        return new ImportRunner(dataFileScanner, tableNameResolver, batchImportEngine, databaseGatewayFactory, dialect);
    }
}
