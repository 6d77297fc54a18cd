package com.example.importer.reader;

import com.example.importer.model.DataFile;
import com.example.importer.model.FileFormat;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads delimited text. The delimiter is sniffed from the first line among comma, semicolon, tab and pipe.
 */
@Slf4j
public class DelimitedFileReader implements DataFileReader {

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final char BOM = '\uFEFF';

    private final Charset charset;

    public DelimitedFileReader(Charset charset) {
        this.charset = charset;
    }

    public DelimitedFileReader() {
        this(StandardCharsets.UTF_8);
    }

    @Override
    public boolean supports(FileFormat format) {
        return format == FileFormat.CSV;
    }

    @Override
    public DataFile read(Path path, FileFormat format) {
        String content;
        try {
            content = Files.readString(path, charset);
        } catch (IOException e) {
            throw new FileReadException("Cannot decode " + path + " as " + charset + ": " + e.getMessage(), e);
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        char delimiter = sniffDelimiter(content);
        log.debug("Reading {} with delimiter '{}'", path, delimiter);

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<List<Object>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), csvFormat)) {
            for (CSVRecord record : parser) {
                List<Object> row = new ArrayList<>(record.size());
                boolean blank = true;
                for (String value : record) {
                    row.add(value);
                    blank &= value.isEmpty();
                }
                if (!blank) {
                    rows.add(row);
                }
            }
        } catch (IOException | IllegalStateException | UncheckedIOException e) {
            throw new FileReadException("Cannot parse " + path + ": " + e.getMessage(), e);
        }
        log.info("Read {} rows from {}", rows.size(), path.getFileName());
        return new DataFile(path, format, rows);
    }

    static char sniffDelimiter(String content) {
        if (content.isEmpty()) {
            return ',';
        }
        String firstLine = content.split("\\R", 2)[0];
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = countOutsideQuotes(firstLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static int countOutsideQuotes(String line, char candidate) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == candidate && !quoted) {
                count++;
            }
        }
        return count;
    }
}
