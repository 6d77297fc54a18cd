package com.example.importer.reader;

import com.example.importer.model.DataFile;
import com.example.importer.model.FileFormat;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetFileReaderTest {

    private final SpreadsheetFileReader reader = new SpreadsheetFileReader();

    @TempDir
    Path folder;

    @Test
    void readsFirstSheetAsDisplayedText() throws IOException {
        Path xlsx = folder.resolve("users.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("users");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("ID");
            header.createCell(1).setCellValue("NAME");
            header.createCell(2).setCellValue("JOINED");
            header.createCell(3).setCellValue("SCORE");

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue(1);
            data.createCell(1).setCellValue("Alice");
            data.createCell(2).setCellValue(LocalDateTime.of(2025, 8, 22, 0, 0));
            data.getCell(2).setCellStyle(dateStyle);
            data.createCell(3).setCellFormula("A2*10");

            sheet.createRow(2);
            Row partial = sheet.createRow(3);
            partial.createCell(0).setCellValue(2);
            partial.createCell(1).setCellValue("Bob");

            workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("x");
            try (OutputStream out = Files.newOutputStream(xlsx)) {
                workbook.write(out);
            }
        }

        DataFile file = reader.read(xlsx, FileFormat.XLSX);

        assertThat(file.getRows()).containsExactly(
                List.of("ID", "NAME", "JOINED", "SCORE"),
                List.of("1", "Alice", "2025-08-22 00:00:00", "10"),
                List.of("2", "Bob", "", ""));
    }

    @Test
    void unreadableWorkbookIsAFileReadFailure() throws IOException {
        Path xlsx = folder.resolve("broken.xlsx");
        Files.writeString(xlsx, "this is not a workbook");

        assertThatThrownBy(() -> reader.read(xlsx, FileFormat.XLSX))
                .isInstanceOf(FileReadException.class)
                .hasMessageContaining("broken.xlsx");
    }

    @Test
    void supportsSpreadsheetFormatsOnly() {
        assertThat(reader.supports(FileFormat.XLS)).isTrue();
        assertThat(reader.supports(FileFormat.XLSX)).isTrue();
        assertThat(reader.supports(FileFormat.CSV)).isFalse();
    }

    @Test
    void headerRowIsNeverPaddedByWiderDataRows() throws IOException {
        Path xlsx = folder.resolve("people.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("people");
            writeRow(sheet, 0, "ID", "NAME");
            writeRow(sheet, 1, "1", "Ann");
            writeRow(sheet, 2, "2", "Bob", "oops");
            writeRow(sheet, 3, "3");
            try (OutputStream out = Files.newOutputStream(xlsx)) {
                workbook.write(out);
            }
        }

        DataFile file = reader.read(xlsx, FileFormat.XLSX);

        assertThat(file.getRows()).containsExactly(
                List.of("ID", "NAME"),
                List.of("1", "Ann"),
                List.of("2", "Bob", "oops"),
                List.of("3", ""));
    }

    static void writeRow(Sheet sheet, int index, String... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            row.createCell(i).setCellValue(values[i]);
        }
    }
}
