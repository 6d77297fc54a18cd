package com.example.importer.reader;

import com.example.importer.model.DataFile;
import com.example.importer.model.FileFormat;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an {@code .xls} or {@code .xlsx} workbook. Cells are returned as displayed, except
 * date-formatted cells which become ISO-8601 timestamps.
 */
@Slf4j
public class SpreadsheetFileReader implements DataFileReader {

    private static final DateTimeFormatter ISO_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DataFormatter dataFormatter = new DataFormatter();

    @Override
    public boolean supports(FileFormat format) {
        return format.isSpreadsheet();
    }

    @Override
    public DataFile read(Path path, FileFormat format) {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new DataFile(path, format, List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            List<List<Object>> rows = new ArrayList<>();
            for (Row row : sheet) {
                List<Object> values = new ArrayList<>();
                int lastFilled = -1;
                for (int i = 0; i < Math.max(row.getLastCellNum(), 0); i++) {
                    String value = cellText(row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL), evaluator);
                    values.add(value);
                    if (!value.isEmpty()) {
                        lastFilled = i;
                    }
                }
                if (lastFilled >= 0) {
                    rows.add(new ArrayList<>(values.subList(0, lastFilled + 1)));
                }
            }
            // trailing empty cells are not stored by the workbook; restore them up to the first row's width
            int width = rows.isEmpty() ? 0 : rows.get(0).size();
            for (List<Object> row : rows.subList(Math.min(1, rows.size()), rows.size())) {
                while (row.size() < width) {
                    row.add("");
                }
            }
            log.info("Read {} rows from sheet '{}' of {}", rows.size(), sheet.getSheetName(), path.getFileName());
            return new DataFile(path, format, rows);
        } catch (IOException | RuntimeException e) {
            throw new FileReadException("Cannot read workbook " + path + ": " + e.getMessage(), e);
        }
    }

    private String cellText(Cell cell, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime value = cell.getLocalDateTimeCellValue();
            return value == null ? "" : value.format(ISO_TIMESTAMP);
        }
        return dataFormatter.formatCellValue(cell, evaluator).trim();
    }
}
