package com.example.importer.processor;

import com.example.importer.model.ColumnDefinition;
import com.example.importer.model.SchemaDocument;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowValueConverterTest {

    private static final SchemaDocument USERS = SchemaDocument.builder()
            .tableName("USERS")
            .sourcePath("users.sql")
            .column(ColumnDefinition.builder().name("ID").type("NUMBER(10)").nullable(false).primaryKey(true).ordinal(1).build())
            .column(ColumnDefinition.builder().name("NAME").type("VARCHAR2(100)").nullable(false).ordinal(2).build())
            .column(ColumnDefinition.builder().name("JOINED").type("DATE").ordinal(3).build())
            .column(ColumnDefinition.builder().name("STATUS").type("VARCHAR2(10)").nullable(false).hasDefault(true).ordinal(4).build())
            .build();

    private final RowValueConverter converter = new RowValueConverter(
            List.of("ID", "NAME", "JOINED", "STATUS"), Optional.of(USERS));

    @Test
    void convertsByDeclaredType() {
        List<Object> row = converter.convert(List.of(" 1,200 ", " Alice ", "2025/08/22", "ACTIVE"));

        assertThat(row.get(0)).isEqualTo(new BigDecimal("1200"));
        assertThat(row.get(1)).isEqualTo("Alice");
        assertThat(row.get(2)).isEqualTo(Timestamp.valueOf(LocalDateTime.of(2025, 8, 22, 0, 0)));
        assertThat(row.get(3)).isEqualTo("ACTIVE");
    }

    @Test
    void nullMarkersBecomeNull() {
        List<Object> row = converter.convert(Arrays.asList("7", "Bob", "N/A", "null"));

        assertThat(row.get(2)).isNull();
        assertThat(row.get(3)).isNull();
    }

    @Test
    void unparsableNumberIsRejected() {
        assertThatThrownBy(() -> converter.convert(List.of("seven", "Bob", "", "")))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("ID")
                .hasMessageContaining("seven");
    }

    @Test
    void unparsableDateIsRejected() {
        assertThatThrownBy(() -> converter.convert(List.of("7", "Bob", "next tuesday", "")))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("JOINED");
    }

    @Test
    void mandatoryColumnWithoutDefaultMustHaveAValue() {
        assertThatThrownBy(() -> converter.convert(List.of("7", " ", "", "")))
                .isInstanceOf(ValueConversionException.class)
                .hasMessageContaining("NAME is NOT NULL");
    }

    @Test
    void withoutSchemaValuesStayTrimmedStrings() {
        RowValueConverter untyped = new RowValueConverter(List.of("A", "B", "C"), Optional.empty());

        assertThat(untyped.convert(List.of(" 42 ", "", "x"))).containsExactly("42", null, "x");
    }

    @Test
    void parsesCommonDateShapes() {
        LocalDateTime expected = LocalDateTime.of(2025, 8, 22, 0, 0);

        assertThat(DateTimeParser.parse("2025-08-22")).contains(expected);
        assertThat(DateTimeParser.parse("22/08/2025")).contains(expected);
        assertThat(DateTimeParser.parse("20250822")).contains(expected);
        assertThat(DateTimeParser.parse("2025-08-22 13:45:10.5")).contains(LocalDateTime.of(2025, 8, 22, 13, 45, 10, 500_000_000));
        assertThat(DateTimeParser.parse("2025-08-22T13:45:10")).contains(LocalDateTime.of(2025, 8, 22, 13, 45, 10));
        assertThat(DateTimeParser.parse("soon")).isEmpty();
    }

    @Test
    void mapsDeclaredTypes() {
        assertThat(ValueType.fromDeclaredType("NUMBER")).isEqualTo(ValueType.NUMBER);
        assertThat(ValueType.fromDeclaredType("TIMESTAMP(6) WITH TIME ZONE")).isEqualTo(ValueType.TIMESTAMP);
        assertThat(ValueType.fromDeclaredType("varchar2")).isEqualTo(ValueType.STRING);
        assertThat(ValueType.fromDeclaredType("BLOB")).isEqualTo(ValueType.RAW);
    }
}
