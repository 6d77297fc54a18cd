package com.example.importer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDefinition implements Serializable {
    private String name;
    private String type;
    @Builder.Default
    private boolean nullable = true;
    private boolean hasDefault;
    /** Default expression as written in the document, e.g. {@code SYSTIMESTAMP} or {@code 'N'}. */
    private String defaultValue;
    private boolean primaryKey;
    private int ordinal;

    /**
     * Declared type without its length/precision arguments, e.g. {@code NUMBER} for {@code NUMBER(10,2)}.
     */
    public String getBaseType() {
        if (type == null) {
            return "";
        }
        int paren = type.indexOf('(');
        String base = paren >= 0 ? type.substring(0, paren) : type;
        return base.trim().toUpperCase(Locale.ROOT);
    }
}
