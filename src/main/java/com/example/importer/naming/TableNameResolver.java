package com.example.importer.naming;

import com.example.importer.model.TableTarget;
import com.example.importer.util.IdentifierSanitizer;
import com.example.importer.util.SqlIdentifierValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Derives an Oracle-valid table name from a file stem.
 * <p>
 * Order of operations: optional date-suffix strip, character sanitizing with underscore-run collapsing,
 * uppercasing, {@code T_} prefix when the name does not start with a letter, and finally truncation to
 * {@value SqlIdentifierValidator#MAX_IDENTIFIER_LENGTH} characters. Leading and trailing underscores are kept
 * so that resolving a resolved name returns it unchanged.
 */
@Slf4j
public class TableNameResolver {

    static final String NON_LETTER_PREFIX = "T_";

    private final DateSuffixAnalyzer dateSuffixAnalyzer;

    public TableNameResolver(DateSuffixAnalyzer dateSuffixAnalyzer) {
        this.dateSuffixAnalyzer = dateSuffixAnalyzer;
    }

    public TableTarget resolve(String fileStem, boolean keepDateSuffix, String explicitOverride) {
        if (explicitOverride != null && !explicitOverride.isBlank()) {
            String name = explicitOverride.trim().toUpperCase(Locale.ROOT);
            SqlIdentifierValidator.validate(name);
            return new TableTarget(name, fileStem, true);
        }
        return new TableTarget(resolveName(fileStem, keepDateSuffix), fileStem, false);
    }

    /**
     * Repeats the derivation until the name no longer changes, so dated stems with several date tokens and
     * truncations that expose a new date token still resolve to a fixed point.
     */
    public String resolveName(String fileStem, boolean keepDateSuffix) {
        String name = deriveOnce(fileStem, keepDateSuffix);
        String again = deriveOnce(name, keepDateSuffix);
        while (!again.equals(name) && again.length() < name.length()) {
            name = again;
            again = deriveOnce(name, keepDateSuffix);
        }
        return name;
    }

    private String deriveOnce(String stem, boolean keepDateSuffix) {
        String base = stem;
        if (!keepDateSuffix) {
            DateSuffix suffix = dateSuffixAnalyzer.strip(base);
            while (suffix.isSuffixFound()) {
                log.debug("Stripped date suffix '{}' from '{}'", suffix.getSuffixText(), base);
                base = suffix.getBaseName();
                suffix = dateSuffixAnalyzer.strip(base);
            }
        }
        String name = IdentifierSanitizer.sanitize(base);
        if (name.isEmpty() || !Character.isLetter(name.charAt(0))) {
            name = IdentifierSanitizer.collapse(NON_LETTER_PREFIX + name);
        }
        if (name.length() > SqlIdentifierValidator.MAX_IDENTIFIER_LENGTH) {
            name = name.substring(0, SqlIdentifierValidator.MAX_IDENTIFIER_LENGTH);
        }
        return name;
    }
}
