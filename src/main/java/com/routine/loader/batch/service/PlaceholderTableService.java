package com.routine.loader.batch.service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.database.DataLayer;
import com.routine.loader.util.SqlValues;

import lombok.RequiredArgsConstructor;

/**
 * Builds the replacement table for placeholders. It has two sources:
 * - {@code @TABLE.COLUMN%TYPE@} for every column of every table in the current schema
 * - a properties file with entries like {@code @TST_ID@=42}, which take precedence
 *
 * Keys are upper case.
 */
@RequiredArgsConstructor
public class PlaceholderTableService {
    private static final Logger log = LoggerFactory.getLogger(PlaceholderTableService.class);

    private static final String COLUMN_TYPES_QUERY = """
            select table_name         as table_name
            ,      column_name        as column_name
            ,      column_type        as column_type
            ,      character_set_name as character_set_name
            from   information_schema.COLUMNS
            where  table_schema = database()
            order by table_name
            ,        ordinal_position""";

    private final DataLayer dataLayer;

    public Map<String, String> buildReplacePairs(Path placeholderFile) throws IOException {
        Map<String, String> replacePairs = new TreeMap<>(columnTypePlaceholders());
        if (placeholderFile != null) {
            replacePairs.putAll(readPlaceholderFile(placeholderFile));
        }
        log.debug("Replacement table has {} entries", replacePairs.size());
        return replacePairs;
    }

    Map<String, String> columnTypePlaceholders() {
        List<Map<String, Object>> rows = dataLayer.executeRows(COLUMN_TYPES_QUERY);

        Map<String, String> placeholders = new TreeMap<>();
        for (Map<String, Object> row : rows) {
            String key = "@" + SqlValues.asString(row.get("table_name")) + "."
                    + SqlValues.asString(row.get("column_name")) + "%type@";

            String value = SqlValues.asString(row.get("column_type"));
            String characterSet = SqlValues.asString(row.get("character_set_name"));
            if (characterSet != null) {
                value += " character set " + characterSet;
            }

            placeholders.put(key.toUpperCase(Locale.ROOT), value);
        }
        return placeholders;
    }

    Map<String, String> readPlaceholderFile(Path placeholderFile) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(placeholderFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }

        Map<String, String> placeholders = new TreeMap<>();
        for (String name : properties.stringPropertyNames()) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            if (!key.startsWith("@") || !key.endsWith("@") || key.length() < 3) {
                log.warn("Ignoring '{}' in {}: placeholders look like @NAME@", name, placeholderFile);
                continue;
            }
            placeholders.put(key, properties.getProperty(name).trim());
        }
        return placeholders;
    }
}
