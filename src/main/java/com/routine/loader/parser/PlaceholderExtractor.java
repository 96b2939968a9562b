package com.routine.loader.parser;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.exception.RoutineParseException;

/**
 * Finds placeholders like {@code @TST_ID@} and {@code @TST_FOO.BAR%type@} in the source of a stored routine and
 * resolves them against the replacement table. Lookup keys of the table are upper case.
 */
public class PlaceholderExtractor {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("@[A-Za-z0-9_.]+(%type)?@");

    /**
     * @return map from placeholder, as written in the source, to its value, sorted by placeholder
     * @throws RoutineParseException if one or more placeholders are not in the replacement table
     */
    public SortedMap<String, String> extract(RoutineSource source, Map<String, String> replacePairs) {
        Set<String> placeholders = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(source.getText());
        while (matcher.find()) {
            placeholders.add(matcher.group());
        }

        Set<String> unknown = new LinkedHashSet<>();
        SortedMap<String, String> resolved = new TreeMap<>();
        for (String placeholder : placeholders) {
            String value = replacePairs.get(placeholder.toUpperCase(Locale.ROOT));
            if (value == null) {
                unknown.add(placeholder);
            } else {
                resolved.put(placeholder, value);
            }
        }

        if (!unknown.isEmpty()) {
            throw new RoutineParseException("Unknown placeholder '%s' in file '%s'.",
                    String.join("', '", unknown), source.fileName());
        }

        return resolved;
    }
}
