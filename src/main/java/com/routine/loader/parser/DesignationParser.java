package com.routine.loader.parser;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.model.Designation;
import com.routine.loader.model.DesignationType;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.exception.RoutineParseException;

/**
 * Parser for the designation comment of a stored routine.
 *
 * Format (one line, somewhere above the {@code begin} line):
 * - {@code -- type: rows}
 * - {@code -- type: rows_with_key col1,col2}
 * - {@code -- type: bulk_insert tmp_table col1,col2,col3}
 */
public class DesignationParser {
    private static final Logger log = LoggerFactory.getLogger(DesignationParser.class);

    private static final Pattern TYPE_PATTERN = Pattern.compile("^\\s*--\\s+type:\\s*(\\w+)\\s*(.+)?\\s*$");

    private static final Pattern BULK_INSERT_PATTERN = Pattern.compile("^([a-zA-Z0-9_]+)\\s+([a-zA-Z0-9_,]+)$");

    public ParsedDesignation parse(RoutineSource source) {
        List<String> lines = source.getLines();
        int begin = source.beginLineIndex();
        if (begin < 0) {
            throw notFound(source);
        }

        Designation designation = null;
        int designationLine = -1;
        for (int i = begin - 1; i >= 0; i--) {
            Matcher matcher = TYPE_PATTERN.matcher(lines.get(i));
            if (!matcher.matches()) {
                continue;
            }
            if (designation != null) {
                throw new RoutineParseException("Found more than one designation type (lines %d and %d) in file '%s'.",
                        i + 1, designationLine + 1, source.fileName());
            }
            designation = toDesignation(matcher.group(1), matcher.group(2), source);
            designationLine = i;
        }

        if (designation == null) {
            throw notFound(source);
        }

        log.debug("Designation of {}: {}", source.getRoutineName(), designation);
        return new ParsedDesignation(designation, designationLine, begin);
    }

    private Designation toDesignation(String name, String rawArguments, RoutineSource source) {
        DesignationType type = DesignationType.fromName(name)
                .orElseThrow(() -> new RoutineParseException("Unknown designation type '%s' in file '%s'.",
                        name, source.fileName()));

        String arguments = rawArguments == null || rawArguments.isBlank() ? null : rawArguments.trim();

        switch (type.getArguments()) {
            case TABLE_AND_COLUMNS -> {
                Matcher matcher = arguments == null ? null : BULK_INSERT_PATTERN.matcher(arguments);
                if (matcher == null || !matcher.matches()) {
                    throw new RoutineParseException("Expected: -- type: %s <table_name> <columns> in file '%s'.",
                            type.getSqlName(), source.fileName());
                }
                return Designation.bulkInsert(matcher.group(1), Arrays.asList(matcher.group(2).split(",", -1)));
            }
            case COLUMNS -> {
                if (arguments == null) {
                    throw new RoutineParseException("Expected: -- type: %s <columns> in file '%s'.",
                            type.getSqlName(), source.fileName());
                }
                List<String> columns = Arrays.stream(arguments.split(",", -1))
                        .map(String::trim)
                        .toList();
                return Designation.withColumns(type, columns);
            }
            default -> {
                if (arguments != null) {
                    throw new RoutineParseException("Unexpected arguments '%s' for designation type '%s' in file '%s'.",
                            arguments, type.getSqlName(), source.fileName());
                }
                return Designation.of(type);
            }
        }
    }

    private static RoutineParseException notFound(RoutineSource source) {
        return new RoutineParseException("Unable to find the designation type of the stored routine in file '%s'.",
                source.fileName());
    }
}
