package com.routine.loader.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.routine.loader.model.RoutineKind;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.exception.RoutineParseException;

/**
 * Extracts the routine kind and name from the source and checks the name against the file name.
 */
public class RoutineHeaderParser {

    static final Pattern HEADER_PATTERN = Pattern.compile(
            "create\\s+(procedure|function)\\s+([a-zA-Z0-9_]+)", Pattern.CASE_INSENSITIVE);

    public RoutineHeader parse(RoutineSource source) {
        Matcher matcher = HEADER_PATTERN.matcher(source.getText());
        if (!matcher.find()) {
            throw new RoutineParseException("Unable to find the stored routine name and type in file '%s'.",
                    source.fileName());
        }

        String name = matcher.group(2);
        if (!name.equals(source.getRoutineName())) {
            throw new RoutineParseException("Stored routine name '%s' does not match filename in file '%s'.",
                    name, source.fileName());
        }

        return new RoutineHeader(RoutineKind.fromSql(matcher.group(1)), name,
                lineIndexAt(source.getText(), matcher.start()));
    }

    private static int lineIndexAt(String text, int offset) {
        int lineIndex = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                lineIndex++;
            }
        }
        return lineIndex;
    }
}
