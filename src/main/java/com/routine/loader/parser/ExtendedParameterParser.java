package com.routine.loader.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.routine.loader.model.ExtendedParameter;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.exception.RoutineParseException;

/**
 * Parser for extended parameter comments.
 *
 * Format: {@code -- param: <name> <type_of_list> [delimiter enclosure escape]}, for example
 * {@code -- param: p_ids list_of_int , " \}. A bare {@code -- param:} declares nothing.
 */
public class ExtendedParameterParser {

    private static final Pattern PARAM_PATTERN = Pattern.compile("^\\s*--\\s+param:(.*)$");

    private static final Pattern ARGUMENTS_PATTERN = Pattern.compile(
            "^(\\w+)\\s+(\\w+)(?:\\s+([^\\s-])\\s+([^\\s-])\\s+([^\\s-]))?$");

    /**
     * Parses the lines in the half-open range {@code (afterLine, beforeLine)}.
     *
     * @return the declared parameters keyed by name, in declaration order
     */
    public Map<String, ExtendedParameter> parse(RoutineSource source, int afterLine, int beforeLine) {
        List<String> lines = source.getLines();
        Map<String, ExtendedParameter> parameters = new LinkedHashMap<>();

        for (int i = afterLine + 1; i < beforeLine; i++) {
            Matcher matcher = PARAM_PATTERN.matcher(lines.get(i));
            if (!matcher.matches()) {
                continue;
            }

            String arguments = matcher.group(1).trim();
            if (arguments.isEmpty()) {
                continue;
            }

            Matcher args = ARGUMENTS_PATTERN.matcher(arguments);
            if (!args.matches()) {
                throw new RoutineParseException(
                        "Expected: -- param: <field_name> <type_of_list> [delimiter enclosure escape] in file '%s'.",
                        source.fileName());
            }

            String name = args.group(1);
            if (parameters.containsKey(name)) {
                throw new RoutineParseException("Duplicate parameter '%s' in file '%s'.", name, source.fileName());
            }

            ExtendedParameter.ExtendedParameterBuilder builder = ExtendedParameter.builder()
                    .name(name)
                    .dataType(args.group(2));
            if (args.group(3) != null) {
                builder.delimiter(args.group(3).charAt(0))
                        .enclosure(args.group(4).charAt(0))
                        .escape(args.group(5).charAt(0));
            }
            parameters.put(name, builder.build());
        }

        return parameters;
    }
}
