package com.routine.loader.compiler.executor;

import java.util.Comparator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces placeholders in a line of SQL code. At each position the longest matching placeholder wins and
 * replaced text is never scanned again.
 *
 * The set of placeholders is fixed at construction; values are looked up when a line is substituted.
 */
public final class PlaceholderSubstitutor {

    private final Map<String, String> replacements;
    private final Pattern pattern;

    public PlaceholderSubstitutor(Map<String, String> replacements) {
        this.replacements = replacements;
        this.pattern = replacements.isEmpty() ? null : Pattern.compile(replacements.keySet().stream()
                .filter(key -> !key.isEmpty())
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|")));
    }

    public String substitute(String line) {
        if (pattern == null) {
            return line;
        }
        Matcher matcher = pattern.matcher(line);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacements.get(matcher.group())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
