package com.routine.loader.compiler.doc;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for the first {@code /** ... *}{@code /} comment in a text.
 *
 * The short description is the first paragraph, ending at a blank line or at a line ending with a period.
 * The long description runs up to the first tag. A tag starts with {@code @name} at the beginning of a line
 * and continues up to the next tag.
 */
public class DefaultDocBlockTokenizer implements DocBlockTokenizer {

    private static final Pattern LINE_PREFIX = Pattern.compile("^\\s*\\*?\\s?");
    private static final Pattern TAG_PATTERN = Pattern.compile("^@(\\w+)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern FIRST_WORD = Pattern.compile("^\\S+\\s*", Pattern.DOTALL);

    @Override
    public DocBlock tokenize(String text) {
        int start = text.indexOf("/**");
        if (start < 0) {
            return DocBlock.EMPTY;
        }
        int end = text.indexOf("*/", start + 3);
        if (end < 0) {
            return DocBlock.EMPTY;
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.substring(start + 3, end).split("\r?\n", -1)) {
            lines.add(LINE_PREFIX.matcher(line).replaceFirst("").stripTrailing());
        }

        List<String> description = new ArrayList<>();
        List<StringBuilder> tagTexts = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("@")) {
                tagTexts.add(new StringBuilder(line));
            } else if (!tagTexts.isEmpty()) {
                tagTexts.get(tagTexts.size() - 1).append('\n').append(line);
            } else {
                description.add(line);
            }
        }

        int paragraphEnd = shortDescriptionEnd(description);
        String shortDescription = String.join("\n", description.subList(0, paragraphEnd)).strip();
        String longDescription = String.join("\n", description.subList(paragraphEnd, description.size())).strip();

        List<DocBlockTag> tags = new ArrayList<>();
        for (StringBuilder tagText : tagTexts) {
            Matcher matcher = TAG_PATTERN.matcher(tagText.toString().strip());
            if (matcher.matches()) {
                String content = matcher.group(2).strip();
                String tagDescription = FIRST_WORD.matcher(content).replaceFirst("");
                tags.add(new DocBlockTag(matcher.group(1), content, tagDescription));
            }
        }

        return new DocBlock(shortDescription, longDescription, List.copyOf(tags));
    }

    private static int shortDescriptionEnd(List<String> description) {
        int i = 0;
        while (i < description.size() && description.get(i).isBlank()) {
            i++;
        }
        while (i < description.size()) {
            String line = description.get(i);
            if (line.isBlank()) {
                return i;
            }
            i++;
            if (line.endsWith(".")) {
                return i;
            }
        }
        return i;
    }
}
