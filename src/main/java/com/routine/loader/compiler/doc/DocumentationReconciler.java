package com.routine.loader.compiler.doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.compiler.CompileDiagnostics;
import com.routine.loader.compiler.mapper.SqlToWrapperTypeMapper;
import com.routine.loader.compiler.metadata.ParameterDocumentation;
import com.routine.loader.compiler.metadata.RoutineDocumentation;
import com.routine.loader.model.RoutineParameter;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.RoutineHeader;

import lombok.RequiredArgsConstructor;

/**
 * Builds the documentation of a stored routine from the doc block above its {@code create} statement and
 * reports parameters that are undocumented or documented but unknown. Mismatches are warnings only.
 */
@RequiredArgsConstructor
public class DocumentationReconciler {
    private static final Logger log = LoggerFactory.getLogger(DocumentationReconciler.class);

    private static final String PARAM_TAG = "param";

    private final DocBlockTokenizer tokenizer;

    public RoutineDocumentation reconcile(RoutineSource source,
                                          RoutineHeader header,
                                          List<RoutineParameter> parameters,
                                          CompileDiagnostics diagnostics) {
        DocBlock docBlock = tokenizer.tokenize(textBeforeHeader(source, header));
        List<Map.Entry<String, String>> documented = parameterDescriptions(docBlock);

        List<ParameterDocumentation> parameterDocs = new ArrayList<>();
        for (RoutineParameter parameter : parameters) {
            parameterDocs.add(ParameterDocumentation.builder()
                    .name(parameter.getName())
                    .wrapperType(SqlToWrapperTypeMapper.toWrapperType(parameter))
                    .dataTypeDescriptor(parameter.getDataTypeDescriptor())
                    .description(descriptionOf(documented, parameter.getName()))
                    .build());
        }

        validateParameterLists(parameters, documented, diagnostics);

        return RoutineDocumentation.builder()
                .shortDescription(docBlock.getShortDescription())
                .longDescription(docBlock.getLongDescription())
                .parameters(List.copyOf(parameterDocs))
                .build();
    }

    private static String textBeforeHeader(RoutineSource source, RoutineHeader header) {
        return source.getLines().subList(0, header.getLineIndex()).stream()
                .collect(Collectors.joining("\n", "", "\n"));
    }

    /**
     * Returns (name, description) pairs of all {@code @param} tags in order of appearance. Description lines
     * are trimmed.
     */
    private static List<Map.Entry<String, String>> parameterDescriptions(DocBlock docBlock) {
        List<Map.Entry<String, String>> result = new ArrayList<>();
        for (DocBlockTag tag : docBlock.getTags()) {
            if (!PARAM_TAG.equals(tag.getName())) {
                continue;
            }
            String content = tag.getContent();
            String description = tag.getDescription();
            String name = content.substring(0, content.length() - description.length()).trim();

            String trimmed = description.lines()
                    .map(String::trim)
                    .collect(Collectors.joining("\n"));

            result.add(Map.entry(name, trimmed));
        }
        return result;
    }

    private static String descriptionOf(List<Map.Entry<String, String>> documented, String name) {
        return documented.stream()
                .filter(e -> e.getKey().equals(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static void validateParameterLists(List<RoutineParameter> parameters,
                                               List<Map.Entry<String, String>> documented,
                                               CompileDiagnostics diagnostics) {
        List<String> databaseNames = parameters.stream().map(RoutineParameter::getName).toList();
        List<String> docNames = documented.stream().map(Map.Entry::getKey).toList();

        for (String name : databaseNames) {
            if (!docNames.contains(name)) {
                warn(diagnostics, String.format("Parameter '%s' is missing from doc block.", name));
            }
        }

        for (String name : docNames) {
            if (!databaseNames.contains(name)) {
                warn(diagnostics, String.format("Unknown parameter '%s' found in doc block.", name));
            }
        }
    }

    private static void warn(CompileDiagnostics diagnostics, String warning) {
        log.warn("  Warning: {}", warning);
        diagnostics.getWarnings().add(warning);
    }
}
