package com.routine.loader.parser;

import java.util.Map;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.model.ExtendedParameter;
import com.routine.loader.model.RoutineSource;

import lombok.RequiredArgsConstructor;

/**
 * Scans the source of a stored routine for placeholders, the designation, extended parameters and the
 * routine header. Nothing here touches the database.
 */
@RequiredArgsConstructor
public class AnnotationScanner {
    private static final Logger log = LoggerFactory.getLogger(AnnotationScanner.class);

    private final PlaceholderExtractor placeholderExtractor;
    private final DesignationParser designationParser;
    private final ExtendedParameterParser extendedParameterParser;
    private final RoutineHeaderParser headerParser;

    public AnnotationScanner() {
        this(new PlaceholderExtractor(), new DesignationParser(), new ExtendedParameterParser(),
                new RoutineHeaderParser());
    }

    public RoutineAnnotations scan(RoutineSource source, Map<String, String> replacePairs) {
        SortedMap<String, String> placeholders = placeholderExtractor.extract(source, replacePairs);

        ParsedDesignation designation = designationParser.parse(source);

        RoutineHeader header = headerParser.parse(source);

        Map<String, ExtendedParameter> extendedParameters = extendedParameterParser.parse(source,
                designation.getLineIndex(), designation.getBeginLineIndex());

        log.debug("Scanned {}: {} placeholder(s), {} extended parameter(s)",
                source.getRoutineName(), placeholders.size(), extendedParameters.size());

        return RoutineAnnotations.builder()
                .header(header)
                .designation(designation.getDesignation())
                .placeholders(placeholders)
                .extendedParameters(extendedParameters)
                .build();
    }
}
