package com.routine.loader.parser;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.routine.loader.model.ExtendedParameter;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.exception.RoutineParseException;
import com.routine.loader.testsupport.RoutineSources;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExtendedParameterParser.
 */
class ExtendedParameterParserTest {

    private final ExtendedParameterParser parser = new ExtendedParameterParser();

    private Map<String, ExtendedParameter> parse(String paramLines) {
        String text = """
                create procedure tst_routine(p_ids text)
                -- type: rows
                %s
                begin
                  select 1;
                end
                """.formatted(paramLines);
        RoutineSource source = RoutineSources.of("tst_routine", text);
        return parser.parse(source, 1, source.beginLineIndex());
    }

    @Test
    void testDefaultCodec() {
        Map<String, ExtendedParameter> parameters = parse("-- param: p_ids list_of_int");

        assertThat(parameters).containsOnlyKeys("p_ids");
        ExtendedParameter parameter = parameters.get("p_ids");
        assertThat(parameter.getDataType()).isEqualTo("list_of_int");
        assertThat(parameter.getDelimiter()).isEqualTo(',');
        assertThat(parameter.getEnclosure()).isEqualTo('"');
        assertThat(parameter.getEscape()).isEqualTo('\\');
    }

    @Test
    void testExplicitCodec() {
        Map<String, ExtendedParameter> parameters = parse("-- param: p_ids list_of_int ; ' \\");

        ExtendedParameter parameter = parameters.get("p_ids");
        assertThat(parameter.getDelimiter()).isEqualTo(';');
        assertThat(parameter.getEnclosure()).isEqualTo('\'');
        assertThat(parameter.getEscape()).isEqualTo('\\');
    }

    @Test
    void testDeclarationOrderIsKept() {
        Map<String, ExtendedParameter> parameters = parse("""
                -- param: p_b list_of_int
                -- param: p_a list_of_int""");

        assertThat(parameters.keySet()).containsExactly("p_b", "p_a");
    }

    @Test
    void testEmptyDeclarationIsSkipped() {
        assertThat(parse("-- param:")).isEmpty();
    }

    @Test
    void testDuplicateParameterFails() {
        assertThatThrownBy(() -> parse("""
                -- param: p_ids list_of_int
                -- param: p_ids list_of_int ; ' \\"""))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Duplicate parameter 'p_ids'");
    }

    @Test
    void testMalformedDeclarationFails() {
        assertThatThrownBy(() -> parse("-- param: p_ids"))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Expected: -- param:");
    }

    @Test
    void testDeclarationsOutsideRangeAreIgnored() {
        String text = """
                -- param: p_before list_of_int
                create procedure tst_routine(p_ids text)
                -- type: rows
                begin
                  -- param: p_after list_of_int
                  select 1;
                end
                """;
        RoutineSource source = RoutineSources.of("tst_routine", text);

        assertThat(parser.parse(source, 2, source.beginLineIndex())).isEmpty();
    }
}
