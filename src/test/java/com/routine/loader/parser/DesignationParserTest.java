package com.routine.loader.parser;

import org.junit.jupiter.api.Test;

import com.routine.loader.model.DesignationType;
import com.routine.loader.parser.exception.RoutineParseException;
import com.routine.loader.testsupport.RoutineSources;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DesignationParser.
 */
class DesignationParserTest {

    private final DesignationParser parser = new DesignationParser();

    private static String routine(String designationLine) {
        return """
                /**
                 * Test routine.
                 */
                create procedure tst_routine()
                modifies sql data
                %s
                begin
                  select 1;
                end
                """.formatted(designationLine);
    }

    @Test
    void testParseDesignationWithoutArguments() {
        ParsedDesignation parsed = parser.parse(RoutineSources.of("tst_routine", routine("-- type: rows")));

        assertThat(parsed.getDesignation().getType()).isEqualTo(DesignationType.ROWS);
        assertThat(parsed.getDesignation().getColumns()).isEmpty();
        assertThat(parsed.getDesignation().getTableName()).isNull();
        assertThat(parsed.getLineIndex()).isEqualTo(5);
        assertThat(parsed.getBeginLineIndex()).isEqualTo(6);
    }

    @Test
    void testParseRowsWithKey() {
        ParsedDesignation parsed = parser.parse(
                RoutineSources.of("tst_routine", routine("-- type: rows_with_key tst_c01,tst_c02")));

        assertThat(parsed.getDesignation().getType()).isEqualTo(DesignationType.ROWS_WITH_KEY);
        assertThat(parsed.getDesignation().getColumns()).containsExactly("tst_c01", "tst_c02");
    }

    @Test
    void testParseRowsWithIndex() {
        ParsedDesignation parsed = parser.parse(
                RoutineSources.of("tst_routine", routine("-- type: rows_with_index tst_c01")));

        assertThat(parsed.getDesignation().getType()).isEqualTo(DesignationType.ROWS_WITH_INDEX);
        assertThat(parsed.getDesignation().getColumns()).containsExactly("tst_c01");
    }

    @Test
    void testParseBulkInsert() {
        ParsedDesignation parsed = parser.parse(
                RoutineSources.of("tst_routine", routine("-- type: bulk_insert TMP_TEST field1,field2,field3")));

        assertThat(parsed.getDesignation().isBulkInsert()).isTrue();
        assertThat(parsed.getDesignation().getTableName()).isEqualTo("TMP_TEST");
        assertThat(parsed.getDesignation().getColumns()).containsExactly("field1", "field2", "field3");
    }

    @Test
    void testBulkInsertWithoutColumnsFails() {
        assertThatThrownBy(() -> parser.parse(
                RoutineSources.of("tst_routine", routine("-- type: bulk_insert TMP_TEST"))))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Expected: -- type: bulk_insert <table_name> <columns>");
    }

    @Test
    void testRowsWithKeyWithoutColumnsFails() {
        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", routine("-- type: rows_with_key"))))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Expected: -- type: rows_with_key <columns>");
    }

    @Test
    void testArgumentsOnPlainDesignationFail() {
        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", routine("-- type: singleton1 foo"))))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Unexpected arguments 'foo'");
    }

    @Test
    void testUnknownDesignationFails() {
        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", routine("-- type: rowz"))))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Unknown designation type 'rowz'");
    }

    @Test
    void testDesignationNameIsCaseSensitive() {
        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", routine("-- type: ROWS_WITH_KEY tst_id"))))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Unknown designation type 'ROWS_WITH_KEY'");
    }

    @Test
    void testMoreThanOneDesignationFails() {
        String text = routine("-- type: rows\n-- type: row1");

        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", text)))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("more than one designation");
    }

    @Test
    void testDesignationBelowBeginIsIgnored() {
        String text = """
                create procedure tst_routine()
                begin
                  -- type: rows
                  select 1;
                end
                """;

        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", text)))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("Unable to find the designation type");
    }

    @Test
    void testMissingBeginFails() {
        String text = """
                create function tst_routine() returns int
                -- type: function
                return 1;
                """;

        assertThatThrownBy(() -> parser.parse(RoutineSources.of("tst_routine", text)))
                .isInstanceOf(RoutineParseException.class)
                .hasMessageContaining("tst_routine.psql");
    }
}
