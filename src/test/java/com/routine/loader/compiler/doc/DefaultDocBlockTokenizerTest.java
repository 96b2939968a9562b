package com.routine.loader.compiler.doc;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DefaultDocBlockTokenizer.
 */
class DefaultDocBlockTokenizerTest {

    private final DefaultDocBlockTokenizer tokenizer = new DefaultDocBlockTokenizer();

    @Test
    void testTokenizeDocBlock() {
        DocBlock docBlock = tokenizer.tokenize("""
                /**
                 * Selects rows
                 * of the test table.
                 *
                 * Only rows with the given status
                 * are selected.
                 *
                 * @param p_status The status
                 *                 of the rows.
                 * @param p_limit  The maximum number of rows.
                 * @since 1.0
                 */
                """);

        assertThat(docBlock.getShortDescription()).isEqualTo("Selects rows\nof the test table.");
        assertThat(docBlock.getLongDescription()).isEqualTo("Only rows with the given status\nare selected.");
        assertThat(docBlock.getTags()).extracting(DocBlockTag::getName).containsExactly("param", "param", "since");

        DocBlockTag status = docBlock.getTags().get(0);
        assertThat(status.getContent()).startsWith("p_status The status\n");
        assertThat(status.getDescription()).startsWith("The status\n").endsWith("of the rows.");
        assertThat(docBlock.getTags().get(1).getDescription()).isEqualTo("The maximum number of rows.");
    }

    @Test
    void testShortDescriptionEndsAtPeriod() {
        DocBlock docBlock = tokenizer.tokenize("""
                /**
                 * Deletes a row.
                 * The row must exist.
                 */
                """);

        assertThat(docBlock.getShortDescription()).isEqualTo("Deletes a row.");
        assertThat(docBlock.getLongDescription()).isEqualTo("The row must exist.");
        assertThat(docBlock.getTags()).isEmpty();
    }

    @Test
    void testOnlyFirstDocBlockIsRead() {
        DocBlock docBlock = tokenizer.tokenize("""
                -- Routine without doc block comment style
                /** First. */
                /** Second. */
                """);

        assertThat(docBlock.getShortDescription()).isEqualTo("First.");
    }

    @Test
    void testTextWithoutDocBlock() {
        assertThat(tokenizer.tokenize("-- just a comment\n")).isEqualTo(DocBlock.EMPTY);
        assertThat(tokenizer.tokenize("/** unterminated")).isEqualTo(DocBlock.EMPTY);
    }
}
