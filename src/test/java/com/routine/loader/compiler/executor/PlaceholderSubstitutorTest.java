package com.routine.loader.compiler.executor;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlaceholderSubstitutor.
 */
class PlaceholderSubstitutorTest {

    @Test
    void testLongestPlaceholderWins() {
        PlaceholderSubstitutor substitutor = new PlaceholderSubstitutor(Map.of(
                "@TST@", "short",
                "@TST@X", "long"));

        assertThat(substitutor.substitute("a @TST@X b @TST@ c")).isEqualTo("a long b short c");
    }

    @Test
    void testReplacedTextIsNotScannedAgain() {
        PlaceholderSubstitutor substitutor = new PlaceholderSubstitutor(Map.of(
                "@A@", "@B@",
                "@B@", "b"));

        assertThat(substitutor.substitute("@A@ @B@")).isEqualTo("@B@ b");
    }

    @Test
    void testValuesWithRegexCharacters() {
        PlaceholderSubstitutor substitutor = new PlaceholderSubstitutor(Map.of("@PRICE@", "$1.00\\"));

        assertThat(substitutor.substitute("select '@PRICE@'")).isEqualTo("select '$1.00\\'");
    }

    @Test
    void testValuesAreLookedUpPerLine() {
        Map<String, String> replace = new HashMap<>();
        replace.put("__LINE__", "1");
        PlaceholderSubstitutor substitutor = new PlaceholderSubstitutor(replace);

        String first = substitutor.substitute("line __LINE__");
        replace.put("__LINE__", "2");
        String second = substitutor.substitute("line __LINE__");

        assertThat(first).isEqualTo("line 1");
        assertThat(second).isEqualTo("line 2");
    }

    @Test
    void testNoPlaceholders() {
        assertThat(new PlaceholderSubstitutor(Map.of()).substitute("select 1")).isEqualTo("select 1");
    }
}
