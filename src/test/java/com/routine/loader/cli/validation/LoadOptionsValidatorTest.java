package com.routine.loader.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.routine.loader.batch.LoaderConfig;
import com.routine.loader.cli.exception.OptionsValidationException;
import com.routine.loader.cli.model.LoadOptions;
import com.routine.loader.cli.model.ValidatedLoadOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LoadOptionsValidator.
 */
class LoadOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final LoadOptionsValidator validator = new LoadOptionsValidator();

    private static LoadOptions parse(String... args) {
        LoadOptions options = new LoadOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptionsWithDefaults() {
        ValidatedLoadOptions validated = validator.validate(parse(
                "--source-dir", tempDir.toString(),
                "--url", "jdbc:mysql://localhost:3306/test",
                "--user", "test"));

        LoaderConfig config = validated.getLoaderConfig();
        assertThat(config.getSourceDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(config.getExtension()).isEqualTo(".psql");
        assertThat(config.isRecursive()).isFalse();
        assertThat(config.getMetadataFile()).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("routines.json"));
        assertThat(config.getSessionSettings().getCharacterSet()).isEqualTo("utf8mb4");
        assertThat(config.getSessionSettings().getCollation()).isEqualTo("utf8mb4_general_ci");
        assertThat(config.getSessionSettings().getSqlMode()).contains("STRICT_ALL_TABLES");
        assertThat(config.isSelectiveLoad()).isFalse();
        assertThat(validated.getUrl()).isEqualTo("jdbc:mysql://localhost:3306/test");
        assertThat(validated.getUser()).isEqualTo("test");
    }

    @Test
    void testSelectiveLoadAndExplicitOptions() throws IOException {
        Path placeholders = Files.writeString(tempDir.resolve("placeholders.properties"), "@TST_ID@=1\n");
        Path metadata = tempDir.resolve("out").resolve("metadata.json");

        ValidatedLoadOptions validated = validator.validate(parse(
                "-s", tempDir.toString(),
                "--url", "jdbc:mysql://localhost/test",
                "--extension", ".sql",
                "--recursive",
                "--metadata-file", metadata.toString(),
                "--placeholders", placeholders.toString(),
                "--sql-mode", " ANSI ",
                "tst_a", "tst_b"));

        LoaderConfig config = validated.getLoaderConfig();
        assertThat(config.getExtension()).isEqualTo(".sql");
        assertThat(config.isRecursive()).isTrue();
        assertThat(config.getMetadataFile()).isEqualTo(metadata.toAbsolutePath().normalize());
        assertThat(config.getPlaceholderFile()).isEqualTo(placeholders);
        assertThat(config.getSessionSettings().getSqlMode()).isEqualTo("ANSI");
        assertThat(config.getRoutineNames()).containsExactly("tst_a", "tst_b");
        assertThat(config.isSelectiveLoad()).isTrue();
    }

    @Test
    void testAllErrorsAreReportedAtOnce() {
        LoadOptions options = parse(
                "--source-dir", tempDir.resolve("missing").toString(),
                "--url", "mysql://localhost/test",
                "--extension", "psql",
                "--placeholders", tempDir.resolve("missing.properties").toString(),
                "tst-bad");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(5)
                        .anyMatch(error -> error.startsWith("Source directory does not exist"))
                        .anyMatch(error -> error.startsWith("Database URL must be a JDBC URL"))
                        .anyMatch(error -> error.startsWith("Extension must start with a dot"))
                        .anyMatch(error -> error.startsWith("Placeholder file does not exist"))
                        .anyMatch(error -> error.equals("Invalid routine name: tst-bad")));
    }

    @Test
    void testRequiredOptions() {
        assertThatThrownBy(() -> validator.validate(parse()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Source directory is required")
                .hasMessageContaining("Database URL is required");
    }
}
