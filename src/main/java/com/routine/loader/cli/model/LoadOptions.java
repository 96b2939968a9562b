package com.routine.loader.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for loading stored routines. No validation, no execution
 * logic, no printing.
 */
@Getter
public class LoadOptions {

	@Option(names = { "--source-dir", "-s" }, description = "Directory with the sources of the stored routines")
	private Path sourceDir;

	@Option(names = { "--extension" }, defaultValue = ".psql", description = "Extension of source files (default: ${DEFAULT-VALUE})")
	private String extension;

	@Option(names = { "--recursive", "-r" }, description = "Also search subdirectories of the source directory")
	private boolean recursive;

	@Option(names = { "--metadata-file", "-m" }, description = "JSON file with the metadata of all loaded routines")
	private Path metadataFile;

	@Option(names = { "--placeholders", "-p" }, description = "Properties file with placeholder values, e.g. @TST_ID@=42")
	private Path placeholderFile;

	@Option(names = { "--url" }, description = "JDBC URL of the database, e.g. jdbc:mysql://localhost:3306/test")
	private String url;

	@Option(names = { "--user", "-u" }, description = "Database user")
	private String user;

	@Option(names = { "--password" }, arity = "0..1", interactive = true, description = "Database password (prompted when given without value)")
	private String password;

	@Option(names = {
			"--sql-mode" }, defaultValue = "STRICT_ALL_TABLES,ONLY_FULL_GROUP_BY,NO_ZERO_IN_DATE,NO_ZERO_DATE,ERROR_FOR_DIVISION_BY_ZERO,NO_ENGINE_SUBSTITUTION", description = "SQL mode under which routines are loaded (default: ${DEFAULT-VALUE})")
	private String sqlMode;

	@Option(names = { "--character-set" }, defaultValue = "utf8mb4", description = "Character set of the connection (default: ${DEFAULT-VALUE})")
	private String characterSet;

	@Option(names = { "--collation" }, defaultValue = "utf8mb4_general_ci", description = "Collation of the connection (default: ${DEFAULT-VALUE})")
	private String collation;

	@Parameters(paramLabel = "ROUTINE", arity = "0..*", description = "Load only these routines; obsolete routines are not dropped")
	private List<String> routineNames = new ArrayList<>();

}
