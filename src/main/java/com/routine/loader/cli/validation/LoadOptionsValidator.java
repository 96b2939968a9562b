package com.routine.loader.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.routine.loader.batch.LoaderConfig;
import com.routine.loader.cli.exception.OptionsValidationException;
import com.routine.loader.cli.model.LoadOptions;
import com.routine.loader.cli.model.ValidatedLoadOptions;
import com.routine.loader.model.SessionSettings;

public class LoadOptionsValidator {

	private static final Pattern ROUTINE_NAME = Pattern.compile("[a-zA-Z0-9_]+");
	private static final String DEFAULT_METADATA_FILE = "routines.json";

	public ValidatedLoadOptions validate(LoadOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSourceDir() == null) {
			errors.add("Source directory is required (--source-dir / -s).");
		} else if (!existsDirectory(o.getSourceDir())) {
			errors.add("Source directory does not exist or is not a directory: " + o.getSourceDir());
		}

		if (isBlank(o.getExtension())) {
			errors.add("Extension must not be empty (--extension).");
		} else if (!o.getExtension().startsWith(".")) {
			errors.add("Extension must start with a dot. Got: " + o.getExtension());
		}

		if (isBlank(o.getUrl())) {
			errors.add("Database URL is required (--url).");
		} else if (!o.getUrl().startsWith("jdbc:")) {
			errors.add("Database URL must be a JDBC URL. Got: " + o.getUrl());
		}

		if (o.getPlaceholderFile() != null && !Files.isRegularFile(o.getPlaceholderFile())) {
			errors.add("Placeholder file does not exist: " + o.getPlaceholderFile());
		}

		if (isBlank(o.getSqlMode())) {
			errors.add("SQL mode must not be empty (--sql-mode).");
		}
		if (isBlank(o.getCharacterSet())) {
			errors.add("Character set must not be empty (--character-set).");
		}
		if (isBlank(o.getCollation())) {
			errors.add("Collation must not be empty (--collation).");
		}

		List<String> routineNames = o.getRoutineNames() == null ? List.of() : List.copyOf(o.getRoutineNames());
		for (String routineName : routineNames) {
			if (!ROUTINE_NAME.matcher(routineName).matches()) {
				errors.add("Invalid routine name: " + routineName);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path sourceDir = o.getSourceDir().toAbsolutePath().normalize();
		Path metadataFile = (o.getMetadataFile() == null ? sourceDir.resolve(DEFAULT_METADATA_FILE)
				: o.getMetadataFile()).toAbsolutePath().normalize();

		LoaderConfig config = LoaderConfig.builder()
				.sourceDir(sourceDir)
				.extension(o.getExtension())
				.recursive(o.isRecursive())
				.metadataFile(metadataFile)
				.placeholderFile(o.getPlaceholderFile())
				.sessionSettings(new SessionSettings(o.getSqlMode().trim(), o.getCharacterSet().trim(),
						o.getCollation().trim()))
				.routineNames(routineNames)
				.build();

		return new ValidatedLoadOptions(config, o.getUrl(), o.getUser(), o.getPassword());
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
