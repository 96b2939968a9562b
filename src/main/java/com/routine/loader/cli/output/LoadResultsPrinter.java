package com.routine.loader.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.batch.LoaderConfig;
import com.routine.loader.batch.LoaderResult;
import com.routine.loader.cli.model.ValidatedLoadOptions;
import com.routine.loader.compiler.CompileResult;

/**
 * Responsible only for printing CLI output when loading stored routines.
 * No validation, no execution, no prompting.
 */
public class LoadResultsPrinter {

	private static final Logger log = LoggerFactory.getLogger(LoadResultsPrinter.class);

	public void printBanner(ValidatedLoadOptions v) {
		LoaderConfig config = v.getLoaderConfig();

		log.info("=================================================");
		log.info("Routine Loader");
		log.info("=================================================");
		log.info("Database: {}", v.getUrl());
		log.info("Source Directory: {}", config.getSourceDir());
		log.info("Extension: {}{}", config.getExtension(), config.isRecursive() ? " (recursive)" : "");
		log.info("Metadata File: {}", config.getMetadataFile());
		log.info("Placeholders: {}", config.getPlaceholderFile() != null ? config.getPlaceholderFile().toAbsolutePath() : "None");
		log.info("SQL Mode: {}", config.getSessionSettings().getSqlMode());
		log.info("Character Set: {} collate {}", config.getSessionSettings().getCharacterSet(),
				config.getSessionSettings().getCollation());
		if (config.isSelectiveLoad()) {
			log.info("Routines: {}", String.join(", ", config.getRoutineNames()));
		}
		log.info("=================================================");
	}

	public void printSummary(LoaderResult result) {
		log.info("");
		log.info("=================================================");
		log.info(result.isSuccess() ? "LOADING SUCCESSFUL" : "LOADING FINISHED WITH ERRORS");
		log.info("=================================================");
		log.info("Routines Found: {}", result.getRoutinesFound());
		log.info("Routines Loaded: {}", result.getRoutinesLoaded());
		log.info("Routines Up To Date: {}", result.getRoutinesUpToDate());
		log.info("Warnings: {}", result.getWarningCount());

		if (!result.getDroppedRoutines().isEmpty()) {
			log.info("Obsolete Routines Dropped: {}", String.join(", ", result.getDroppedRoutines()));
		}

		if (!result.getFailures().isEmpty()) {
			log.info("");
			log.error("Failed Routines:");
			for (CompileResult failure : result.getFailures()) {
				log.error("  {} ({}): {}", failure.getRoutineName(), failure.getSourceFile(), failure.getErrorMessage());
			}
		}

		for (String error : result.getBatchErrors()) {
			log.error("  {}", error);
		}
		log.info("=================================================");
	}

	public void printFailure(LoaderResult result) {
		log.error("Loading failed: {}", result.getErrorMessage());
	}
}
