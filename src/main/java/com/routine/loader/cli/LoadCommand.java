package com.routine.loader.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.batch.LoaderResult;
import com.routine.loader.batch.RoutineLoader;
import com.routine.loader.cli.exception.OptionsValidationException;
import com.routine.loader.cli.model.LoadOptions;
import com.routine.loader.cli.model.ValidatedLoadOptions;
import com.routine.loader.cli.output.LoadResultsPrinter;
import com.routine.loader.cli.validation.LoadOptionsValidator;
import com.routine.loader.database.DataLayer;
import com.routine.loader.database.DatabaseUnavailableException;
import com.routine.loader.database.JdbcDataLayer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.PropertiesDefaultProvider;

/**
 * CLI command for loading stored routines into a MySQL database.
 */
@Command(
		name = "routine-loader",
		mixinStandardHelpOptions = true,
		version = "routine-loader 1.0.0",
		defaultValueProvider = PropertiesDefaultProvider.class,
		description = "Loads stored routine sources into a MySQL database and records the metadata needed for wrapper generation."
)
public class LoadCommand implements Callable<Integer> {

	private static final Logger log = LoggerFactory.getLogger(LoadCommand.class);

	@Mixin
	private LoadOptions options = new LoadOptions();

	private final LoadOptionsValidator validator = new LoadOptionsValidator();
	private final LoadResultsPrinter printer = new LoadResultsPrinter();

	@Override
	public Integer call() {
		ValidatedLoadOptions validated;
		try {
			validated = validator.validate(options);
		} catch (OptionsValidationException e) {
			e.getErrors().forEach(error -> log.error(error));
			return 1;
		}

		printer.printBanner(validated);

		try (DataLayer dataLayer = JdbcDataLayer.connect(validated.getUrl(), validated.getUser(),
				validated.getPassword())) {
			LoaderResult result = new RoutineLoader(validated.getLoaderConfig(), dataLayer).load();
			if (result.getErrorMessage() != null) {
				printer.printFailure(result);
				return 1;
			}
			printer.printSummary(result);
			return result.isSuccess() ? 0 : 1;
		} catch (DatabaseUnavailableException e) {
			log.error("Database unavailable: {}", e.getMessage());
			return 1;
		}
	}
}
