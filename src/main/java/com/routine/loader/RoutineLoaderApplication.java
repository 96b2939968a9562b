package com.routine.loader;

import com.routine.loader.cli.LoadCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Routine Loader.
 * Loads stored routines from source files into MySQL and writes the metadata
 * a wrapper generator needs to call them.
 */
public class RoutineLoaderApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LoadCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
