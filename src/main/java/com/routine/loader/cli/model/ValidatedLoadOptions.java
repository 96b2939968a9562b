package com.routine.loader.cli.model;

import com.routine.loader.batch.LoaderConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps LoadCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedLoadOptions {
	LoaderConfig loaderConfig;
	String url;
	String user;
	String password;
}
