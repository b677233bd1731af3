package com.cppbonsai.cli.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Collects every problem found in the build options, plus the CST fixtures
 * that were rejected, so a single run reports all of them at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;
	private final transient List<Path> rejectedFixtures;

	public OptionsValidationException(List<String> errors, List<Path> rejectedFixtures) {
		super(errors.size() + " invalid build option(s): " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
		this.rejectedFixtures = List.copyOf(rejectedFixtures);
	}

	public List<String> getErrors() {
		return errors;
	}

	public List<Path> getRejectedFixtures() {
		return rejectedFixtures;
	}
}
