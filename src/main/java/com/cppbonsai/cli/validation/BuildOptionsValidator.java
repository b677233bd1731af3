package com.cppbonsai.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cppbonsai.cli.exception.OptionsValidationException;
import com.cppbonsai.cli.model.BuildOptions;
import com.cppbonsai.cli.model.ValidatedBuildOptions;

public class BuildOptionsValidator {

	public ValidatedBuildOptions validate(BuildOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getVerbosity() < 0) {
			errors.add("Verbosity must be >= 0. Got: " + o.getVerbosity());
		}

		List<Path> files = new ArrayList<>();
		List<Path> rejected = new ArrayList<>();
		if (o.getFiles() == null || o.getFiles().isEmpty()) {
			errors.add("At least one CST fixture file is required.");
		} else {
			for (Path file : o.getFiles()) {
				Path normalized = file.toAbsolutePath().normalize();
				if (!Files.isRegularFile(normalized)) {
					errors.add("CST fixture does not exist or is not a file: " + file);
					rejected.add(file);
				} else {
					files.add(normalized);
				}
			}
		}

		Path workspace = null;
		if (o.getWorkspace() != null) {
			workspace = o.getWorkspace().toAbsolutePath().normalize();
			if (!Files.isDirectory(workspace)) {
				errors.add("Workspace does not exist or is not a directory: " + o.getWorkspace());
			}
		}

		if (o.getName() != null && o.getName().isBlank()) {
			errors.add("Tree name must not be blank (--name).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors, rejected);
		}

		return new ValidatedBuildOptions(List.copyOf(files), workspace, o.getVerbosity() > 0);
	}
}
