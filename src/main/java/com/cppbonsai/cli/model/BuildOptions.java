package com.cppbonsai.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the build command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class BuildOptions {

	@Option(names = { "--verbosity",
			"-v" }, paramLabel = "N", defaultValue = "0", description = "Verbosity level: 1 adds debug logs and verbose CST dumps, 2 adds trace logs")
	private int verbosity;

	@Option(names = { "--print" }, description = "Print only the filtered CST instead of building the AST")
	private boolean printOnly;

	@Option(names = { "--format",
			"-f" }, defaultValue = "TREE", description = "AST output format: TEXT, TREE or JSON (default: TREE)")
	private OutputFormat format;

	@Option(names = { "--workspace",
			"-w" }, description = "Only keep top-level declarations from files inside this directory (defaults to the fixture's workspace)")
	private Path workspace;

	@Option(names = { "--name" }, description = "Name given to the built trees instead of the translation unit spelling")
	private String name;

	@Parameters(paramLabel = "FILE", arity = "1..*", description = "CST fixture files (JSON)")
	private List<Path> files = new ArrayList<>();
}
