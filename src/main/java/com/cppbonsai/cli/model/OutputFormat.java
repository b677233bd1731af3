package com.cppbonsai.cli.model;

/**
 * How a built AST is written to standard output.
 */
public enum OutputFormat {
	/** One line per node, by ascending id. */
	TEXT,
	/** Indented hierarchy from the root. */
	TREE,
	/** JSON document. */
	JSON
}
