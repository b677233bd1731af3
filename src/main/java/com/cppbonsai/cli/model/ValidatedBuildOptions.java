package com.cppbonsai.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps BuildCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBuildOptions {
    List<Path> files;
    Path workspace;
    boolean verboseDump;
}
