package com.cppbonsai;

import com.cppbonsai.cli.BuildCommand;
import picocli.CommandLine;

/**
 * Main entry point for cppbonsai.
 * Reads recorded C++ syntax trees and prints the normalized AST for each of them.
 */
public class BonsaiApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BuildCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
