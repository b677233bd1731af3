package com.cppbonsai.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.cli.model.BuildOptions;
import com.cppbonsai.cli.model.ValidatedBuildOptions;
import com.cppbonsai.parser.BuildDiagnostics;

/**
 * Responsible only for the log output of the build command: banner, summary and failures.
 * The trees themselves go to the command's standard output.
 */
public class BuildResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BuildResultsPrinter.class);

    public void printBanner(BuildOptions o, ValidatedBuildOptions v) {
        log.info("=================================================");
        log.info("cppbonsai");
        log.info("=================================================");
        log.info("Fixtures: {}", v.getFiles().size());
        log.info("Workspace: {}", v.getWorkspace() != null ? v.getWorkspace() : "from fixture");
        log.info("Mode: {}", o.isPrintOnly() ? "CST dump" : "AST (" + o.getFormat() + ")");
        log.info("=================================================");
    }

    public void printSummary(int built, int failed, BuildDiagnostics diagnostics) {
        log.info("");
        log.info("=================================================");
        log.info(failed == 0 ? "BUILD SUCCESSFUL" : "BUILD FINISHED WITH FAILURES");
        log.info("=================================================");
        log.info("Trees built: {}", built);
        log.info("Failures: {}", failed);
        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            diagnostics.getWarnings().forEach(w -> log.warn("  {}", w));
        }
        diagnostics.getInfos().forEach(i -> log.debug("  {}", i));
        log.info("=================================================");
    }

    public void printValidationErrors(Iterable<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  {}", e));
    }
}
