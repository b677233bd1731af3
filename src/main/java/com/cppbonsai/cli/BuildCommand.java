package com.cppbonsai.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.Ast;
import com.cppbonsai.ast.AstJsonWriter;
import com.cppbonsai.ast.AstPrinter;
import com.cppbonsai.cli.exception.OptionsValidationException;
import com.cppbonsai.cli.model.BuildOptions;
import com.cppbonsai.cli.model.OutputFormat;
import com.cppbonsai.cli.model.ValidatedBuildOptions;
import com.cppbonsai.cli.output.BuildResultsPrinter;
import com.cppbonsai.cli.validation.BuildOptionsValidator;
import com.cppbonsai.cst.CursorFormatter;
import com.cppbonsai.cst.fixture.FixtureLoader;
import com.cppbonsai.cst.fixture.FixtureTranslationUnit;
import com.cppbonsai.parser.AstBuilder;
import com.cppbonsai.parser.BuildDiagnostics;
import com.cppbonsai.parser.BuilderConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that normalizes recorded C++ syntax trees.
 */
@Command(
        name = "cppbonsai",
        mixinStandardHelpOptions = true,
        version = "cppbonsai 0.1.0",
        description = "Builds a normalized, attributed AST from recorded C++ front-end syntax trees."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private BuildOptions options = new BuildOptions();

    @Spec
    private CommandSpec spec;

    private final BuildOptionsValidator validator = new BuildOptionsValidator();
    private final BuildResultsPrinter printer = new BuildResultsPrinter();
    private final FixtureLoader loader = new FixtureLoader();

    @Override
    public Integer call() {
        configureLogging(options.getVerbosity());

        ValidatedBuildOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.debug("Rejected fixtures: {}", e.getRejectedFixtures());
            printer.printValidationErrors(e.getErrors());
            return 1;
        }
        printer.printBanner(options, validated);

        PrintWriter out = spec.commandLine().getOut();
        AstBuilder builder = new AstBuilder(BuilderConfig.builder().name(options.getName()).build());
        BuildDiagnostics diagnostics = new BuildDiagnostics();
        int built = 0;
        int failed = 0;

        for (Path file : validated.getFiles()) {
            try {
                FixtureTranslationUnit unit = loader.load(file);
                Path workspace = validated.getWorkspace() != null ? validated.getWorkspace() : unit.getWorkspace();
                out.println("[AST] " + file);
                if (options.isPrintOnly()) {
                    out.println(CursorFormatter.dump(unit.getCursor(), workspace, validated.isVerboseDump()));
                } else {
                    Ast ast = builder.build(unit, workspace, diagnostics);
                    out.println(render(ast, options.getFormat()));
                    built++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to process {}: {}", file, e.getMessage());
                log.debug("Failure details", e);
                failed++;
            }
        }
        out.flush();

        printer.printSummary(built, failed, diagnostics);
        return failed == 0 ? 0 : 1;
    }

    static String render(Ast ast, OutputFormat format) {
        return switch (format) {
            case TEXT -> AstPrinter.render(ast);
            case TREE -> AstPrinter.renderTree(ast);
            case JSON -> AstJsonWriter.toJson(ast);
        };
    }

    /**
     * Raises the level of the application's loggers: 0 keeps the configured level, 1 enables
     * DEBUG, 2 and above TRACE.
     */
    static void configureLogging(int verbosity) {
        if (verbosity <= 0) {
            return;
        }
        org.slf4j.Logger appLogger = LoggerFactory.getLogger("com.cppbonsai");
        if (appLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(verbosity == 1 ? Level.DEBUG : Level.TRACE);
        } else {
            log.warn("Cannot change log level: SLF4J is not bound to Logback");
        }
    }
}
