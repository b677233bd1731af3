package com.cppbonsai.parser;

import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.Ast;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.Cursors;
import com.cppbonsai.cst.TranslationUnit;
import com.cppbonsai.parser.extract.Dependency;
import com.cppbonsai.parser.extract.ExtractionContext;
import com.cppbonsai.parser.extract.Extractors;
import com.cppbonsai.parser.extract.TranslationUnitExtractor;

/**
 * Entry point that turns a translation-unit cursor into an {@link Ast}.
 *
 * The builder itself holds no per-build state; every call runs its own {@link BuildSession}, so
 * building the same cursor twice gives equal trees.
 */
public class AstBuilder {

    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private final Dispatcher dispatcher;
    private final BuilderConfig config;

    public AstBuilder() {
        this(BuilderConfig.defaults());
    }

    public AstBuilder(BuilderConfig config) {
        this(Extractors.standardTable(), config);
    }

    public AstBuilder(DispatchTable table, BuilderConfig config) {
        this.dispatcher = new Dispatcher(table);
        this.config = Objects.requireNonNull(config, "config");
    }

    public Ast build(Cursor root, Path workspace) {
        return build(root, workspace, new BuildDiagnostics());
    }

    /**
     * Builds the tree for {@code root}, which must be a translation-unit cursor.
     *
     * @param workspace boundary for top-level declarations; null falls back to the configured one
     * @throws com.cppbonsai.parser.extract.InvalidCursorKindException if a strategy receives a
     *         cursor it does not accept, including a root that is not a translation unit
     */
    public Ast build(Cursor root, Path workspace, BuildDiagnostics diagnostics) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Path boundary = workspace != null ? workspace : config.getWorkspace();
        String name = !Cursors.isBlank(config.getName()) ? config.getName() : root.getSpelling();

        TranslationUnitExtractor.INSTANCE.requireAccepted(root);
        ExtractionContext context = ExtractionContext.root(dispatcher, diagnostics, boundary);
        BuildSession session = new BuildSession(name, new Dependency(root, TranslationUnitExtractor.INSTANCE, context));

        log.debug("Building AST for '{}' (workspace: {})", name, boundary != null ? boundary : "none");
        Ast ast = session.drain();
        log.debug("Built AST for '{}' with {} nodes", name, ast.size());
        return ast;
    }

    /**
     * Checks the front end's diagnostics, then builds the unit's tree.
     */
    public Ast build(TranslationUnit unit, Path workspace, BuildDiagnostics diagnostics) {
        Objects.requireNonNull(unit, "unit");
        FrontendDiagnostics.check(unit, diagnostics);
        return build(unit.getCursor(), workspace, diagnostics);
    }

    public BuilderConfig getConfig() {
        return config;
    }
}
