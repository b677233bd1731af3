package com.cppbonsai.parser.extract;

import java.nio.file.Path;
import java.util.Optional;

import com.cppbonsai.cst.Cursor;
import com.cppbonsai.parser.BuildDiagnostics;
import com.cppbonsai.parser.Dispatcher;
import com.cppbonsai.parser.Position;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Information a parent hands down to a child strategy.
 *
 * Scope, index and paired cursor apply to one child only; {@link #child(Cursor, Position)} resets
 * the index and paired cursor while keeping the owning scope.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionContext {

    public static final int NO_INDEX = -1;

    @NonNull
    Dispatcher dispatcher;

    @NonNull
    BuildDiagnostics diagnostics;

    /** Workspace boundary for top-level declarations; null keeps every declaration with a file. */
    Path workspace;

    /** Symbol of the owning namespace or class, null at file level. */
    @With
    String scope;

    /** Argument or parameter position of the child, {@link #NO_INDEX} when it has none. */
    @With
    @Builder.Default
    int index = NO_INDEX;

    /** Initializer expression paired with a member reference in a constructor's init list. */
    @With
    Cursor paired;

    public static ExtractionContext root(Dispatcher dispatcher, BuildDiagnostics diagnostics, Path workspace) {
        return builder().dispatcher(dispatcher).diagnostics(diagnostics).workspace(workspace).build();
    }

    public boolean hasIndex() {
        return index != NO_INDEX;
    }

    public Optional<String> findScope() {
        return Optional.ofNullable(scope).filter(s -> !s.isBlank());
    }

    /**
     * Context a nested child starts from: same scope, no index, nothing paired.
     */
    public ExtractionContext inherit() {
        return toBuilder().index(NO_INDEX).paired(null).build();
    }

    public Optional<Dependency> child(Cursor cursor, Position position) {
        return dispatcher.dispatch(cursor, position, inherit());
    }

    public Optional<Dependency> child(Cursor cursor, Position position, ExtractionContext childContext) {
        return dispatcher.dispatch(cursor, position, childContext);
    }
}
