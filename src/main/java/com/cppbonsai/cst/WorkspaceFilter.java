package com.cppbonsai.cst;

import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a top-level cursor belongs to the workspace being analyzed.
 */
public final class WorkspaceFilter {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceFilter.class);

    private WorkspaceFilter() {
        // Utility class
    }

    /**
     * A cursor is accepted when it has a source file and, if a workspace is given, that file lies
     * strictly below the workspace directory. Compiler-synthesized cursors have no file and are
     * always rejected.
     */
    public static boolean accepts(Cursor cursor, Path workspace) {
        Optional<CursorLocation> location = Cursors.safeLocation(cursor);
        if (location.isEmpty()) {
            log.debug("Skipping top-level {} '{}' without a source file", cursor.getKindName(), cursor.getSpelling());
            return false;
        }
        if (workspace == null) {
            return true;
        }
        Path file = Path.of(location.get().getFile()).toAbsolutePath().normalize();
        Path root = workspace.toAbsolutePath().normalize();
        return !file.equals(root) && file.startsWith(root);
    }
}
