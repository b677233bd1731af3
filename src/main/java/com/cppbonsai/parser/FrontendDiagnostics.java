package com.cppbonsai.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.cst.FrontendDiagnostic;
import com.cppbonsai.cst.TranslationUnit;

/**
 * Surfaces problems the front end reported while parsing. They are informational: the build goes
 * on with whatever CST the front end produced.
 */
public final class FrontendDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(FrontendDiagnostics.class);

    private FrontendDiagnostics() {
        // Utility class
    }

    /**
     * Logs ERROR and FATAL diagnostics and copies them into {@code diagnostics}.
     *
     * @return number of problems found
     */
    public static int check(TranslationUnit unit, BuildDiagnostics diagnostics) {
        int problems = 0;
        for (FrontendDiagnostic diagnostic : unit.getDiagnostics()) {
            if (diagnostic.getSeverity().isAtLeast(FrontendDiagnostic.Severity.ERROR)) {
                log.warn("Front end reported {}: {}", diagnostic.getSeverity(), diagnostic.getSpelling());
                diagnostics.warn("frontend " + diagnostic.getSeverity().name().toLowerCase() + ": "
                        + diagnostic.getSpelling());
                problems++;
            }
        }
        return problems;
    }
}
