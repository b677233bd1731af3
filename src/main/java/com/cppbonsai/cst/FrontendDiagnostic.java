package com.cppbonsai.cst;

import lombok.Value;

/**
 * A problem reported by the front end while it produced the CST.
 */
@Value
public class FrontendDiagnostic {

    public enum Severity {
        IGNORED,
        NOTE,
        WARNING,
        ERROR,
        FATAL;

        public boolean isAtLeast(Severity other) {
            return compareTo(other) >= 0;
        }
    }

    Severity severity;
    String spelling;
}
