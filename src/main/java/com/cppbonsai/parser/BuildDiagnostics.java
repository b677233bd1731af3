package com.cppbonsai.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal findings accumulated during one or more builds. Warnings are front-end errors and
 * unmatched call arguments; infos note nodes built with the zero location.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class BuildDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
