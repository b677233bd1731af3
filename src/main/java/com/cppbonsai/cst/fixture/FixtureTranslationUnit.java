package com.cppbonsai.cst.fixture;

import java.nio.file.Path;
import java.util.List;

import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.FrontendDiagnostic;
import com.cppbonsai.cst.TranslationUnit;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A translation unit replayed from a fixture, with the workspace the fixture was recorded in.
 */
@Value
@Builder
public class FixtureTranslationUnit implements TranslationUnit {

    @NonNull
    Cursor cursor;

    @Singular
    List<FrontendDiagnostic> diagnostics;

    /** Workspace recorded in the fixture; null when none was given. */
    Path workspace;
}
