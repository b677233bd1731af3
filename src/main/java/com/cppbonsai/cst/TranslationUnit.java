package com.cppbonsai.cst;

import java.util.List;

/**
 * An already parsed translation unit handed over by the front end.
 */
public interface TranslationUnit {

    /** Root cursor, of kind {@link CursorKind#TRANSLATION_UNIT}. */
    Cursor getCursor();

    List<FrontendDiagnostic> getDiagnostics();
}
