package com.cppbonsai.parser.extract;

import com.cppbonsai.cst.Cursor;

import lombok.NonNull;
import lombok.Value;

/**
 * A child still to be built: the cursor, the strategy chosen for it and the context it inherits.
 */
@Value
public class Dependency {
    @NonNull
    Cursor cursor;
    @NonNull
    Extractor extractor;
    @NonNull
    ExtractionContext context;
}
