package com.cppbonsai.cst;

import lombok.Value;

/**
 * Location as reported by the front end. {@code file} is null for compiler-synthesized cursors.
 */
@Value
public class CursorLocation {
    String file;
    int line;
    int column;

    public boolean hasFile() {
        return file != null && !file.isEmpty();
    }
}
