package com.cppbonsai.ast;

import lombok.Value;

/**
 * Position of a construct in its source file. Missing parts default to an empty file name and zero
 * line/column; a location is never null.
 */
@Value
public class SourceLocation {

    public static final SourceLocation EMPTY = new SourceLocation("", 0, 0);

    String file;
    int line;
    int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file != null ? file : "";
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    public static SourceLocation ofFile(String file) {
        return new SourceLocation(file, 0, 0);
    }

    public boolean isEmpty() {
        return file.isEmpty() && line == 0 && column == 0;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
