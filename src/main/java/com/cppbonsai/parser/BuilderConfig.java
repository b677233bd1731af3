package com.cppbonsai.parser;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for {@link AstBuilder}.
 */
@Data
@Builder
public class BuilderConfig {

    /**
     * Default workspace boundary, used when a build call passes none.
     * Only top-level declarations located strictly inside it are kept.
     */
    private Path workspace;

    /**
     * Name given to built trees instead of the translation unit's spelling.
     */
    private String name;

    public static BuilderConfig defaults() {
        return builder().build();
    }
}
