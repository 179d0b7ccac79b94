package com.wiregen.core.model;

import java.util.Objects;

/**
 * Content of one source file in a declaration snapshot.
 *
 * @param path path relative to its source root, using {@code /} separators
 * @param content file content
 */
public record SourceUnit(String path, String content) {

    public SourceUnit {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
        path = path.replace('\\', '/');
    }
}
