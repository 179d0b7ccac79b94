package com.wiregen.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * File system helpers for reading source trees and writing generated files.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files under {@code rootPath} whose path relative to the root matches a glob,
     * sorted by path.
     *
     * @param rootPath directory to search
     * @param globPattern glob such as {@code **.java}
     * @return matching files
     * @throws IOException if the tree cannot be walked
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Relative path with {@code /} separators on every platform.
     */
    public static String relativeUnixPath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Writes {@code content} unless the file already holds exactly that content.
     *
     * @return true if the file was written
     * @throws IOException if reading or writing fails
     */
    public static boolean writeIfChanged(Path file, String content) throws IOException {
        if (Files.isRegularFile(file) && Files.readString(file).equals(content)) {
            return false;
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content);
        return true;
    }
}
