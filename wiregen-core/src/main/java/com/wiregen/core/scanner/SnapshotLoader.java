package com.wiregen.core.scanner;

import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.SourceUnit;
import com.wiregen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every {@code .java} file under a set of source roots into a {@link DeclarationSnapshot}.
 */
public final class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final String JAVA_SOURCES = "**.java";

    private SnapshotLoader() {
        // Utility class
    }

    /**
     * Loads the snapshot. Missing roots are skipped with a warning.
     *
     * @param sourceRoots source directories
     * @return snapshot of all Java sources, paths relative to their root
     * @throws IOException if a source file cannot be read
     */
    public static DeclarationSnapshot load(List<Path> sourceRoots) throws IOException {
        List<SourceUnit> units = new ArrayList<>();
        for (Path root : sourceRoots) {
            if (!Files.isDirectory(root)) {
                log.warn("Source root does not exist or is not a directory: {}", root);
                continue;
            }
            List<Path> files = FileUtils.findFiles(root, JAVA_SOURCES);
            log.debug("Found {} Java files under {}", files.size(), root);
            for (Path file : files) {
                units.add(new SourceUnit(FileUtils.relativeUnixPath(root, file), Files.readString(file)));
            }
        }
        log.info("Loaded {} source files from {} source root(s)", units.size(), sourceRoots.size());
        return new DeclarationSnapshot(units);
    }
}
