package com.wiregen.core.scanner;

import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.SourceUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_nestedSources_returnsRelativeSortedUnits() throws IOException {
        // Given
        Path root = tempDir.resolve("src/main/java");
        write(root.resolve("com/acme/b/Worker.java"), "package com.acme.b; class Worker { }");
        write(root.resolve("com/acme/Api.java"), "package com.acme; interface Api { }");
        write(root.resolve("Main.java"), "class Main { }");
        write(root.resolve("com/acme/readme.md"), "# not java");

        // When
        DeclarationSnapshot snapshot = SnapshotLoader.load(List.of(root));

        // Then
        assertThat(snapshot.units()).extracting(SourceUnit::path)
            .containsExactly("Main.java", "com/acme/Api.java", "com/acme/b/Worker.java");
        assertThat(snapshot.units().get(1).content()).isEqualTo("package com.acme; interface Api { }");
    }

    @Test
    void load_severalRoots_mergesUnits() throws IOException {
        Path main = tempDir.resolve("main");
        Path generated = tempDir.resolve("generated");
        write(main.resolve("a/One.java"), "package a; class One { }");
        write(generated.resolve("b/Two.java"), "package b; class Two { }");

        DeclarationSnapshot snapshot = SnapshotLoader.load(List.of(main, generated));

        assertThat(snapshot.units()).extracting(SourceUnit::path).containsExactly("a/One.java", "b/Two.java");
    }

    @Test
    void load_missingRoot_isSkipped() throws IOException {
        DeclarationSnapshot snapshot = SnapshotLoader.load(List.of(tempDir.resolve("does-not-exist")));

        assertThat(snapshot.isEmpty()).isTrue();
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
