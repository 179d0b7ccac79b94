package com.wiregen.core.graph;

import com.wiregen.core.WiringTestBase;
import com.wiregen.core.diagnostic.DiagnosticCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CycleDetectorTest extends WiringTestBase {

    private final CycleDetector detector = new CycleDetector();

    @Test
    void detect_threeServiceCycle_reportsPath() {
        // Given: A -> B -> C -> A
        service("A", "B");
        service("B", "C");
        service("C", "A");

        // When
        List<List<String>> cycles = detector.detect(buildGraph(), reporter);

        // Then
        assertThat(cycles).containsExactly(List.of("com.acme.A", "com.acme.B", "com.acme.C", "com.acme.A"));
        assertThat(diagnostics(DiagnosticCode.CYCLE_DETECTED)).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("Circular dependency detected: A → B → C → A");
            assertThat(d.types()).containsExactly("com.acme.A", "com.acme.B", "com.acme.C");
            assertThat(d.location()).isEqualTo("com/acme/A.java");
        });
    }

    @Test
    void detect_acyclicGraph_reportsNothing() {
        service("A", "B");
        service("B", "C");
        service("C", null);

        assertThat(detector.detect(buildGraph(), reporter)).isEmpty();
        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void detect_selfDependency_isACycle() {
        service("A", "A");

        List<List<String>> cycles = detector.detect(buildGraph(), reporter);

        assertThat(cycles).containsExactly(List.of("com.acme.A", "com.acme.A"));
    }

    @Test
    void detect_collectionEdges_doNotFormCycles() {
        source("com/acme/IHandler.java", "package com.acme; public interface IHandler { }");
        source("com/acme/Pipeline.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;
            import java.util.List;

            @DependsOn(types = "List<IHandler>")
            public class Pipeline implements IHandler {
            }
            """);

        assertThat(detector.detect(buildGraph(), reporter)).isEmpty();
    }

    @Test
    void detect_twoDisjointCycles_reportsBoth() {
        service("A", "B");
        service("B", "A");
        service("X", "Y");
        service("Y", "X");

        List<List<String>> cycles = detector.detect(buildGraph(), reporter);

        assertThat(cycles).hasSize(2);
        assertThat(diagnostics(DiagnosticCode.CYCLE_DETECTED)).extracting(d -> d.message())
            .containsExactly("Circular dependency detected: A → B → A",
                "Circular dependency detected: X → Y → X");
    }

    @Test
    void detect_deepChain_doesNotOverflow() {
        int depth = 2_000;
        for (int i = 0; i < depth; i++) {
            service("S" + i, i + 1 < depth ? "S" + (i + 1) : null);
        }

        assertThat(detector.detect(buildGraph(), reporter)).isEmpty();
    }

    private void service(String name, String dependency) {
        String dependsOn = dependency != null ? "@com.wiregen.api.DependsOn(" + dependency + ".class)\n" : "";
        source("com/acme/" + name + ".java",
            "package com.acme;\n\n@com.wiregen.api.Scoped\n" + dependsOn + "public class " + name + " {\n}\n");
    }
}
