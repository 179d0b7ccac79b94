package com.wiregen.core.generator.impl;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.wiregen.core.WiringTestBase;
import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.engine.AnalysisResult;
import com.wiregen.core.engine.WiringEngine;
import com.wiregen.core.generator.GenerationInput;
import com.wiregen.core.generator.GeneratorConfig;
import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.ConfigurationValueType;
import com.wiregen.core.naming.ConfigurationBinding;
import com.wiregen.core.renderer.GeneratedFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ConstructorGenerator}.
 */
class ConstructorGeneratorTest extends WiringTestBase {

    private final ConstructorGenerator generator = new ConstructorGenerator();

    private final JavaParser javaParser = new JavaParser(new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Test
    void generate_serviceWithDependencies_addsFieldsAndConstructor() {
        // Given
        source("com/acme/Orders.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;
            import com.wiregen.api.Inject;
            import com.wiregen.api.Scoped;

            @Scoped
            @DependsOn(IOrderRepository.class)
            public class Orders {
                @Inject
                private Clock _clock;

                public void place() {
                }
            }
            """);
        source("com/acme/IOrderRepository.java", "package com.acme; public interface IOrderRepository { }");
        source("com/acme/Clock.java", "package com.acme; public class Clock { }");

        // When
        List<GeneratedFile> files = generator.generate(input(), GeneratorConfig.defaults(), reporter);

        // Then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("com/acme/Orders.java");
            assertThat(file.generatorId()).isEqualTo("constructors");
            assertThat(file.content())
                .contains("private final com.acme.IOrderRepository _orderRepository;")
                .contains("public Orders(com.acme.IOrderRepository orderRepository, com.acme.Clock clock) {")
                .contains("this._orderRepository = orderRepository;")
                .contains("this._clock = clock;")
                .contains("@DependsOn(IOrderRepository.class)");
        });

        ClassOrInterfaceDeclaration orders = parse(files.get(0).content()).getClassByName("Orders").orElseThrow();
        assertThat(orders.getMember(0).isFieldDeclaration()).isTrue();
        assertThat(orders.getMember(1).isFieldDeclaration()).isTrue();
        assertThat(orders.getMember(2).isConstructorDeclaration()).isTrue();
        assertThat(orders.getMember(3).isMethodDeclaration()).isTrue();
        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void generate_derivedClass_forwardsToBaseConstructor() {
        source("com/acme/Repository.java", """
            package com.acme;

            import com.wiregen.api.Inject;

            public abstract class Repository<T> {
                @Inject
                private IStore<T> store;
            }
            """);
        source("com/acme/Orders.java", """
            package com.acme;

            @com.wiregen.api.Scoped
            @com.wiregen.api.DependsOn(Clock.class)
            public class Orders extends Repository<Order> {
            }
            """);
        source("com/acme/IStore.java", "package com.acme; public interface IStore<E> { }");
        source("com/acme/Order.java", "package com.acme; public class Order { }");
        source("com/acme/Clock.java", "package com.acme; public class Clock { }");

        List<GeneratedFile> files = generator.generate(input(), GeneratorConfig.defaults(), reporter);

        assertThat(files).extracting(GeneratedFile::relativePath)
            .containsExactly("com/acme/Orders.java", "com/acme/Repository.java");

        ConstructorDeclaration base = parse(files.get(1).content()).getClassByName("Repository").orElseThrow()
            .getConstructors().get(0);
        assertThat(base.isProtected()).isTrue();
        assertThat(base.getParameter(0).getTypeAsString()).isEqualTo("com.acme.IStore<T>");

        ConstructorDeclaration derived = parse(files.get(0).content()).getClassByName("Orders").orElseThrow()
            .getConstructors().get(0);
        assertThat(derived.getParameters()).extracting(p -> p.getNameAsString())
            .containsExactly("store", "clock");
        assertThat(derived.getParameter(0).getTypeAsString()).isEqualTo("com.acme.IStore<com.acme.Order>");
        assertThat(derived.getBody().getStatement(0).toString()).isEqualTo("super(store);");
        assertThat(derived.getBody().getStatement(1).toString()).isEqualTo("this._clock = clock;");
    }

    @Test
    void generate_failingClass_doesNotAffectOthersInUnit() {
        source("com/acme/Services.java", """
            package com.acme;

            @com.wiregen.api.DependsOn(Clock.class)
            class Broken {
                private Object _clock;
            }

            @com.wiregen.api.DependsOn(Clock.class)
            class Fine {
            }
            """);
        source("com/acme/Clock.java", "package com.acme; public class Clock { }");

        List<GeneratedFile> files = generator.generate(input(), GeneratorConfig.defaults(), reporter);

        assertThat(diagnostics(DiagnosticCode.EMISSION_FAILED)).singleElement()
            .satisfies(d -> assertThat(d.message())
                .isEqualTo("Code generation for 'Broken' failed: field '_clock' is already declared"));
        assertThat(files).singleElement().satisfies(file -> {
            CompilationUnit cu = parse(file.content());
            assertThat(cu.getClassByName("Fine").orElseThrow().getConstructors()).hasSize(1);
            assertThat(cu.getClassByName("Broken").orElseThrow().getConstructors()).isEmpty();
        });
    }

    @Test
    void generate_noLayouts_producesNothing() {
        source("com/acme/Clock.java", "package com.acme; @com.wiregen.api.Singleton public class Clock { }");

        assertThat(generator.generate(input(), GeneratorConfig.defaults(), reporter)).isEmpty();
    }

    @Test
    void generate_configurationFields_assignConvertedValues() {
        source("com/acme/MailSender.java", """
            package com.acme;

            import com.wiregen.api.InjectConfiguration;
            import com.wiregen.api.Singleton;

            @Singleton
            public class MailSender {
                @InjectConfiguration("mail.host")
                private final String host;
                @InjectConfiguration(value = "mail.port", defaultValue = "25")
                private final int port;
                @InjectConfiguration(value = "mail.timeout", required = false)
                private Long timeout;
            }
            """);

        List<GeneratedFile> files = generator.generate(input(), GeneratorConfig.defaults(), reporter);

        assertThat(files).singleElement().satisfies(file -> assertThat(file.content())
            .contains("public MailSender(com.wiregen.api.container.Configuration configuration) {")
            .contains("this.host = configuration.require(\"mail.host\");")
            .contains("this.port = Integer.parseInt(configuration.getOrDefault(\"mail.port\", \"25\"));")
            .contains("this.timeout = configuration.find(\"mail.timeout\").map(Long::valueOf).orElse(null);"));
        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void bindingExpression_optionalPrimitiveWithoutDefault_fallsBackToZero() {
        ConfigurationField enabled = new ConfigurationField("com.acme.Feature", "enabled", ConfigurationValueType.BOOLEAN,
            "feature.enabled", null, false);
        ConfigurationField label = new ConfigurationField("com.acme.Feature", "label", ConfigurationValueType.STRING,
            "feature.label", null, false);

        assertThat(ConstructorGenerator.bindingExpression(new ConfigurationBinding(enabled, "configuration")))
            .isEqualTo("configuration.find(\"feature.enabled\").map(Boolean::parseBoolean).orElse(false)");
        assertThat(ConstructorGenerator.bindingExpression(new ConfigurationBinding(label, "settings")))
            .isEqualTo("settings.find(\"feature.label\").orElse(null)");
    }

    private GenerationInput input() {
        AnalysisResult analysis = new WiringEngine(WireGenConfig.defaults(), List.of()).analyze(snapshot());
        return new GenerationInput(snapshot(), analysis.graph().registry(), analysis.layouts(), analysis.plan());
    }

    private CompilationUnit parse(String content) {
        ParseResult<CompilationUnit> result = javaParser.parse(content);
        assertThat(result.isSuccessful()).as("generated source parses: %s", result.getProblems()).isTrue();
        return result.getResult().orElseThrow();
    }
}
