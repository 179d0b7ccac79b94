package com.wiregen.core.generator.impl;

import com.wiregen.core.WiringTestBase;
import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.engine.AnalysisResult;
import com.wiregen.core.engine.WiringEngine;
import com.wiregen.core.generator.GenerationInput;
import com.wiregen.core.generator.GeneratorConfig;
import com.wiregen.core.graph.TypeRegistry;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.model.TypeRef;
import com.wiregen.core.registration.ConditionalGroup;
import com.wiregen.core.registration.PlannedRegistration;
import com.wiregen.core.registration.RegistrationKind;
import com.wiregen.core.registration.RegistrationPlan;
import com.wiregen.core.renderer.GeneratedFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link RegistrationGenerator}.
 */
class RegistrationGeneratorTest extends WiringTestBase {

    private final RegistrationGenerator generator = new RegistrationGenerator();

    @Test
    void generate_singleton_writesDirectAndForwardingRegistrations() {
        // Given
        source("com/acme/ICache.java", "package com.acme; public interface ICache { }");
        source("com/acme/Cache.java", "package com.acme; @com.wiregen.api.Singleton public class Cache implements ICache { }");

        // When
        List<GeneratedFile> files = generator.generate(input(), GeneratorConfig.defaults(), reporter);

        // Then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("com/wiregen/generated/WireGenRegistrations.java");
            assertThat(file.generatorId()).isEqualTo("registrations");
            assertThat(file.content()).isEqualTo("""
                // Generated by WireGen. Do not edit.
                package com.wiregen.generated;

                import com.wiregen.api.container.ServiceCollection;
                import com.wiregen.api.container.ServiceLifetime;

                import java.util.Map;

                public final class WireGenRegistrations {

                    private WireGenRegistrations() {
                    }

                    public static ServiceCollection addWireGenServices(ServiceCollection services, Map<String, String> configuration) {
                        services.add(ServiceLifetime.SINGLETON, com.acme.Cache.class, com.acme.Cache.class);
                        services.addFactory(ServiceLifetime.SINGLETON, com.acme.ICache.class, provider -> provider.getRequiredService(com.acme.Cache.class));
                        return services;
                    }
                }
                """);
        });
    }

    @Test
    void generate_exclusiveEnvironments_writeIfElseChainAfterUnconditional() {
        source("com/acme/IEmail.java", "package com.acme; public interface IEmail { }");
        source("com/acme/FakeEmail.java", """
            package com.acme;

            @com.wiregen.api.ConditionalService(environment = "Dev")
            @com.wiregen.api.RegisterAs(IEmail.class)
            public class FakeEmail implements IEmail {
            }
            """);
        source("com/acme/ProdEmail.java", """
            package com.acme;

            @com.wiregen.api.ConditionalService(environment = "Prod")
            @com.wiregen.api.RegisterAs(IEmail.class)
            public class ProdEmail implements IEmail {
            }
            """);
        source("com/acme/AuditLog.java", "package com.acme; @com.wiregen.api.Transient public class AuditLog { }");

        String content = generator.generate(input(), GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(content)
            .contains("import java.util.Objects;")
            .contains("        String environment = Objects.requireNonNullElse(System.getenv(\"WIREGEN_ENVIRONMENT\"), \"\");\n"
                + "        services.add(ServiceLifetime.TRANSIENT, com.acme.AuditLog.class, com.acme.AuditLog.class);\n")
            .contains("""
                        if ("Dev".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.FakeEmail.class);
                        } else if ("Prod".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.ProdEmail.class);
                        }
                """)
            .contains("""
                        if ("Dev".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.FakeEmail.class, com.acme.FakeEmail.class);
                        }
                """);
    }

    @Test
    void generate_overlappingConditions_writeOneIfPerRegistration() {
        source("com/acme/IFeature.java", "package com.acme; public interface IFeature { }");
        source("com/acme/Beta.java", """
            package com.acme;

            @com.wiregen.api.ConditionalService(configKey = "beta", equalsValue = "on")
            @com.wiregen.api.RegisterAsAll(value = com.wiregen.api.RegistrationMode.EXCLUSIONARY,
                instanceSharing = com.wiregen.api.InstanceSharing.SEPARATE)
            public class Beta implements IFeature {
            }
            """);
        source("com/acme/Preview.java", """
            package com.acme;

            @com.wiregen.api.ConditionalService(notEnvironment = "Prod")
            @com.wiregen.api.RegisterAsAll(value = com.wiregen.api.RegistrationMode.EXCLUSIONARY,
                instanceSharing = com.wiregen.api.InstanceSharing.SEPARATE)
            public class Preview implements IFeature {
            }
            """);

        String content = generator.generate(input(), GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(content)
            .contains("""
                        if ("on".equals(configuration.getOrDefault("beta", ""))) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IFeature.class, com.acme.Beta.class);
                        }
                        if (!"Prod".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IFeature.class, com.acme.Preview.class);
                        }
                """)
            .doesNotContain("else if");
    }

    @Test
    void generate_alternativeConditions_shareOneGuard() {
        source("com/acme/IFeature.java", "package com.acme; public interface IFeature { }");
        source("com/acme/Beta.java", """
            package com.acme;

            @com.wiregen.api.ConditionalService(configKey = "beta", equalsValue = "on")
            @com.wiregen.api.ConditionalService(notEnvironment = "Prod")
            @com.wiregen.api.RegisterAs(IFeature.class)
            public class Beta implements IFeature {
            }
            """);

        String content = generator.generate(input(), GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(content)
            .contains("""
                        if (("on".equals(configuration.getOrDefault("beta", ""))) || (!"Prod".equals(environment))) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IFeature.class, com.acme.Beta.class);
                        }
                """)
            .doesNotContain("else if");
    }

    @Test
    void generate_configurationBinding_registersConfigurationFirst() {
        source("com/acme/MailSender.java", """
            package com.acme;

            @com.wiregen.api.Singleton
            public class MailSender {
                @com.wiregen.api.InjectConfiguration("mail.host")
                private String host;
            }
            """);

        String content = generator.generate(input(), GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(content)
            .contains("import com.wiregen.api.container.Configuration;\n")
            .contains("        services.addFactory(ServiceLifetime.SINGLETON, Configuration.class, "
                + "provider -> Configuration.of(configuration));\n"
                + "        services.add(ServiceLifetime.SINGLETON, com.acme.MailSender.class, com.acme.MailSender.class);\n");
    }

    @Test
    void generate_customConfig_usesNamesAndDefaultPackage() {
        GeneratorConfig config = new GeneratorConfig("", "Registrations", "register", "APP_ENV");

        List<GeneratedFile> files = generator.generate(input(), config, reporter);

        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.relativePath()).isEqualTo("Registrations.java");
            assertThat(file.content())
                .doesNotContain("package ")
                .doesNotContain("Objects")
                .contains("public final class Registrations {")
                .contains("public static ServiceCollection register(ServiceCollection services, ");
        });
    }

    @Test
    void generate_invalidName_isReportedAndLeftOut() {
        PlannedRegistration invalid = new PlannedRegistration(TypeRef.of("com.acme.Bad-Name"), "com.acme.Impl",
            Lifetime.SCOPED, RegistrationKind.DIRECT, null);
        PlannedRegistration valid = new PlannedRegistration(TypeRef.of("com.acme.Impl"), "com.acme.Impl",
            Lifetime.SCOPED, RegistrationKind.DIRECT, null);
        GenerationInput input = new GenerationInput(DeclarationSnapshot.of(), new TypeRegistry(List.of()), Map.of(),
            new RegistrationPlan(List.of(invalid, valid), List.of()));

        String content = generator.generate(input, GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(content)
            .contains("services.add(ServiceLifetime.SCOPED, com.acme.Impl.class, com.acme.Impl.class);")
            .doesNotContain("Bad-Name");
        assertThat(diagnostics(DiagnosticCode.EMISSION_FAILED)).singleElement()
            .satisfies(d -> assertThat(d.location()).isNull());
    }

    @Test
    void generate_unwrittenRegistration_doesNotBreakExclusiveChain() {
        TypeRef email = TypeRef.of("com.acme.IEmail");
        PlannedRegistration dev = new PlannedRegistration(email, "com.acme.FakeEmail", Lifetime.SCOPED,
            RegistrationKind.DIRECT, environment("Dev"));
        PlannedRegistration broken = new PlannedRegistration(email, "com.acme.Broken-Email", Lifetime.SCOPED,
            RegistrationKind.DIRECT, environment("Dev"));
        PlannedRegistration prod = new PlannedRegistration(email, "com.acme.SmtpEmail", Lifetime.SCOPED,
            RegistrationKind.DIRECT, environment("Prod"));
        ConditionalGroup group = new ConditionalGroup(email, List.of(dev, broken, prod));
        GenerationInput input = new GenerationInput(DeclarationSnapshot.of(), new TypeRegistry(List.of()), Map.of(),
            new RegistrationPlan(List.of(), List.of(group)));

        String content = generator.generate(input, GeneratorConfig.defaults(), reporter).get(0).content();

        assertThat(group.isMutuallyExclusive()).isFalse();
        assertThat(content)
            .contains("""
                        if ("Dev".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.FakeEmail.class);
                        } else if ("Prod".equals(environment)) {
                            services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.SmtpEmail.class);
                        }
                """)
            .doesNotContain("Broken-Email");
        assertThat(diagnostics(DiagnosticCode.EMISSION_FAILED)).hasSize(1);
    }

    @Test
    void condition_rendersEveryClause() {
        ConditionalRule rule = new ConditionalRule(List.of("Dev", "Test"), List.of("Prod"), "mail", "fake",
            List.of("smtp"));

        assertThat(RegistrationGenerator.condition(rule)).isEqualTo(
            "(\"Dev\".equals(environment) || \"Test\".equals(environment))"
                + " && !\"Prod\".equals(environment)"
                + " && \"fake\".equals(configuration.getOrDefault(\"mail\", \"\"))"
                + " && !\"smtp\".equals(configuration.getOrDefault(\"mail\", \"\"))");
    }

    @Test
    void condition_incompleteConfigClause_isLeftOut() {
        ConditionalRule keyOnly = new ConditionalRule(List.of(), List.of(), "mail", "", List.of());

        assertThat(RegistrationGenerator.condition(keyOnly)).isEqualTo("true");
    }

    @Test
    void condition_escapesStringLiterals() {
        ConditionalRule rule = new ConditionalRule(List.of("Dev\"\\"), List.of(), "", "", List.of());

        assertThat(RegistrationGenerator.condition(rule)).isEqualTo("\"Dev\\\"\\\\\".equals(environment)");
    }

    private GenerationInput input() {
        AnalysisResult analysis = new WiringEngine(WireGenConfig.defaults(), List.of()).analyze(snapshot());
        return new GenerationInput(snapshot(), analysis.graph().registry(), analysis.layouts(), analysis.plan());
    }

    private static ConditionalRule environment(String name) {
        return new ConditionalRule(List.of(name), List.of(), "", "", List.of());
    }
}
