package com.wiregen.core.scanner;

import com.wiregen.core.WiringTestBase;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.ConfigurationValueType;
import com.wiregen.core.model.DependencyDescriptor;
import com.wiregen.core.model.InstanceSharing;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.model.NamingConvention;
import com.wiregen.core.model.RegistrationMode;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeKind;
import com.wiregen.core.model.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link MetadataExtractor}.
 */
class MetadataExtractorTest extends WiringTestBase {

    @Test
    void extract_lifetimeMarker_resolvesLifetime() {
        // Given: a singleton with a type-level dependency
        source("com/acme/Cache.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;
            import com.wiregen.api.Singleton;

            @Singleton
            @DependsOn(IDatabase.class)
            public class Cache {
            }
            """);
        source("com/acme/IDatabase.java", """
            package com.acme;

            public interface IDatabase {
            }
            """);

        // When
        ExtractionResult result = extract();

        // Then
        assertThat(result.types()).extracting(TypeDescriptor::qualifiedName)
            .containsExactly("com.acme.Cache", "com.acme.IDatabase");
        TypeDescriptor cache = result.types().get(0);
        assertThat(cache.lifetime()).isEqualTo(Lifetime.SINGLETON);
        assertThat(cache.lifetimeDeclared()).isTrue();
        assertThat(cache.kind()).isEqualTo(TypeKind.CLASS);
        assertThat(cache.sourcePath()).isEqualTo("com/acme/Cache.java");

        assertThat(result.dependenciesOf("com.acme.Cache")).singleElement()
            .satisfies(dependency -> {
                assertThat(dependency.target()).isEqualTo(TypeRef.of("com.acme.IDatabase"));
                assertThat(dependency.isField()).isFalse();
            });
        assertThat(result.types().get(1).isInterface()).isTrue();
        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void extract_serviceIntentWithoutLifetime_getsDefaultLifetime() {
        source("com/acme/Orders.java", """
            package com.acme;

            import com.wiregen.api.Inject;

            public class Orders {
                @Inject
                private Clock clock;
            }
            """);
        source("com/acme/Plain.java", """
            package com.acme;

            public class Plain {
            }
            """);
        source("com/acme/Clock.java", "package com.acme; public class Clock { }");

        ExtractionResult result = new MetadataExtractor(Lifetime.TRANSIENT).extract(snapshot(), reporter);

        assertThat(result.types()).filteredOn(t -> t.qualifiedName().equals("com.acme.Orders"))
            .singleElement()
            .satisfies(orders -> {
                assertThat(orders.lifetime()).isEqualTo(Lifetime.TRANSIENT);
                assertThat(orders.lifetimeDeclared()).isFalse();
            });
        assertThat(result.types()).filteredOn(t -> t.qualifiedName().equals("com.acme.Plain"))
            .singleElement()
            .satisfies(plain -> assertThat(plain.isService()).isFalse());
    }

    @Test
    void extract_dependsOnAttributes_readsNamingAndExternalFlag() {
        source("com/acme/Reports.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;
            import com.wiregen.api.NamingConvention;
            import java.util.List;

            @DependsOn(value = {IClock.class}, namingConvention = NamingConvention.SNAKE_CASE, stripI = false, prefix = "m_")
            @DependsOn(types = {"List<IHandler>"}, external = true)
            public class Reports {
            }
            """);
        source("com/acme/IClock.java", "package com.acme; public interface IClock { }");
        source("com/acme/IHandler.java", "package com.acme; public interface IHandler { }");

        List<DependencyDescriptor> dependencies = extract().dependenciesOf("com.acme.Reports");

        assertThat(dependencies).hasSize(2);
        DependencyDescriptor clock = dependencies.get(0);
        assertThat(clock.naming().convention()).isEqualTo(NamingConvention.SNAKE_CASE);
        assertThat(clock.naming().stripLeadingMarker()).isFalse();
        assertThat(clock.naming().prefix()).isEqualTo("m_");
        assertThat(clock.declarationIndex()).isZero();

        DependencyDescriptor handlers = dependencies.get(1);
        assertThat(handlers.target()).isEqualTo(TypeRef.of("java.util.List", TypeRef.of("com.acme.IHandler")));
        assertThat(handlers.target().isCollection()).isTrue();
        assertThat(handlers.external()).isTrue();
        assertThat(handlers.declarationIndex()).isEqualTo(1);
    }

    @Test
    void extract_declarationsBeforeInjectedFields() {
        source("com/acme/Checkout.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;
            import com.wiregen.api.Inject;

            @DependsOn(IPayments.class)
            public class Checkout {
                @Inject
                private final IInventory inventory;
            }
            """);
        source("com/acme/IPayments.java", "package com.acme; public interface IPayments { }");
        source("com/acme/IInventory.java", "package com.acme; public interface IInventory { }");

        List<DependencyDescriptor> dependencies = extract().dependenciesOf("com.acme.Checkout");

        assertThat(dependencies).extracting(d -> d.target().simpleName())
            .containsExactly("IPayments", "IInventory");
        assertThat(dependencies.get(1).fieldName()).isEqualTo("inventory");
        assertThat(dependencies).extracting(DependencyDescriptor::order).containsExactly(0, 1);
    }

    @Test
    void extract_registrationMarkers_readsDirective() {
        source("com/acme/Impl.java", """
            package com.acme;

            import com.wiregen.api.InstanceSharing;
            import com.wiregen.api.RegisterAsAll;
            import com.wiregen.api.RegistrationMode;
            import com.wiregen.api.SkipRegistration;

            @RegisterAsAll(value = RegistrationMode.EXCLUSIONARY, instanceSharing = InstanceSharing.SHARED)
            @SkipRegistration({IA.class})
            public class Impl implements IB {
            }
            """);
        source("com/acme/IA.java", "package com.acme; public interface IA { }");
        source("com/acme/IB.java", "package com.acme; public interface IB extends IA { }");

        TypeDescriptor impl = extract().types().get(0);

        assertThat(impl.qualifiedName()).isEqualTo("com.acme.Impl");
        assertThat(impl.registration().modeDeclared()).isTrue();
        assertThat(impl.registration().mode()).isEqualTo(RegistrationMode.EXCLUSIONARY);
        assertThat(impl.registration().instanceSharing()).isEqualTo(InstanceSharing.SHARED);
        assertThat(impl.registration().skipped()).containsExactly(TypeRef.of("com.acme.IA"));
        assertThat(impl.interfaces()).containsExactly(TypeRef.of("com.acme.IB"));
        assertThat(impl.lifetime()).isEqualTo(Lifetime.SCOPED);
    }

    @Test
    void extract_conditionalService_splitsCommaSeparatedValues() {
        source("com/acme/FakeEmail.java", """
            package com.acme;

            import com.wiregen.api.ConditionalService;

            @ConditionalService(environment = "Dev, Test", configKey = "email.mode", notEquals = "smtp,ses")
            public class FakeEmail {
            }
            """);

        TypeDescriptor fake = extract().types().get(0);

        assertThat(fake.conditions()).singleElement().satisfies(condition -> {
            assertThat(condition.environments()).containsExactly("Dev", "Test");
            assertThat(condition.configKey()).isEqualTo("email.mode");
            assertThat(condition.notEqualsValues()).containsExactly("smtp", "ses");
        });
        assertThat(fake.isConditional()).isTrue();
    }

    @Test
    void extract_repeatedConditionalService_keepsEveryAlternative() {
        source("com/acme/FakeEmail.java", """
            package com.acme;

            import com.wiregen.api.ConditionalService;

            @ConditionalService(environment = "Dev")
            @ConditionalService(configKey = "email.fake", equalsValue = "on")
            public class FakeEmail {
            }
            """);
        source("com/acme/Sandbox.java", """
            package com.acme;

            import com.wiregen.api.ConditionalService;

            @ConditionalService.List({
                @ConditionalService(environment = "Test"),
                @ConditionalService(notEnvironment = "Prod")
            })
            public class Sandbox {
            }
            """);

        List<TypeDescriptor> types = extract().types();

        TypeDescriptor fake = types.stream().filter(t -> t.simpleName().equals("FakeEmail")).findFirst().orElseThrow();
        assertThat(fake.conditions()).extracting(ConditionalRule::environments, ConditionalRule::configKey)
            .containsExactly(tuple(List.of("Dev"), ""), tuple(List.of(), "email.fake"));
        assertThat(fake.lifetime()).isEqualTo(Lifetime.SCOPED);
        TypeDescriptor sandbox = types.stream().filter(t -> t.simpleName().equals("Sandbox")).findFirst().orElseThrow();
        assertThat(sandbox.conditions()).extracting(ConditionalRule::notEnvironments)
            .containsExactly(List.of(), List.of("Prod"));
    }

    @Test
    void extract_injectConfiguration_readsKeyDefaultAndRequired() {
        // Given
        source("com/acme/MailSender.java", """
            package com.acme;

            import com.wiregen.api.InjectConfiguration;

            public class MailSender {
                @InjectConfiguration("mail.host")
                private final String host;
                @InjectConfiguration(value = "mail.port", defaultValue = "25")
                private final int port;
                @InjectConfiguration(value = "mail.tls", required = false)
                private Boolean tls;
            }
            """);

        // When
        ExtractionResult result = extract();

        // Then
        assertThat(result.configurationFieldsOf("com.acme.MailSender"))
            .extracting(ConfigurationField::fieldName, ConfigurationField::valueType, ConfigurationField::key,
                ConfigurationField::defaultValue, ConfigurationField::required)
            .containsExactly(
                tuple("host", ConfigurationValueType.STRING, "mail.host", null, true),
                tuple("port", ConfigurationValueType.INT, "mail.port", "25", true),
                tuple("tls", ConfigurationValueType.BOOLEAN_WRAPPER, "mail.tls", null, false));
        assertThat(result.dependenciesOf("com.acme.MailSender")).isEmpty();
        assertThat(result.types().get(0).lifetime()).isEqualTo(Lifetime.SCOPED);
        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void extract_invalidConfigurationFields_areReportedAndSkipped() {
        source("com/acme/Cache.java", """
            package com.acme;

            import com.wiregen.api.Inject;
            import com.wiregen.api.InjectConfiguration;

            public class Cache {
                @InjectConfiguration("cache.ttl")
                private java.time.Duration ttl;
                @InjectConfiguration(value = "cache.size", defaultValue = "large")
                private int size;
                @InjectConfiguration("cache.name")
                private String name = "default";
                @InjectConfiguration(" ")
                private String region;
                @Inject
                @InjectConfiguration("cache.clock")
                private Clock clock;
                @InjectConfiguration("cache.mode")
                private static String mode;
            }
            """);
        source("com/acme/Clock.java", "package com.acme; public class Clock { }");

        ExtractionResult result = extract();

        assertThat(result.configurationFields()).isEmpty();
        assertThat(diagnostics(DiagnosticCode.MALFORMED_MARKER)).extracting(d -> d.message())
            .anySatisfy(m -> assertThat(m).contains("unsupported type 'java.time.Duration'"))
            .anySatisfy(m -> assertThat(m).contains("default value 'large'", "'size'"))
            .anySatisfy(m -> assertThat(m).contains("'name' must not have an initializer"))
            .anySatisfy(m -> assertThat(m).contains("'region' declares no key"))
            .anySatisfy(m -> assertThat(m).contains("'clock' is both injected and bound"))
            .anySatisfy(m -> assertThat(m).contains("static field 'mode'"))
            .hasSize(6);
    }

    @Test
    void extract_genericBase_keepsTypeArgumentsAndVariables() {
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

            public class Orders extends Repository<Order> {
            }
            """);
        source("com/acme/IStore.java", "package com.acme; public interface IStore<E> { }");
        source("com/acme/Order.java", "package com.acme; public record Order(String id) { }");

        ExtractionResult result = extract();

        TypeDescriptor orders = result.types().stream()
            .filter(t -> t.qualifiedName().equals("com.acme.Orders")).findFirst().orElseThrow();
        assertThat(orders.superclass()).isEqualTo(TypeRef.of("com.acme.Repository", TypeRef.of("com.acme.Order")));
        assertThat(result.dependenciesOf("com.acme.Repository")).singleElement()
            .satisfies(d -> assertThat(d.target()).isEqualTo(TypeRef.of("com.acme.IStore", TypeRef.variable("T"))));
        assertThat(result.types()).filteredOn(t -> t.kind() == TypeKind.RECORD).hasSize(1);
    }

    @Test
    void extract_nestedTypes_useQualifiedNames() {
        source("com/acme/Outer.java", """
            package com.acme;

            import com.wiregen.api.Inject;
            import com.wiregen.api.Transient;

            public class Outer {
                public interface Handler {
                }

                @Transient
                public static class Worker {
                    @Inject
                    private Handler handler;
                }
            }
            """);

        ExtractionResult result = extract();

        assertThat(result.types()).extracting(TypeDescriptor::qualifiedName)
            .containsExactly("com.acme.Outer", "com.acme.Outer.Handler", "com.acme.Outer.Worker");
        assertThat(result.dependenciesOf("com.acme.Outer.Worker")).singleElement()
            .satisfies(d -> assertThat(d.target().name()).isEqualTo("com.acme.Outer.Handler"));
    }

    @Test
    void extract_markerFromOtherPackage_isIgnored() {
        source("com/acme/Cache.java", """
            package com.acme;

            import javax.inject.Singleton;

            @Singleton
            public class Cache {
            }
            """);

        TypeDescriptor cache = extract().types().get(0);

        assertThat(cache.isService()).isFalse();
    }

    @Test
    void extract_explicitConstructor_isRecorded() {
        source("com/acme/Manual.java", """
            package com.acme;

            import com.wiregen.api.Scoped;

            @Scoped
            public class Manual {
                public Manual() {
                }
            }
            """);

        assertThat(extract().types().get(0).explicitConstructor()).isTrue();
    }

    @Test
    void extract_unparseableUnit_isReportedAndOthersAreExtracted() {
        source("com/acme/Broken.java", "package com.acme; public class Broken {");
        source("com/acme/Fine.java", "package com.acme; @com.wiregen.api.Scoped public class Fine { }");

        ExtractionResult result = extract();

        assertThat(result.types()).extracting(TypeDescriptor::qualifiedName).containsExactly("com.acme.Fine");
        assertThat(diagnostics(DiagnosticCode.SOURCE_PARSE_FAILED)).singleElement()
            .satisfies(d -> assertThat(d.location()).isEqualTo("com/acme/Broken.java"));
        assertThat(result.statistics().filesFailed()).isEqualTo(1);
        assertThat(result.statistics().filesParsed()).isEqualTo(1);
    }

    @Test
    void extract_malformedMarkers_areReportedPerType() {
        source("com/acme/Twice.java", """
            package com.acme;

            import com.wiregen.api.Scoped;
            import com.wiregen.api.Singleton;

            @Singleton
            @Scoped
            public class Twice {
            }
            """);
        source("com/acme/BadDependsOn.java", """
            package com.acme;

            import com.wiregen.api.DependsOn;

            @DependsOn(value = "not a class literal")
            public class BadDependsOn {
            }
            """);
        source("com/acme/StaticInject.java", """
            package com.acme;

            import com.wiregen.api.Inject;

            public class StaticInject {
                @Inject
                private static Runnable task;
            }
            """);

        ExtractionResult result = extract();

        assertThat(diagnostics(DiagnosticCode.MALFORMED_MARKER)).hasSize(3);
        assertThat(result.types()).hasSize(3);
        TypeDescriptor twice = result.types().stream()
            .filter(t -> t.simpleName().equals("Twice")).findFirst().orElseThrow();
        assertThat(twice.lifetime()).isEqualTo(Lifetime.SINGLETON);
    }

    @Test
    void extract_lifetimeOnInterface_isReportedAndIgnored() {
        source("com/acme/IClock.java", """
            package com.acme;

            @com.wiregen.api.Singleton
            public interface IClock {
            }
            """);

        TypeDescriptor clock = extract().types().get(0);

        assertThat(clock.lifetime()).isEqualTo(Lifetime.UNASSIGNED);
        assertThat(diagnostics(DiagnosticCode.MALFORMED_MARKER)).hasSize(1);
    }

    @Test
    void extract_sameTypeTwice_isReported() {
        source("a/Dup.java", "package com.acme; public class Dup { }");
        source("b/Dup.java", "package com.acme; public class Dup { }");

        ExtractionResult result = extract();

        assertThat(result.types()).hasSize(1);
        assertThat(diagnostics(DiagnosticCode.MALFORMED_MARKER)).singleElement()
            .satisfies(d -> assertThat(d.location()).isEqualTo("b/Dup.java"));
    }
}
