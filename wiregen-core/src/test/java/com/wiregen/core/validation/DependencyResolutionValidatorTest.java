package com.wiregen.core.validation;

import com.wiregen.core.WiringTestBase;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.graph.DependencyGraphBuilder;
import com.wiregen.core.registration.RegistrationPlan;
import com.wiregen.core.registration.RegistrationPlanner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link DependencyResolutionValidator}.
 */
class DependencyResolutionValidatorTest extends WiringTestBase {

    private final DependencyResolutionValidator validator = new DependencyResolutionValidator();

    @Test
    void validate_interfaceWithoutImplementation_isUnresolved() {
        // Given
        source("com/acme/IPayments.java", "package com.acme; public interface IPayments { }");
        notifier("IPayments");

        // When
        validate(buildGraph());

        // Then
        assertThat(diagnostics(DiagnosticCode.UNRESOLVED_DEPENDENCY)).singleElement()
            .satisfies(d -> assertThat(d.message())
                .isEqualTo("No implementation of 'IPayments' is declared for service 'Notifier'."));
    }

    @Test
    void validate_emptyCollection_isAllowed() {
        source("com/acme/IHandler.java", "package com.acme; public interface IHandler { }");
        source("com/acme/Notifier.java", """
            package com.acme;

            import com.wiregen.api.Inject;
            import java.util.List;

            @com.wiregen.api.Scoped
            public class Notifier {
                @Inject
                private List<IHandler> handlers;
            }
            """);

        validate(buildGraph());

        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void validate_unknownType_isReportedOnlyWhenRequested() {
        notifier("IMissing");

        validate(buildGraph());
        assertThat(reporter.diagnostics()).isEmpty();

        validate(new DependencyGraphBuilder(true).build(extract(), reporter));
        assertThat(diagnostics(DiagnosticCode.UNRESOLVED_DEPENDENCY)).singleElement()
            .satisfies(d -> assertThat(d.message()).contains("'IMissing'"));
    }

    @Test
    void validate_severalUnconditionalImplementations_isAmbiguous() {
        source("com/acme/IEmail.java", "package com.acme; public interface IEmail { }");
        source("com/acme/SmtpEmail.java", "package com.acme; @com.wiregen.api.Scoped public class SmtpEmail implements IEmail { }");
        source("com/acme/SesEmail.java", "package com.acme; @com.wiregen.api.Scoped public class SesEmail implements IEmail { }");
        notifier("IEmail");

        validate(buildGraph());

        assertThat(diagnostics(DiagnosticCode.AMBIGUOUS_IMPLEMENTATION)).singleElement()
            .satisfies(d -> assertThat(d.message())
                .isEqualTo("Dependency 'IEmail' of 'Notifier' has several unconditional implementations: SesEmail, SmtpEmail."));
    }

    @Test
    void validate_implementationNotRegisteredAsContract_isReported() {
        source("com/acme/IEmail.java", "package com.acme; public interface IEmail { }");
        source("com/acme/SmtpEmail.java", """
            package com.acme;

            import com.wiregen.api.RegisterAsAll;
            import com.wiregen.api.RegistrationMode;

            @RegisterAsAll(RegistrationMode.DIRECT_ONLY)
            public class SmtpEmail implements IEmail {
            }
            """);
        notifier("IEmail");

        validate(buildGraph());

        assertThat(diagnostics(DiagnosticCode.UNREGISTERED_IMPLEMENTATION)).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo(
                "Service 'Notifier' depends on 'IEmail', but its implementation 'SmtpEmail' is not registered as that type.");
            assertThat(d.types()).containsExactly("com.acme.Notifier", "com.acme.SmtpEmail");
        });
    }

    @Test
    void validate_registeredImplementation_isAccepted() {
        source("com/acme/IEmail.java", "package com.acme; public interface IEmail { }");
        source("com/acme/SmtpEmail.java", "package com.acme; @com.wiregen.api.Scoped public class SmtpEmail implements IEmail { }");
        notifier("IEmail");

        validate(buildGraph());

        assertThat(reporter.diagnostics()).isEmpty();
    }

    @Test
    void validate_ownerThatIsNoService_isSkipped() {
        source("com/acme/IPayments.java", "package com.acme; public interface IPayments { }");
        source("com/acme/Helper.java", """
            package com.acme;

            @com.wiregen.api.DependsOn(IPayments.class)
            public abstract class Helper {
            }
            """);

        validate(buildGraph());

        assertThat(reporter.diagnostics()).isEmpty();
    }

    private void notifier(String dependency) {
        source("com/acme/Notifier.java", """
            package com.acme;

            @com.wiregen.api.Scoped
            @com.wiregen.api.DependsOn(%s.class)
            public class Notifier {
            }
            """.formatted(dependency));
    }

    private void validate(DependencyGraph graph) {
        RegistrationPlan plan = new RegistrationPlanner().plan(graph.registry(), reporter);
        validator.validate(graph, plan, reporter);
    }
}
