package com.wiregen.core.engine;

import com.wiregen.core.config.ConfigLoader;
import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.diagnostic.DiagnosticSettings;
import com.wiregen.core.generator.CodeGenerator;
import com.wiregen.core.generator.GenerationInput;
import com.wiregen.core.generator.GeneratorConfig;
import com.wiregen.core.graph.CycleDetector;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.graph.DependencyGraphBuilder;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.naming.ConstructorLayout;
import com.wiregen.core.naming.ConstructorLayoutFactory;
import com.wiregen.core.naming.NamingResolver;
import com.wiregen.core.registration.RegistrationPlan;
import com.wiregen.core.registration.RegistrationPlanner;
import com.wiregen.core.renderer.GeneratedFile;
import com.wiregen.core.renderer.GeneratedOutput;
import com.wiregen.core.scanner.ExtractionResult;
import com.wiregen.core.scanner.MetadataExtractor;
import com.wiregen.core.scanner.ScanStatistics;
import com.wiregen.core.validation.ConditionalRuleValidator;
import com.wiregen.core.validation.DependencyResolutionValidator;
import com.wiregen.core.validation.LifetimeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Runs the whole analysis and code generation pipeline over one snapshot.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>extract type and dependency descriptors</li>
 *   <li>build the dependency graph (inheritance merging, substitution, implementation lookup)</li>
 *   <li>detect cycles</li>
 *   <li>validate lifetimes and registration conditions</li>
 *   <li>plan registrations, then check every dependency against the plan</li>
 *   <li>compute constructor layouts</li>
 *   <li>run every {@link CodeGenerator} (generating runs only)</li>
 * </ol>
 *
 * <p>Every run recomputes everything from the snapshot; nothing is kept between runs. The engine
 * holds no per-run state, so one instance can serve several runs.
 */
public class WiringEngine {

    private static final Logger log = LoggerFactory.getLogger(WiringEngine.class);

    private final DiagnosticSettings diagnosticSettings;
    private final MetadataExtractor extractor;
    private final DependencyGraphBuilder graphBuilder;
    private final ConstructorLayoutFactory layoutFactory;
    private final GeneratorConfig generatorConfig;
    private final List<CodeGenerator> generators;

    public WiringEngine(WireGenConfig config) {
        this(config, discoverGenerators());
    }

    public WiringEngine(WireGenConfig config, List<CodeGenerator> generators) {
        Objects.requireNonNull(config, "config must not be null");
        this.diagnosticSettings = ConfigLoader.diagnosticSettings(config);
        this.extractor = new MetadataExtractor(ConfigLoader.defaultLifetime(config));
        this.graphBuilder = new DependencyGraphBuilder(config.analysisDefaults().reportUnknownTypes());
        this.layoutFactory = new ConstructorLayoutFactory(new NamingResolver(ConfigLoader.interfaceMarker(config)));
        this.generatorConfig = config.registration().toGeneratorConfig();
        this.generators = List.copyOf(generators);
    }

    /**
     * Analyses a snapshot without generating code.
     */
    public AnalysisResult analyze(DeclarationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        DiagnosticReporter reporter = new DiagnosticReporter(diagnosticSettings);
        return analyze(snapshot, reporter);
    }

    /**
     * Analyses a snapshot and runs every generator. A generator that fails is reported and
     * skipped; the output of the others is kept.
     */
    public GenerationResult generate(DeclarationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        DiagnosticReporter reporter = new DiagnosticReporter(diagnosticSettings);
        AnalysisResult analysis = analyze(snapshot, reporter);

        GenerationInput input = new GenerationInput(snapshot, analysis.graph().registry(), analysis.layouts(),
            analysis.plan());
        List<GeneratedFile> files = new ArrayList<>();
        for (CodeGenerator generator : generators) {
            try {
                List<GeneratedFile> generated = generator.generate(input, generatorConfig, reporter);
                log.debug("{} produced {} file(s)", generator.getDisplayName(), generated.size());
                files.addAll(generated);
            } catch (RuntimeException e) {
                log.error("Generator {} failed: {}", generator.getId(), e.getMessage(), e);
                reporter.report(DiagnosticCode.EMISSION_FAILED, List.of(), null, generator.getDisplayName(),
                    e.getMessage());
            }
        }
        return new GenerationResult(analysis.withDiagnostics(reporter.diagnostics(), reporter.suppressedCount()),
            new GeneratedOutput(files));
    }

    public List<CodeGenerator> generators() {
        return generators;
    }

    private AnalysisResult analyze(DeclarationSnapshot snapshot, DiagnosticReporter reporter) {
        ExtractionResult extraction = extractor.extract(snapshot, reporter);
        ScanStatistics statistics = extraction.statistics();
        if (statistics.hasFailures()) {
            log.warn("Parsed {}% of {} source file(s); skipped {} file(s) and {} type(s), first errors: {}",
                String.format("%.1f", statistics.getParseSuccessRate()), statistics.filesScanned(),
                statistics.filesFailed(), statistics.typesFailed(), statistics.topErrors());
        }
        DependencyGraph graph = graphBuilder.build(extraction, reporter);
        List<List<String>> cycles = new CycleDetector().detect(graph, reporter);
        new LifetimeValidator().validate(graph, reporter);
        new ConditionalRuleValidator().validate(graph.registry(), reporter);
        RegistrationPlan plan = new RegistrationPlanner().plan(graph.registry(), reporter);
        new DependencyResolutionValidator().validate(graph, plan, reporter);
        Map<String, ConstructorLayout> layouts = layoutFactory.createAll(graph, extraction, reporter);

        log.info("Analysed {} types: {} cycle(s), {} registration(s), {} diagnostic(s)",
            graph.types().size(), cycles.size(), plan.all().size(), reporter.diagnostics().size());
        return new AnalysisResult(extraction, graph, cycles, layouts, plan, reporter.diagnostics(),
            reporter.suppressedCount());
    }

    /**
     * Discovers generators via ServiceLoader, ordered by id.
     */
    static List<CodeGenerator> discoverGenerators() {
        List<CodeGenerator> generators = new ArrayList<>();
        ServiceLoader.load(CodeGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(CodeGenerator::getId));
        log.debug("Discovered {} code generator(s)", generators.size());
        return generators;
    }
}
