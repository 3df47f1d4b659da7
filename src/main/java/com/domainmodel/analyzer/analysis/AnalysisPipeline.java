package com.domainmodel.analyzer.analysis;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.analysis.callgraph.CallGraph;
import com.domainmodel.analyzer.analysis.callgraph.CallGraphBuilder;
import com.domainmodel.analyzer.analysis.callgraph.CycleDetector;
import com.domainmodel.analyzer.analysis.classifier.ClassificationResult;
import com.domainmodel.analyzer.analysis.classifier.MethodFactsRegistry;
import com.domainmodel.analyzer.analysis.classifier.PropertyAccessClassifier;
import com.domainmodel.analyzer.analysis.propagation.FieldRequirementPropagator;
import com.domainmodel.analyzer.analysis.propagation.PropagationOutcome;
import com.domainmodel.analyzer.analysis.repository.RepositoryIdentification;
import com.domainmodel.analyzer.analysis.repository.RepositoryIdentifier;
import com.domainmodel.analyzer.analysis.repository.RepositoryRegistry;
import com.domainmodel.analyzer.bytecode.BytecodeInstructionStreamSource;
import com.domainmodel.analyzer.bytecode.ClassNameFilter;
import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.AnalysisReport;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.FieldRequirement;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;
import com.domainmodel.analyzer.model.RepositoryMapping;
import com.domainmodel.analyzer.result.AnalysisDocument;
import com.domainmodel.analyzer.result.AnalysisDocumentAssembler;
import com.domainmodel.analyzer.result.AnalysisDocumentSerializer;
import com.domainmodel.analyzer.result.AnalysisDocumentValidator;
import com.domainmodel.analyzer.result.AnalysisOutputException;
import com.domainmodel.analyzer.result.AnalysisStatistics;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.InstructionReadException;
import com.domainmodel.analyzer.stream.InstructionStreamSource;
import com.domainmodel.analyzer.stream.MethodInstructions;

/**
 * Runs the whole analysis for one compilation: collects per-class facts in
 * parallel, then, once every class is known, identifies repositories, builds
 * the call graph, propagates field requirements and writes the document.
 *
 * Problems local to a class, method or call site are reported and skipped.
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisConfig config;
    private final InstructionStreamSource source;
    private final Clock clock;

    private final PropertyAccessClassifier classifier = new PropertyAccessClassifier();
    private final AnalysisDocumentAssembler assembler = new AnalysisDocumentAssembler();
    private final AnalysisDocumentValidator validator = new AnalysisDocumentValidator();

    public AnalysisPipeline(AnalysisConfig config) {
        this(config, new BytecodeInstructionStreamSource(config.getClassDirs(), config.classNameFilter()), Clock.systemUTC());
    }

    public AnalysisPipeline(AnalysisConfig config, InstructionStreamSource source, Clock clock) {
        this.config = config;
        this.source = source;
        this.clock = clock;
    }

    public AnalysisRunResult run() {
        AnalysisReport report = new AnalysisReport();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, config.getParallelism()));
        try {
            log.info("Starting field requirement analysis...");
            Instant timestamp = clock.instant();

            // Step 1: Discover classes
            log.info("Step 1: Discovering classes...");
            List<String> classNames = discoverClasses(report);

            // Step 2: Read and classify every class
            log.info("Step 2: Reading and classifying {} classes...", classNames.size());
            MethodFactsRegistry.Builder factsBuilder = MethodFactsRegistry.builder();
            List<ClassInstructions> classes = readAndClassify(classNames, factsBuilder, report, executor);
            MethodFactsRegistry facts = factsBuilder.build();

            // Step 3: Aggregate roots
            log.info("Step 3: Resolving aggregate roots...");
            Set<String> aggregateRoots = findAggregateRoots(classes);

            // Step 4: Repositories
            log.info("Step 4: Identifying repositories...");
            RepositoryRegistry registry = identifyRepositories(classes, aggregateRoots, report);

            // Step 5: Call graph
            log.info("Step 5: Building call graph...");
            CallGraph callGraph = buildCallGraph(classes, registry, report, executor);

            // Step 6: Cycle report
            log.info("Step 6: Checking aggregate-root call cycles...");
            List<List<MethodId>> cycles = new CycleDetector()
                    .findCycles(callGraph, m -> registry.isAggregateRoot(m.getOwnerClass()) && facts.isDeclared(m));
            for (List<MethodId> cycle : cycles) {
                report.add(AnalysisIssue.of(IssueKind.CALL_GRAPH_CYCLE, cycle.get(0).getOwnerClass(),
                        "Recursive aggregate-root methods: " + cycle));
            }

            // Step 7: Propagation
            log.info("Step 7: Propagating field requirements for {} call sites...", callGraph.getRepositoryCallSites().size());
            FieldRequirementPropagator propagator = new FieldRequirementPropagator(config.getPropagation(), callGraph, facts);
            List<FieldRequirement> requirements = new ArrayList<>();
            for (RepositoryCallSite site : callGraph.getRepositoryCallSites()) {
                PropagationOutcome outcome = propagator.propagate(site);
                report.addAll(outcome.getIssues());
                requirements.add(outcome.getRequirement());
            }

            // Step 8: Assemble
            log.info("Step 8: Assembling analysis document...");
            AnalysisDocument document = assembler.assemble(requirements, timestamp);
            report.addAll(validator.validate(document));

            // Step 9: Write
            Optional<Path> written = writeDocument(document, report);

            boolean failed = config.isFailOnError() && report.hasRunFailingIssues();
            String errorMessage = failed ? firstRunFailingMessage(report) : null;

            log.info("Analysis finished: {} call sites, {} warnings, {} errors",
                    requirements.size(), report.getWarnings().size(), report.getErrors().size());

            return AnalysisRunResult.builder()
                    .success(!failed)
                    .errorMessage(errorMessage)
                    .document(document)
                    .report(report)
                    .statistics(AnalysisStatistics.of(document))
                    .outputPath(written.orElse(null))
                    .classesAnalyzed(classes.size())
                    .classesSkipped(classNames.size() - classes.size())
                    .methodsClassified(facts.size())
                    .aggregateRoots(registry.getAggregateRoots().size())
                    .repositories(registry.getMappings().size())
                    .callEdges(callGraph.edgeCount())
                    .repositoryCallSites(callGraph.getRepositoryCallSites().size())
                    .cycles(cycles.size())
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnalysisRunResult.failure("Analysis interrupted", report);
        } catch (Exception e) {
            log.error("Analysis failed", e);
            return AnalysisRunResult.failure(e.getMessage() != null ? e.getMessage() : e.toString(), report);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<String> discoverClasses(AnalysisReport report) {
        ClassNameFilter filter = config.classNameFilter();
        try {
            return source.discoverClasses().stream()
                    .filter(filter::accept)
                    .sorted()
                    .toList();
        } catch (InstructionReadException e) {
            log.warn("Cannot discover classes: {}", e.getMessage());
            report.add(AnalysisIssue.of(IssueKind.INSTRUCTION_READ_ERROR, e.getClassName(), e.getMessage(), e));
            return List.of();
        }
    }

    private List<ClassInstructions> readAndClassify(List<String> classNames, MethodFactsRegistry.Builder factsBuilder,
                                                    AnalysisReport report, ExecutorService executor)
            throws InterruptedException, ExecutionException {
        Map<String, ClassInstructions> read = new ConcurrentHashMap<>();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (String className : classNames) {
            tasks.add(() -> {
                try {
                    ClassInstructions cls = source.readClass(className);
                    List<ClassificationResult> results = new ArrayList<>();
                    for (MethodInstructions method : cls.getMethods()) {
                        results.add(classifier.classify(cls.getClassName(), method));
                    }
                    // register only once the whole class classified
                    for (ClassificationResult result : results) {
                        factsBuilder.register(result);
                        report.addAll(result.getIssues());
                    }
                    read.put(cls.getClassName(), cls);
                } catch (InstructionReadException e) {
                    log.warn("Skipping class {}: {}", className, e.getMessage());
                    report.add(AnalysisIssue.of(IssueKind.INSTRUCTION_READ_ERROR, className, e.getMessage(), e));
                } catch (RuntimeException e) {
                    log.warn("Skipping class {} after unexpected failure: {}", className, e.toString());
                    report.add(AnalysisIssue.of(IssueKind.INSTRUCTION_READ_ERROR, className,
                            "Unexpected failure while reading class: " + e, e));
                }
                return null;
            });
        }
        awaitAll(executor.invokeAll(tasks));

        List<ClassInstructions> classes = new ArrayList<>(read.values());
        classes.sort(Comparator.comparing(ClassInstructions::getClassName));
        return classes;
    }

    private Set<String> findAggregateRoots(List<ClassInstructions> classes) {
        Set<String> roots = new TreeSet<>(config.getAggregateRoots());
        for (ClassInstructions cls : classes) {
            boolean annotated = config.getAggregateRootAnnotations().stream()
                    .anyMatch(a -> cls.findAnnotation(a).isPresent());
            if (annotated) {
                roots.add(cls.getClassName());
            }
        }
        log.debug("Aggregate roots: {}", roots);
        return roots;
    }

    private RepositoryRegistry identifyRepositories(List<ClassInstructions> classes, Set<String> aggregateRoots,
                                                    AnalysisReport report) {
        RepositoryIdentifier identifier = new RepositoryIdentifier(config.getRepositoryIdentification());
        List<RepositoryMapping> mappings = new ArrayList<>();
        for (ClassInstructions cls : classes) {
            RepositoryIdentification identification = identifier.identify(cls, aggregateRoots);
            report.addAll(identification.getIssues());
            identification.getMapping().ifPresent(mappings::add);
        }
        RepositoryRegistry registry = RepositoryRegistry.of(mappings, aggregateRoots);
        for (RepositoryMapping mapping : registry.getMappings()) {
            log.info("  Repository {} -> {} ({})", mapping.getRepositoryClass(), mapping.getAggregateRootClass(),
                    mapping.getMatchKind());
        }
        return registry;
    }

    private CallGraph buildCallGraph(List<ClassInstructions> classes, RepositoryRegistry registry, AnalysisReport report,
                                     ExecutorService executor) throws InterruptedException, ExecutionException {
        CallGraphBuilder builder = new CallGraphBuilder(registry);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (ClassInstructions cls : classes) {
            tasks.add(() -> {
                try {
                    report.addAll(builder.addClass(cls));
                } catch (RuntimeException e) {
                    log.warn("Leaving class {} out of the call graph: {}", cls.getClassName(), e.toString());
                    report.add(AnalysisIssue.of(IssueKind.INSTRUCTION_READ_ERROR, cls.getClassName(),
                            "Unexpected failure while building call edges: " + e, e));
                }
                return null;
            });
        }
        awaitAll(executor.invokeAll(tasks));
        return builder.build();
    }

    private Optional<Path> writeDocument(AnalysisDocument document, AnalysisReport report) {
        Optional<Path> target = config.getOutputFile();
        if (target.isEmpty()) {
            log.info("Step 9: No output file configured, skipping write");
            return Optional.empty();
        }
        Path file = target.get();
        log.info("Step 9: Writing analysis document to {}...", file);
        if (Files.isDirectory(file)) {
            report.add(AnalysisIssue.of(IssueKind.CONFIGURATION_ERROR, file.toString(),
                    "Output path is a directory"));
            return Optional.empty();
        }
        try {
            new AnalysisDocumentSerializer(config.isPrettyPrint()).write(document, file);
            return Optional.of(file);
        } catch (AnalysisOutputException e) {
            log.error("{}", e.getMessage());
            report.add(AnalysisIssue.of(e.getKind(), file.toString(), e.getMessage(), e.getCause()));
            return Optional.empty();
        }
    }

    private static void awaitAll(List<Future<Void>> futures) throws InterruptedException, ExecutionException {
        for (Future<Void> future : futures) {
            future.get();
        }
    }

    private static String firstRunFailingMessage(AnalysisReport report) {
        return report.getIssues().stream()
                .filter(i -> i.getKind().isRunFailing())
                .findFirst()
                .map(AnalysisIssue::describe)
                .orElse("Analysis failed");
    }
}
