package com.domainmodel.analyzer.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.analysis.AnalysisConfig;
import com.domainmodel.analyzer.analysis.AnalysisPipeline;
import com.domainmodel.analyzer.analysis.AnalysisRunResult;
import com.domainmodel.analyzer.analysis.propagation.PropagationConfig;
import com.domainmodel.analyzer.analysis.repository.RepositoryIdentificationConfig;
import com.domainmodel.analyzer.cli.exception.OptionsValidationException;
import com.domainmodel.analyzer.cli.model.AnalyzeOptions;
import com.domainmodel.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.domainmodel.analyzer.cli.output.AnalyzeResultsPrinter;
import com.domainmodel.analyzer.cli.validation.AnalyzeOptionsValidator;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that analyzes compiled domain classes and writes the
 * field-requirement document.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        version = "aggregate-field-analyzer 1.0.0",
        description = "Computes, for every repository call site, the aggregate-root fields the call site needs."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private AnalyzeOptions options = new AnalyzeOptions();

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalyzeResultsPrinter printer = new AnalyzeResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ValidatedAnalyzeOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            AnalysisRunResult result = new AnalysisPipeline(toConfig(options, validated)).run();

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (Exception e) {
            log.error("Analysis failed with exception", e);
            return 1;
        }
    }

    static AnalysisConfig toConfig(AnalyzeOptions o, ValidatedAnalyzeOptions v) {
        return AnalysisConfig.builder()
                .classDirs(v.getClassDirs())
                .outputFile(v.getOutputFile())
                .repositoryIdentification(RepositoryIdentificationConfig.builder()
                        .markerInterfaces(o.getRepositoryInterfaces())
                        .repositoryAnnotations(o.getRepositoryAnnotations())
                        .namingTemplates(o.getNamingTemplates())
                        .build())
                .aggregateRootAnnotations(o.getAggregateAnnotations())
                .aggregateRoots(o.getAggregateRoots() == null ? List.of() : o.getAggregateRoots())
                .includePackages(o.getIncludePackages())
                .excludePackages(o.getExcludePackages())
                .propagation(PropagationConfig.builder()
                        .maxRecursionDepth(o.getMaxDepth())
                        .excludeSetterMethods(!o.isIncludeSetterMethods())
                        .enableCycleDetection(!o.isNoCycleDetection())
                        .build())
                .parallelism(v.getParallelism())
                .failOnError(o.isFailOnError())
                .prettyPrint(!o.isCompact())
                .build();
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("com.domainmodel.analyzer");
        if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
