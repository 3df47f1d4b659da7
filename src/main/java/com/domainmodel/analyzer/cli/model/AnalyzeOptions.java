package com.domainmodel.analyzer.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "analyze" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

	@Option(names = { "--classes-dir", "-c" }, required = true, split = ",",
			description = "Compiled class directories to analyze (comma-separated or repeated)")
	private List<Path> classDirs;

	@Option(names = { "--output", "-o" },
			description = "Output file (default: <first classes dir>/META-INF/aggregate-field-analyzer/call-analysis.json)")
	private Path output;

	@Option(names = { "--aggregate-root" }, split = ",",
			description = "Qualified aggregate root class names, in addition to annotated classes")
	private List<String> aggregateRoots;

	@Option(names = { "--aggregate-annotation" }, split = ",", defaultValue = "AggregateRoot",
			description = "Annotations marking aggregate roots (default: ${DEFAULT-VALUE})")
	private List<String> aggregateAnnotations;

	@Option(names = { "--repository-interface" }, split = ",", defaultValue = "DomainRepository",
			description = "Generic repository marker interfaces (default: ${DEFAULT-VALUE})")
	private List<String> repositoryInterfaces;

	@Option(names = { "--repository-annotation" }, split = ",", defaultValue = "DomainRepository",
			description = "Repository annotations naming their target type (default: ${DEFAULT-VALUE})")
	private List<String> repositoryAnnotations;

	@Option(names = { "--naming-template" }, split = ",",
			defaultValue = "{Aggregate}Repository,I{Aggregate}Repository,{Aggregate}Repo",
			description = "Repository naming templates (default: ${DEFAULT-VALUE})")
	private List<String> namingTemplates;

	@Option(names = { "--include-package" }, split = ",", defaultValue = "**",
			description = "Package patterns to analyze (default: ${DEFAULT-VALUE})")
	private List<String> includePackages;

	@Option(names = { "--exclude-package" }, split = ",", defaultValue = "**.test.**,**.tests.**",
			description = "Package patterns to skip (default: ${DEFAULT-VALUE})")
	private List<String> excludePackages;

	@Option(names = { "--max-depth" }, defaultValue = "10",
			description = "Maximum recursion depth through aggregate-root methods (default: ${DEFAULT-VALUE})")
	private int maxDepth;

	@Option(names = { "--include-setter-methods" },
			description = "Let setter methods and caller-side writes contribute required fields")
	private boolean includeSetterMethods;

	@Option(names = { "--no-cycle-detection" },
			description = "Disable visited-set cycle detection; only the depth bound applies")
	private boolean noCycleDetection;

	@Option(names = { "--parallelism" }, defaultValue = "0",
			description = "Worker threads for per-class analysis (0 = available processors)")
	private int parallelism;

	@Option(names = { "--fail-on-error" },
			description = "Exit non-zero on configuration or output errors")
	private boolean failOnError;

	@Option(names = { "--compact" }, description = "Write the document without indentation")
	private boolean compact;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
