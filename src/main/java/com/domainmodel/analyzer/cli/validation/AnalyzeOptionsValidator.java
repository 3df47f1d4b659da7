package com.domainmodel.analyzer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.domainmodel.analyzer.analysis.repository.RepositoryIdentificationConfig;
import com.domainmodel.analyzer.cli.exception.OptionsValidationException;
import com.domainmodel.analyzer.cli.model.AnalyzeOptions;
import com.domainmodel.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.domainmodel.analyzer.util.NamingUtil;

public class AnalyzeOptionsValidator {

	static final Path DEFAULT_OUTPUT = Path.of("META-INF", "aggregate-field-analyzer", "call-analysis.json");

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> classDirs = o.getClassDirs() == null ? List.of() : o.getClassDirs();
		if (classDirs.isEmpty()) {
			errors.add("At least one classes directory is required (--classes-dir / -c).");
		}
		List<Path> normalizedDirs = new ArrayList<>();
		for (Path dir : classDirs) {
			if (!existsDirectory(dir)) {
				errors.add("Classes directory does not exist or is not a directory: " + dir);
			} else {
				normalizedDirs.add(dir.toAbsolutePath().normalize());
			}
		}

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			}
		} else if (!normalizedDirs.isEmpty()) {
			outputFile = normalizedDirs.get(0).resolve(DEFAULT_OUTPUT);
		}

		if (o.getMaxDepth() < 1) {
			errors.add("Max depth must be >= 1. Got: " + o.getMaxDepth());
		}
		if (o.getParallelism() < 0) {
			errors.add("Parallelism must be >= 0. Got: " + o.getParallelism());
		}

		if (o.getNamingTemplates() != null) {
			for (String template : o.getNamingTemplates()) {
				if (!template.contains(RepositoryIdentificationConfig.AGGREGATE_PLACEHOLDER)) {
					errors.add("Naming template must contain " + RepositoryIdentificationConfig.AGGREGATE_PLACEHOLDER
							+ ": " + template);
				}
			}
		}

		if (o.getAggregateRoots() != null) {
			for (String root : o.getAggregateRoots()) {
				if (!isQualifiedName(root)) {
					errors.add("Aggregate root is not a valid class name: " + root);
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		int parallelism = o.getParallelism() == 0 ? Runtime.getRuntime().availableProcessors() : o.getParallelism();
		return new ValidatedAnalyzeOptions(normalizedDirs, outputFile, parallelism);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isQualifiedName(String name) {
		if (name == null || name.isBlank()) {
			return false;
		}
		for (String part : name.split("\\.", -1)) {
			if (!NamingUtil.isIdentifier(part.replace("$", "_"))) {
				return false;
			}
		}
		return true;
	}
}
