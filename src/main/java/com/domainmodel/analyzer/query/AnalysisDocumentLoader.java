package com.domainmodel.analyzer.query;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.result.AnalysisDocument;
import com.domainmodel.analyzer.result.AnalysisDocumentSerializer;

/**
 * Supplies the analysis document to the query layer. An absent or unreadable
 * document is an empty result, never an exception.
 */
@FunctionalInterface
public interface AnalysisDocumentLoader {

    String DEFAULT_RESOURCE = "META-INF/aggregate-field-analyzer/call-analysis.json";

    Optional<AnalysisDocument> load();

    static AnalysisDocumentLoader fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE, Thread.currentThread().getContextClassLoader());
    }

    static AnalysisDocumentLoader fromClasspath(String resource, ClassLoader classLoader) {
        Logger log = LoggerFactory.getLogger(AnalysisDocumentLoader.class);
        return () -> {
            ClassLoader loader = classLoader != null ? classLoader : AnalysisDocumentLoader.class.getClassLoader();
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    log.debug("Analysis resource {} not found on classpath", resource);
                    return Optional.empty();
                }
                return Optional.of(new AnalysisDocumentSerializer().read(in));
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to load analysis resource {}: {}", resource, e.getMessage());
                return Optional.empty();
            }
        };
    }

    static AnalysisDocumentLoader fromFile(Path file) {
        Logger log = LoggerFactory.getLogger(AnalysisDocumentLoader.class);
        return () -> {
            if (!Files.isRegularFile(file)) {
                log.debug("Analysis file {} does not exist", file);
                return Optional.empty();
            }
            try {
                return Optional.of(new AnalysisDocumentSerializer().read(file));
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to load analysis file {}: {}", file, e.getMessage());
                return Optional.empty();
            }
        };
    }

    static AnalysisDocumentLoader of(AnalysisDocument document) {
        return () -> Optional.ofNullable(document);
    }
}
