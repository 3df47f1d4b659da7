package com.domainmodel.analyzer.bytecode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

/**
 * Finds {@code .class} files under compiled-output directories and maps them
 * to qualified class names.
 */
@RequiredArgsConstructor
public class ClassFileDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(ClassFileDiscoveryService.class);

    private static final String CLASS_SUFFIX = ".class";

    private final ClassNameFilter filter;

    /**
     * @return class name to file, sorted by class name; the first directory wins on duplicates
     */
    public Map<String, Path> discover(List<Path> classDirs) throws IOException {
        Map<String, Path> found = new TreeMap<>();
        for (Path dir : classDirs) {
            if (!Files.isDirectory(dir)) {
                log.warn("Class directory does not exist, skipping: {}", dir);
                continue;
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(CLASS_SUFFIX))
                        .forEach(p -> {
                            String className = toClassName(dir, p);
                            if (filter.accept(className)) {
                                found.putIfAbsent(className, p);
                            }
                        });
            }
            log.debug("Scanned {}: {} classes accepted so far", dir, found.size());
        }
        return found;
    }

    static String toClassName(Path root, Path classFile) {
        String relative = root.relativize(classFile).toString().replace('\\', '/');
        return relative.substring(0, relative.length() - CLASS_SUFFIX.length()).replace('/', '.');
    }
}
