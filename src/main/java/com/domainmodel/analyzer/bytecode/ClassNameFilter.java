package com.domainmodel.analyzer.bytecode;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which classes take part in the analysis.
 *
 * Patterns are dot-separated globs: {@code **} matches any sequence of
 * characters (dots included), {@code *} any sequence without a dot. Generated
 * proxies, lambdas and platform/framework classes are always left out.
 */
public class ClassNameFilter {

    public static final List<String> DEFAULT_INCLUDES = List.of("**");
    public static final List<String> DEFAULT_EXCLUDES = List.of("**.test.**", "**.tests.**");

    private static final List<String> EXCLUDED_PREFIXES =
            List.of("java.", "javax.", "jdk.", "sun.", "kotlin.", "kotlinx.", "org.springframework.", "org.junit.");

    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    public ClassNameFilter(List<String> includePatterns, List<String> excludePatterns) {
        this.includes = compile(includePatterns == null || includePatterns.isEmpty() ? DEFAULT_INCLUDES : includePatterns);
        this.excludes = compile(excludePatterns == null ? List.of() : excludePatterns);
    }

    public static ClassNameFilter defaults() {
        return new ClassNameFilter(DEFAULT_INCLUDES, DEFAULT_EXCLUDES);
    }

    public boolean accept(String className) {
        if (isBuiltInExclusion(className)) {
            return false;
        }
        return matchesAny(includes, className) && !matchesAny(excludes, className);
    }

    static boolean isBuiltInExclusion(String className) {
        if (className.contains("$$") || className.contains("$lambda") || className.contains("$Lambda")) {
            return true;
        }
        if (className.endsWith("package-info") || className.equals("module-info")) {
            return true;
        }
        return EXCLUDED_PREFIXES.stream().anyMatch(className::startsWith);
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^.]*");
                }
            } else if (c == '.' || c == '$') {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs.stream().map(String::trim).filter(s -> !s.isEmpty()).map(ClassNameFilter::toRegex).toList();
    }

    private static boolean matchesAny(List<Pattern> patterns, String className) {
        return patterns.stream().anyMatch(p -> p.matcher(className).matches());
    }
}
