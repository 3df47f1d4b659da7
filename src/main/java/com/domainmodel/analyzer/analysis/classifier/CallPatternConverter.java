package com.domainmodel.analyzer.analysis.classifier;

import java.util.Optional;

import com.domainmodel.analyzer.model.AccessKind;
import com.domainmodel.analyzer.util.NamingUtil;

/**
 * Converts method-call names into property accesses by naming convention.
 *
 * Matching order, first match wins:
 * <ol>
 *   <li>compiler-generated accessors {@code <get-x>} / {@code <set-x>}</li>
 *   <li>{@code getX()} / {@code isX()} with no arguments</li>
 *   <li>{@code setX(value)} with exactly one argument</li>
 * </ol>
 * Stateless; safe to share between threads.
 */
public class CallPatternConverter {

    private static final String SYNTHETIC_GETTER_PREFIX = "<get-";
    private static final String SYNTHETIC_SETTER_PREFIX = "<set-";
    private static final String SYNTHETIC_SUFFIX = ">";

    public Optional<PropertyCallMatch> convert(String methodName, int argCount) {
        if (methodName == null || methodName.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> synthetic = syntheticProperty(methodName, SYNTHETIC_GETTER_PREFIX);
        if (synthetic.isPresent()) {
            return Optional.of(new PropertyCallMatch(synthetic.get(), AccessKind.GET));
        }
        synthetic = syntheticProperty(methodName, SYNTHETIC_SETTER_PREFIX);
        if (synthetic.isPresent()) {
            return Optional.of(new PropertyCallMatch(synthetic.get(), AccessKind.SET));
        }

        if (argCount == 0) {
            Optional<String> getter = beanProperty(methodName, "get").or(() -> beanProperty(methodName, "is"));
            if (getter.isPresent()) {
                return Optional.of(new PropertyCallMatch(getter.get(), AccessKind.GET));
            }
        }

        if (argCount == 1) {
            Optional<String> setter = beanProperty(methodName, "set");
            if (setter.isPresent()) {
                return Optional.of(new PropertyCallMatch(setter.get(), AccessKind.SET));
            }
        }

        return Optional.empty();
    }

    /**
     * True for methods named like a property setter: {@code <set-x>}, or
     * {@code setX} taking one argument.
     */
    public boolean isSetterPattern(String methodName, int argCount) {
        return convert(methodName, argCount)
                .map(m -> m.kind() == AccessKind.SET)
                .orElse(false);
    }

    private static Optional<String> syntheticProperty(String methodName, String prefix) {
        if (!methodName.startsWith(prefix) || !methodName.endsWith(SYNTHETIC_SUFFIX)
                || methodName.length() <= prefix.length() + SYNTHETIC_SUFFIX.length()) {
            return Optional.empty();
        }
        String property = methodName.substring(prefix.length(), methodName.length() - SYNTHETIC_SUFFIX.length());
        return NamingUtil.isIdentifier(property) ? Optional.of(property) : Optional.empty();
    }

    private static Optional<String> beanProperty(String methodName, String prefix) {
        if (!methodName.startsWith(prefix) || methodName.length() == prefix.length()) {
            return Optional.empty();
        }
        String rest = methodName.substring(prefix.length());
        if (!Character.isUpperCase(rest.charAt(0)) || !NamingUtil.isIdentifier(rest)) {
            return Optional.empty();
        }
        return Optional.of(NamingUtil.lowerFirst(rest));
    }
}
