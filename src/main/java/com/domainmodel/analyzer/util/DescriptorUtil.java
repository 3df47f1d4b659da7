package com.domainmodel.analyzer.util;

/**
 * Minimal reading of JVM method descriptors.
 */
public class DescriptorUtil {

    private DescriptorUtil() {
        // Utility class
    }

    /**
     * Number of parameters in a method descriptor such as {@code (JLjava/lang/String;[I)V}.
     *
     * @throws IllegalArgumentException if the descriptor is not a method descriptor
     */
    public static int argumentCount(String descriptor) {
        if (descriptor == null || descriptor.isEmpty() || descriptor.charAt(0) != '(') {
            throw new IllegalArgumentException("Not a method descriptor: " + descriptor);
        }
        int count = 0;
        int i = 1;
        while (i < descriptor.length() && descriptor.charAt(i) != ')') {
            char c = descriptor.charAt(i);
            while (c == '[' && i + 1 < descriptor.length()) {
                c = descriptor.charAt(++i);
            }
            if (c == 'L') {
                int end = descriptor.indexOf(';', i);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated class type in " + descriptor);
                }
                i = end;
            }
            count++;
            i++;
        }
        if (i >= descriptor.length()) {
            throw new IllegalArgumentException("Unterminated parameter list in " + descriptor);
        }
        return count;
    }
}
