package com.domainmodel.analyzer.util;

/**
 * Utility for class and member naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts an internal JVM name ({@code com/x/Order}) to a qualified name ({@code com.x.Order}).
     */
    public static String toQualifiedName(String internalName) {
        if (internalName == null) {
            return null;
        }
        return internalName.replace('/', '.');
    }

    /**
     * Simple name of a qualified class name; nested classes yield the innermost name.
     */
    public static String simpleName(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isEmpty()) {
            return qualifiedName;
        }
        int idx = Math.max(qualifiedName.lastIndexOf('.'), qualifiedName.lastIndexOf('$'));
        return idx < 0 ? qualifiedName : qualifiedName.substring(idx + 1);
    }

    public static String packageName(String qualifiedName) {
        if (qualifiedName == null) {
            return "";
        }
        int idx = qualifiedName.lastIndexOf('.');
        return idx < 0 ? "" : qualifiedName.substring(0, idx);
    }

    /**
     * Lower-cases the first character: {@code NowAddress1 -> nowAddress1}.
     */
    public static String lowerFirst(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toLowerCase() + name.substring(1);
    }

    /**
     * True for a non-empty name starting with a letter or underscore and containing
     * only letters, digits and underscores.
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
