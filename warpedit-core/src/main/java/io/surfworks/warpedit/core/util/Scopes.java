package io.surfworks.warpedit.core.util;

/**
 * Helpers for hierarchical names of the form {@code a/b/c}.
 *
 * <p>A finalized scope is either empty or ends with exactly one {@code /}, so that
 * {@code scope + relativeName} is always a well-formed name.
 */
public final class Scopes {

    public static final char SEPARATOR = '/';

    private Scopes() {}

    /**
     * Normalizes a scope to its canonical form: empty, or ending with one separator.
     */
    public static String finalizeScope(String scope) {
        if (scope == null || scope.isEmpty()) {
            return "";
        }
        int end = scope.length();
        while (end > 0 && scope.charAt(end - 1) == SEPARATOR) {
            end--;
        }
        if (end == 0) {
            return "";
        }
        return scope.substring(0, end) + SEPARATOR;
    }

    /**
     * Returns the scope part of a name, with its trailing separator ({@code "a/b/"} for {@code "a/b/c"}).
     */
    public static String dirname(String name) {
        int idx = name.lastIndexOf(SEPARATOR);
        return idx < 0 ? "" : name.substring(0, idx + 1);
    }

    /**
     * Returns the last component of a name ({@code "c"} for {@code "a/b/c"}).
     */
    public static String basename(String name) {
        int idx = name.lastIndexOf(SEPARATOR);
        return idx < 0 ? name : name.substring(idx + 1);
    }

    /**
     * Removes the trailing separator of a finalized scope ({@code "a/b"} for {@code "a/b/"}).
     */
    public static String withoutTrailingSeparator(String scope) {
        return scope.endsWith(String.valueOf(SEPARATOR)) ? scope.substring(0, scope.length() - 1) : scope;
    }
}
