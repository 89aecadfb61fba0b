package io.surfworks.warpedit.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ScopesTest {

    @Test
    void finalizeScopeAddsOneSeparator() {
        assertEquals("", Scopes.finalizeScope(""));
        assertEquals("", Scopes.finalizeScope(null));
        assertEquals("a/", Scopes.finalizeScope("a"));
        assertEquals("a/b/", Scopes.finalizeScope("a/b//"));
        assertEquals("", Scopes.finalizeScope("/"));
    }

    @Test
    void splitsNames() {
        assertEquals("a/b/", Scopes.dirname("a/b/c"));
        assertEquals("", Scopes.dirname("c"));
        assertEquals("c", Scopes.basename("a/b/c"));
        assertEquals("c", Scopes.basename("c"));
    }

    @Test
    void stripsTrailingSeparator() {
        assertEquals("a/b", Scopes.withoutTrailingSeparator("a/b/"));
        assertEquals("a", Scopes.withoutTrailingSeparator("a"));
    }
}
