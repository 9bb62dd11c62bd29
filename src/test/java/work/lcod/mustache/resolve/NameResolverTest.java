package work.lcod.mustache.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.mustache.support.MustacheTestSupport.map;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.mustache.scope.ScopeStack;
import work.lcod.mustache.value.Resolution;

class NameResolverTest {
    @Test
    void nearestFrameShadowsAncestors() {
        var scopes = new ScopeStack(map("count", 1, "title", "root"));
        scopes.push(map("count", 2));
        var inner = scopes.push(map("other", true));

        assertEquals(Resolution.found(2), NameResolver.resolve(inner, "count"));
        assertEquals(Resolution.found("root"), NameResolver.resolve(inner, "title"));
    }

    @Test
    void missingEverywhereIsNotFound() {
        var scopes = new ScopeStack(map("a", 1));
        var inner = scopes.push(map("b", 2));

        assertFalse(NameResolver.resolve(inner, "c").isFound());
    }

    @Test
    void nonMapFramesAreSkippedDuringChainWalk() {
        var scopes = new ScopeStack(map("name", "outer"));
        scopes.push(List.of(1, 2));
        var inner = scopes.push("just text");

        assertEquals(Resolution.found("outer"), NameResolver.walkChain(inner, "name"));
    }

    @Test
    void nullBindingShadowsAncestorValue() {
        var scopes = new ScopeStack(map("flag", "set"));
        var inner = scopes.push(map("flag", null));

        var resolved = NameResolver.resolve(inner, "flag");
        assertTrue(resolved.isFound());
        assertNull(resolved.value());
        assertTrue(resolved.isFalsy());
    }

    @Test
    void dottedNameDescendsIntoHeadValue() {
        var scopes = new ScopeStack(map("nested", map("item", "dot notation success")));
        var inner = scopes.push(map("unrelated", 1));

        assertEquals(Resolution.found("dot notation success"), NameResolver.resolve(inner, "nested.item"));
    }

    @Test
    void dottedNameNeverFallsBackToAncestorScopes() {
        var scopes = new ScopeStack(map("b", "ancestor b", "a", map("x", 1)));
        var inner = scopes.push(map("a", map("other", 2)));

        assertFalse(NameResolver.resolve(inner, "a.b").isFound());
        assertFalse(NameResolver.resolve(inner, "a.x").isFound());
    }

    @Test
    void dottedNameThroughNonMapIsNotFound() {
        var scopes = new ScopeStack(map("b", "ancestor b"));
        var inner = scopes.push(map("a", "scalar"));

        assertFalse(NameResolver.resolve(inner, "a.b").isFound());
    }

    @Test
    void dottedNameDoesNotIndexIntoArrays() {
        var root = new ScopeStack(map("items", List.of("zero", "one"))).root();

        assertFalse(NameResolver.resolve(root, "items.0").isFound());
    }

    @Test
    void deepDescentFollowsEverySegment() {
        var root = new ScopeStack(map("a", map("b", map("c", "deep")))).root();

        assertEquals(Resolution.found("deep"), NameResolver.resolve(root, "a.b.c"));
        assertFalse(NameResolver.resolve(root, "a.b.c.d").isFound());
        assertFalse(NameResolver.resolve(root, "a.c").isFound());
    }

    @Test
    void emptySegmentsAreLiteralKeys() {
        var root = new ScopeStack(map("a", map("", "empty key"), "", map("b", "under empty"))).root();

        assertEquals(Resolution.found("empty key"), NameResolver.resolve(root, "a."));
        assertEquals(Resolution.found("under empty"), NameResolver.resolve(root, ".b"));
        assertFalse(NameResolver.resolve(root, "a..b").isFound());
    }

    @Test
    void literalDottedKeyIsNotMatchedAsAWhole() {
        var root = new ScopeStack(map("a.b", "literal")).root();

        assertFalse(NameResolver.resolve(root, "a.b").isFound());
    }

    @Test
    void descendStartsFromGivenRootOnly() {
        Map<String, Object> localRoot = map("x", map("y", 3));

        assertEquals(Resolution.found(3), NameResolver.descend(localRoot, List.of("x", "y")));
        assertEquals(Resolution.found(localRoot), NameResolver.descend(localRoot, List.of()));
        assertFalse(NameResolver.descend("scalar", List.of("x")).isFound());
    }

    @Test
    void parsesHeadAndTail() {
        assertEquals(new NamePath("a", List.of("b", "c")), NamePath.parse("a.b.c"));
        assertEquals(new NamePath("plain", List.of()), NamePath.parse("plain"));
        assertEquals(new NamePath("", List.of("")), NamePath.parse("."));
        assertFalse(NamePath.parse("plain").isDotted());
    }
}
