package work.lcod.toon.encode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.toon.support.ToonTestSupport.obj;
import static work.lcod.toon.support.ToonTestSupport.value;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.toon.value.ToonObject;
import work.lcod.toon.value.ToonValue;

class KeyCollapserTest {
    private static final int UNBOUNDED = Integer.MAX_VALUE;

    @Test
    void collapsesChainToLeaf() {
        ToonValue chain = value(obj("b", obj("c", 1)));
        Optional<CollapseResult> result = KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, UNBOUNDED);
        assertTrue(result.isPresent());
        assertEquals("a.b.c", result.get().collapsedKey());
        assertEquals(ToonValue.number(1), result.get().leafValue());
        assertTrue(result.get().remainder().isEmpty());
        assertEquals(3, result.get().segmentCount());
    }

    @Test
    void stopsAtMultiKeyObject() {
        ToonValue chain = value(obj("b", obj("c", 1, "d", 2)));
        CollapseResult result = KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, UNBOUNDED).orElseThrow();
        assertEquals("a.b", result.collapsedKey());
        assertEquals(List.of("c", "d"), result.remainder().orElseThrow().keys());
        assertEquals(2, result.segmentCount());
    }

    @Test
    void emptyObjectLeafHasNoRemainder() {
        ToonValue chain = value(obj("b", obj()));
        CollapseResult result = KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, UNBOUNDED).orElseThrow();
        assertEquals("a.b", result.collapsedKey());
        assertTrue(result.remainder().isEmpty());
        assertEquals(ToonObject.EMPTY, result.leafValue());
    }

    @Test
    void flattenDepthBoundsTheChain() {
        ToonValue chain = value(obj("b", obj("c", obj("d", 1))));
        CollapseResult result = KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, 2).orElseThrow();
        assertEquals("a.b", result.collapsedKey());
        assertEquals(List.of("c"), result.remainder().orElseThrow().keys());
        assertFalse(KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, 1).isPresent());
    }

    @Test
    void singleSegmentIsNotACollapse() {
        assertFalse(KeyCollapser.tryCollapse("a", value(obj("b", 1, "c", 2)), List.of("a"), Set.of(), null, UNBOUNDED)
            .isPresent());
        assertFalse(KeyCollapser.tryCollapse("a", ToonValue.number(1), List.of("a"), Set.of(), null, UNBOUNDED)
            .isPresent());
    }

    @Test
    void rejectsNonIdentifierSegments() {
        ToonValue chain = value(obj("b-c", 1));
        assertFalse(KeyCollapser.tryCollapse("a", chain, List.of("a"), Set.of(), null, UNBOUNDED).isPresent());
        assertFalse(KeyCollapser.tryCollapse("x.y", value(obj("z", 1)), List.of("x.y"), Set.of(), null, UNBOUNDED)
            .isPresent());
    }

    @Test
    void rejectsSiblingCollision() {
        ToonValue chain = value(obj("b", 1));
        assertFalse(KeyCollapser.tryCollapse("a", chain, List.of("a", "a.b"), Set.of(), null, UNBOUNDED)
            .isPresent());
        assertFalse(KeyCollapser.tryCollapse("a", chain, List.of("a", "a.b", "y"), Set.of(), "x", UNBOUNDED)
            .isPresent());
        assertTrue(KeyCollapser.tryCollapse("a", chain, List.of("a", "y"), Set.of(), "x", UNBOUNDED).isPresent());
    }

    @Test
    void rejectsCollisionWithRootLiteralKeyThroughPathPrefix() {
        ToonValue chain = value(obj("c", 1));
        assertFalse(KeyCollapser.tryCollapse("b", chain, List.of("b"), Set.of("a.b.c"), "a", UNBOUNDED).isPresent());
        assertTrue(KeyCollapser.tryCollapse("b", chain, List.of("b"), Set.of("a.b.c"), "x", UNBOUNDED).isPresent());
    }
}
