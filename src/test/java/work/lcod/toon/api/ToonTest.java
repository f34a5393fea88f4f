package work.lcod.toon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.toon.support.ToonTestSupport.lines;
import static work.lcod.toon.support.ToonTestSupport.list;
import static work.lcod.toon.support.ToonTestSupport.nestedLists;
import static work.lcod.toon.support.ToonTestSupport.obj;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.toon.error.MaxDepthExceededException;
import work.lcod.toon.value.Replacer;

class ToonTest {
    @Test
    void tabularArrayOfRecords() {
        var rows = list(obj("a", 1, "b", 2), obj("a", 3, "b", 4));
        assertEquals(lines("[2]{a,b}:", "  1,2", "  3,4"), Toon.encode(rows));
    }

    @Test
    void inlineRootArray() {
        assertEquals("[3]: 1,2,3", Toon.encode(list(1, 2, 3)));
    }

    @Test
    void emptyArrayUnderKey() {
        assertEquals("tags[0]", Toon.encode(obj("tags", list())));
    }

    @Test
    void keyCollapsingAndCollisionFallback() {
        var options = EncodeOptions.builder().keyCollapsing(KeyCollapsing.SAFE).build();
        assertEquals("a.b.c: 1", Toon.encode(obj("a", obj("b", obj("c", 1))), options));
        assertEquals(lines("a:", "  b:", "    c: 1", "a.b.c: 2"),
            Toon.encode(obj("a", obj("b", obj("c", 1)), "a.b.c", 2), options));
    }

    @Test
    void nonFiniteNumbersKeepTabularEligibility() {
        var rows = list(obj("a", Double.NaN, "b", 1), obj("a", 2, "b", Double.POSITIVE_INFINITY));
        assertEquals(lines("[2]{a,b}:", "  null,1", "  2,null"), Toon.encode(rows));
    }

    @Test
    void delimiterPropagatesToQuoting() {
        var options = EncodeOptions.builder().delimiter(Delimiter.PIPE).build();
        assertEquals("[2|]: a,b|c", Toon.encode(list("a,b", "c"), options));
    }

    @Test
    void objectsWithoutCommonKeysFallBackToList() {
        assertEquals(lines("[2]:", "  - a: 1", "  - b: 2"), Toon.encode(list(obj("a", 1), obj("b", 2))));
    }

    @Test
    void encodingIsDeterministic() {
        var doc = obj("items", list(obj("id", 1, "tags", list("x")), 5), "meta", obj("v", 1.5));
        assertEquals(Toon.encode(doc), Toon.encode(doc));
    }

    @Test
    void rootPrimitivesAndEmptyObject() {
        assertEquals("null", Toon.encode(null));
        assertEquals("42", Toon.encode(42));
        assertEquals("\"true\"", Toon.encode("true"));
        assertEquals("hello", Toon.encode("hello"));
        assertEquals("", Toon.encode(obj()));
    }

    @Test
    void documentMixingEveryLayout() {
        var doc = obj(
            "name", "demo",
            "tags", list("a", "b"),
            "users", list(obj("id", 1, "name", "Ada"), obj("id", 2, "name", "Linus")),
            "misc", list(1, obj("k", "v")),
            "empty", list()
        );
        assertEquals(lines(
            "name: demo",
            "tags[2]: a,b",
            "users[2]{id,name}:",
            "  1,Ada",
            "  2,Linus",
            "misc[2]:",
            "  - 1",
            "  - k: v",
            "empty[0]"
        ), Toon.encode(doc));
    }

    @Test
    void customIndentation() {
        var options = EncodeOptions.builder().indent(4).build();
        assertEquals(lines("a:", "    b: 1"), Toon.encode(obj("a", obj("b", 1)), options));
    }

    @Test
    void encodeLinesMatchesEncode() {
        var doc = obj("a", obj("b", 1), "c", list(1, 2));
        assertEquals(List.of("a:", "  b: 1", "c[2]: 1,2"), Toon.encodeLines(doc, EncodeOptions.defaults()));
    }

    @Test
    void replacerRunsBeforeEncoding() {
        Replacer redact = (key, value, path) -> "secret".equals(key) ? Replacer.OMIT : value;
        var options = EncodeOptions.builder().replacer(redact).build();
        assertEquals("user: ada", Toon.encode(obj("user", "ada", "secret", "x"), options));
    }

    @Test
    void depthBoundIsEnforced() {
        var options = EncodeOptions.builder().maxDepth(5).build();
        assertEquals("[1]:\n  - [1]:\n    - [1]:\n      - [1]:\n        - [1]: 1", Toon.encode(nestedLists(5), options));
        assertThrows(MaxDepthExceededException.class, () -> Toon.encode(nestedLists(6), options));
    }
}
