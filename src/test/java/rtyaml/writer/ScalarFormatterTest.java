package rtyaml.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rtyaml.model.Chomping;
import rtyaml.model.Scalar;
import rtyaml.model.ScalarStyle;

class ScalarFormatterTest {
    @ParameterizedTest
    @ValueSource(strings = {"", " lead", "trail ", "- item", "? key", ":", "key: value",
        "value #note", "ends:", "---", "...", "[x", "*alias", "&anchor", "!tag", "%d", "@at",
        "`tick", "|pipe", ">fold", "'q", "\"q", "tab\tin", "bell\u0007"})
    void unsafePlain(String value) {
        assertFalse(ScalarFormatter.isPlainSafe(value, false));
    }

    @ParameterizedTest
    @ValueSource(strings = {"plain", "with space", "a-b", "-1", "http://x.org/#a", "a:b",
        "key?", "it's"})
    void safePlain(String value) {
        assertTrue(ScalarFormatter.isPlainSafe(value, false));
    }

    @Test
    void flowIndicatorsNeedQuotesInFlow() {
        assertTrue(ScalarFormatter.isPlainSafe("a,b", false));
        assertFalse(ScalarFormatter.isPlainSafe("a,b", true));
    }

    @Test
    void doubleQuotedEscapes() {
        assertEquals("\"a\\\\b\\\"c\\0\\t\\n\\x07\"",
                ScalarFormatter.doubleQuoted("a\\b\"c\0\t\n\u0007"));
    }

    @Test
    void chompingFromTrailingBreaks() {
        assertEquals(Chomping.STRIP, ScalarFormatter.chomping(block("a")));
        assertEquals(Chomping.CLIP, ScalarFormatter.chomping(block("a\n")));
        assertEquals(Chomping.KEEP, ScalarFormatter.chomping(block("a\n\n")));

        var kept = block("a\n");
        kept.setChomping(Chomping.KEEP);

        assertEquals(Chomping.KEEP, ScalarFormatter.chomping(kept));
    }

    @Test
    void foldedLinesAreSplitBack() {
        var folded = new Scalar("one two\nthree\n  indented\n", ScalarStyle.BLOCK_FOLDED);

        assertEquals(List.of("one two", "", "three", "  indented"),
                ScalarFormatter.blockLines(folded));
    }

    @Test
    void literalLinesAreKept() {
        assertEquals(List.of("a", "", "b"), ScalarFormatter.blockLines(block("a\n\nb\n")));
    }

    private static Scalar block(String value) {
        return new Scalar(value, ScalarStyle.BLOCK_LITERAL);
    }
}
