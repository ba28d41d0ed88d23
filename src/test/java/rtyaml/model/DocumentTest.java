package rtyaml.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import rtyaml.Yaml;

class DocumentTest {
    @Test
    void createNodeWrapsJavaValues() {
        var doc = new Document();
        var value = new LinkedHashMap<String, Object>();
        value.put("list", List.of(1, true));
        value.put("array", new String[] {"x"});
        value.put("none", null);

        var map = assertInstanceOf(YamlMap.class, doc.createNode(value));
        var list = assertInstanceOf(YamlSeq.class, map.get("list"));

        assertEquals(new Scalar("1"), list.get(0));
        assertEquals(new Scalar("true"), list.get(1));
        assertInstanceOf(YamlSeq.class, map.get("array"));
        assertNull(((Scalar) map.get("none")).getValue());
    }

    @Test
    void createNodeWrapsObjectArrays() {
        var seq = assertInstanceOf(YamlSeq.class,
                new Document().createNode(new Object[] {"a", null}));

        assertEquals(2, seq.size());
        assertEquals("a", ((Scalar) seq.get(0)).getValue());
        assertNull(((Scalar) seq.get(1)).getValue());
    }

    @Test
    void createNodeKeepsNodes() {
        var node = new Scalar("x");

        assertSame(node, new Document().createNode(node));
    }

    @Test
    void toJavaConvertsTree() {
        var doc = Yaml.parseDocument("a:\n  - 1\n  - b: c\nd:\n");
        var expected = new LinkedHashMap<Object, Object>();
        expected.put("a", List.of("1", Map.of("b", "c")));
        expected.put("d", null);

        assertEquals(expected, doc.toJava());
    }

    @Test
    void mutationClearsRange() {
        var doc = Yaml.parseDocument("- a\n- b\n");
        var seq = (YamlSeq) doc.getContents();
        var first = (Scalar) seq.get(0);

        assertNotNull(seq.getRange());
        assertEquals(new SourceRange(2, 4), first.getRange());

        first.setValue("z");
        seq.add(new Scalar("c"));

        assertNull(first.getRange());
        assertNull(seq.getRange());
        assertEquals("- z\n- b\n- c\n", doc.toString());
    }

    @Test
    void emptyDocument() {
        var doc = new Document();

        assertNull(doc.toJava());
        assertEquals("null\n", doc.toString());
    }

    @Test
    void commentsJoinLines() {
        assertEquals("a\nb", Comments.join("a", "b"));
        assertEquals("a", Comments.join("a", null));
        assertEquals(List.of("", "x"), Comments.lines("\nx"));
        assertNull(Comments.join(List.of()));
    }
}
