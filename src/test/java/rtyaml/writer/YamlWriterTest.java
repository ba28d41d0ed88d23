package rtyaml.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rtyaml.Yaml;
import rtyaml.model.Collection;
import rtyaml.model.Commentable;
import rtyaml.model.Document;
import rtyaml.model.Pair;
import rtyaml.model.Scalar;
import rtyaml.model.ScalarStyle;
import rtyaml.model.YamlMap;
import rtyaml.model.YamlSeq;

class YamlWriterTest {
    private static String roundTrip(String src) {
        return Yaml.parseDocument(src).toString();
    }

    @Nested
    class ScalarComments {
        @Test
        void plainSingleLine() {
            var doc = Yaml.parseDocument("string");
            doc.getContents().setComment("comment");

            assertEquals("string #comment\n", doc.toString());
        }

        @Test
        void quotedSingleLine() {
            var doc = Yaml.parseDocument("\"string\\u0000\"");
            doc.getContents().setComment("comment");

            assertEquals("\"string\\0\" #comment\n", doc.toString());
        }

        @Test
        void blockSingleLine() {
            var doc = Yaml.parseDocument(">\nstring\n");
            doc.getContents().setComment("comment");

            assertEquals("> #comment\nstring\n", doc.toString());
        }

        @Test
        void plainMultilineGoesBeforeTheValue() {
            var doc = Yaml.parseDocument("string");
            doc.getContents().setComment("comment\nlines");

            assertEquals("#comment\n#lines\nstring\n", doc.toString());
        }

        @Test
        void quotedMultilineGoesAfterTheValue() {
            var doc = Yaml.parseDocument("\"string\\u0000\"");
            doc.getContents().setComment("comment\nlines");

            assertEquals("\"string\\0\"\n#comment\n#lines\n", doc.toString());
        }

        @Test
        void blockMultilineJoinsIntoTheHeader() {
            var doc = Yaml.parseDocument(">\nstring\n");
            doc.getContents().setComment("comment\nlines");

            assertEquals("> #comment lines\nstring\n", doc.toString());
        }
    }

    @Nested
    class DocumentComments {
        @Test
        void directives() {
            assertEquals("#comment\n#comment\n\n%YAML 1.2\n---\nstring\n",
                    roundTrip("#comment\n%YAML 1.2 #comment\n---\nstring\n"));
        }

        @Test
        void commentBeforeMarker() {
            var doc = Yaml.parseDocument("#c0\n---\nstring");
            doc.setCommentBefore(doc.getCommentBefore() + "\nc1");

            assertEquals("#c0\n#c1\n---\nstring\n", doc.toString());
        }

        @Test
        void bodyStartComments() {
            var src = "---\n#comment\n#\n#comment\nstring";

            assertEquals(src + "\n", roundTrip(src));
        }

        @Test
        void bodyEndComments() {
            assertEquals("string\n\n#comment\n#comment\n",
                    roundTrip("\nstring\n#comment\n#comment\n"));
        }
    }

    @Nested
    class CollectionComments {
        @Test
        void seq() {
            var doc = Yaml.parseDocument("- value 1\n- value 2\n");
            var seq = (YamlSeq) doc.getContents();
            seq.setCommentBefore("c0");
            ((Scalar) seq.get(0)).setCommentBefore("c1");
            ((Scalar) seq.get(1)).setCommentBefore("c2");
            seq.setComment("c3");

            assertEquals("#c0\n#c1\n- value 1\n#c2\n- value 2\n#c3\n", doc.toString());
        }

        @Test
        void seqMultiline() {
            var doc = Yaml.parseDocument("- value 1\n- value 2\n");
            var seq = (YamlSeq) doc.getContents();
            ((Scalar) seq.get(0)).setCommentBefore("c0\nc1");
            ((Scalar) seq.get(1)).setCommentBefore("\nc2\n\nc3");
            seq.setComment("c4\nc5");

            assertEquals("#c0\n#c1\n- value 1\n#\n#c2\n#\n#c3\n- value 2\n#c4\n#c5\n",
                    doc.toString());
        }

        @Test
        void seqInMap() {
            var doc = Yaml.parseDocument("map:\n  - value 1\n  - value 2\n");
            var pair = ((YamlMap) doc.getContents()).get(0);
            var key = (Scalar) pair.getKey();
            key.setCommentBefore("c0");
            key.setComment("c1");
            pair.setComment("c2");

            var seq = (YamlSeq) pair.getValue();
            ((Scalar) seq.get(0)).setCommentBefore("c3");
            ((Scalar) seq.get(1)).setCommentBefore("c4");
            seq.setComment("c5");

            assertEquals("c2", key.getComment());
            assertEquals("#c0\nmap: #c2\n  #c3\n  - value 1\n  #c4\n  - value 2\n  #c5\n",
                    doc.toString());
        }

        @Test
        void mapEntries() {
            var doc = Yaml.parseDocument("key1: value 1\nkey2: value 2\n");
            var map = (YamlMap) doc.getContents();
            map.get(0).setCommentBefore("c0");
            map.get(1).setCommentBefore("c1");
            map.get(1).setComment("c2");
            ((Scalar) map.get(1).getValue()).setSpaceBefore(true);
            map.setComment("c3");

            assertEquals("#c0\nkey1: value 1\n#c1\nkey2: #c2\n\n  value 2\n#c3\n",
                    doc.toString());
        }

        @Test
        void mapEntriesMultiline() {
            var doc = Yaml.parseDocument("key1: value 1\nkey2: value 2\n");
            var map = (YamlMap) doc.getContents();
            map.get(0).setCommentBefore("c0\nc1");
            map.get(1).setCommentBefore("\nc2\n\nc3");
            map.get(1).setComment("c4\nc5");

            var value = (Scalar) map.get(1).getValue();
            value.setSpaceBefore(true);
            value.setCommentBefore("c6");
            map.setComment("c7\nc8");

            assertEquals("#c0\n#c1\nkey1: value 1\n#\n#c2\n#\n#c3\nkey2:\n  #c4\n  #c5\n\n"
                    + "  #c6\n  value 2\n#c7\n#c8\n", doc.toString());
        }

        @Test
        void mapInSeq() {
            var src = "#c0\n- #c1\n  k1: v1\n  #c2\n  k2: v2 #c3\n#c4\n  k3: v3\n#c5\n";

            assertEquals("#c0\n#c1\n- k1: v1\n  #c2\n  k2: v2 #c3\n  #c4\n  k3: v3\n\n#c5\n",
                    roundTrip(src));
        }

        @Test
        void commentAfterKeyStaysOnTheKeyLine() {
            var src = "#c0\nk1: #c1\n  - v1\n#c2\n  - v2\n  #c3\nk2:\n  - v3 #c4\n#c5\n";

            assertEquals("#c0\nk1: #c1\n  - v1\n  #c2\n  - v2\n  #c3\nk2:\n  - v3 #c4\n\n#c5\n",
                    roundTrip(src));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "- value 1\n#c0\n#c1\n\n#c2\n- value 2\n",
            "key1: value 1\n#c0\n#c1\n\n#c2\nkey2: value 2\n",
            "a:\n  - v1\n  #c0\n  #c1\n\n  - v2\n"
        })
        void multilineTrailingCommentFollowsTheValue(String src) {
            assertEquals(src, roundTrip(src));
        }

        @Test
        void multilineCommentOnQuotedValue() {
            var doc = Yaml.parseDocument("a: \"x\"\n");
            ((Scalar) ((YamlMap) doc.getContents()).get(0).getValue()).setComment("comment\nlines");

            assertEquals("a: \"x\"\n#comment\n#lines\n", doc.toString());
        }

        @Test
        void trailingCommentMovesOntoTheValueLine() {
            assertEquals("#c0\n- value 1 #c1\n\n- value 2\n\n#c2\n",
                    roundTrip("#c0\n- value 1\n#c1\n\n- value 2\n\n#c2"));
        }
    }

    @Nested
    class BlankLines {
        @ParameterizedTest
        @ValueSource(strings = {
            "- a\n\n- b\n\n- c\n",
            "#cc\n\n%YAML 1.2\n---\nstr\n",
            "a: |+\n  A\n\nb: B\n",
            "a:\n  - |+\n    A\n\nb: B\n",
            "- |+\n  a\n\n- b\n",
            "|+\n  a\n\n#c\n",
            "a:\n\n  1\nb:\n\n  #c\n  2\n",
            "{\n  a:\n    #c\n    1,\n  b:\n\n    #d\n    2\n}\n",
            "a:\n  - aa\n\nb:\n  - bb\n\nc: cc\n",
            "- a: aa\n\n- b: bb\n  c: cc\n\n- d: dd\n",
            "test1:\n  foo:\n    #123\n    bar: 1\n",
            "foo:\n  #123\n  bar: baz\n",
            "#0\n- - a\n  - b\n  #1\n\n#2\n- d\n",
            "#0\n- a: 1\n  b: 2\n  #1\n\n#2\n- d\n",
            "#0\na:\n  - b\n  - c\n  #1\n\n#2\nd: 1\n",
            "#0\na:\n  b: 1\n  c: 2\n  #1\n\n#2\nd: 1\n",
            "#0\na:\n  #1\n  - b:\n      - c\n\n  #2\n  - e\n",
            "# This comment is ok\nentryA:\n  - foo\n\nentryB:\n  - bar # bar comment\n\n"
                    + "# Ending comment\n# Ending comment 2\n"
        })
        void unchanged(String src) {
            assertEquals(src, roundTrip(src));
        }

        @Test
        void leadingBlankLinesAreDropped() {
            assertEquals("str\n", roundTrip("\n\nstr\n"));
            assertEquals("#cc\n\nstr\n", roundTrip("\n\n#cc\n\nstr\n"));
            assertEquals("%YAML 1.2\n---\nstr\n", roundTrip("\n\n%YAML 1.2\n---\nstr\n"));
            assertEquals("#cc\n\n%YAML 1.2\n---\nstr\n",
                    roundTrip("\n\n#cc\n%YAML 1.2\n---\nstr\n"));
        }

        @Test
        void trailingBlankLinesAreDropped() {
            assertEquals("null\n", roundTrip("\n\n\n"));
            assertEquals("str\n", roundTrip("str\n\n\n"));
            assertEquals("- a\n- b\n", roundTrip("- a\n- b\n\n\n"));
            assertEquals("#cc\n\nnull\n", roundTrip("#cc\n\n\n"));
        }

        @Test
        void runsCollapseToOne() {
            assertEquals("#cc\n\n%YAML 1.2\n---\nstr\n",
                    roundTrip("#cc\n\n\n%YAML 1.2\n---\nstr\n"));
            assertEquals("#cc\n\nstr\n", roundTrip("#cc\n\n\nstr\n"));
            assertEquals("- a\n\n- b\n\n- c\n", roundTrip("- a\n\n- b\n\n\n- c\n"));
            assertEquals("#A\n- a\n\n#B\n- b\n\n#C\n- c\n",
                    roundTrip("#A\n- a\n\n#B\n- b\n\n\n#C\n\n- c\n"));
        }

        @Test
        void spaceBeforeFirstNodeAfterMarker() {
            var doc = Yaml.parseDocument("str\n");
            doc.setDirectivesEndMarker(true);
            doc.getContents().setSpaceBefore(true);

            assertEquals("---\n\nstr\n", doc.toString());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "- |+\n  a\n\n- b\n",
            "a: |+\n  A\n\nb: B\n",
            "a:\n  - |+\n    A\n\nb: B\n"
        })
        void notAddedAfterKeepChompedBlockScalar(String src) {
            var doc = Yaml.parseDocument(src);
            var items = ((Collection<?>) doc.getContents()).getItems();
            var second = (Commentable) items.get(1);

            assertFalse(second.isSpaceBefore());

            second.setSpaceBefore(true);

            assertEquals(src, doc.toString());
        }

        @Test
        void afterBlockValuesInSeq() {
            assertEquals("- |\n  a\n\n- >-\n  b\n\n- |+\n  c\n\n- d\n",
                    roundTrip("- |\n a\n\n- >-\n b\n\n- |+\n c\n\n- d\n"));
        }

        @Test
        void afterBlockValuesInMap() {
            assertEquals("A: |\n  a\n\nB: >-\n  b\n\nC: |+\n  c\n\nD: d\n",
                    roundTrip("A: |\n a\n\nB: >-\n b\n\nC: |+\n c\n\nD: d\n"));
        }

        @Test
        void emptyRootBlockScalarBeforeDocumentComment() {
            var doc = Yaml.parseDocument("  >-\n\n #t\n");

            assertEquals("", doc.toJava());
            assertEquals("t", doc.getComment());

            var once = doc.toString();
            var again = Yaml.parseDocument(once);

            assertEquals(">2-\n\n#t\n", once);
            assertEquals("", again.toJava());
            assertEquals("t", again.getComment());
            assertEquals(once, again.toString());
        }

        @Test
        void collectionEndCommentOfRootMap() {
            assertEquals("a: b #c\n\n#d\n", roundTrip("a: b #c\n#d\n"));
        }
    }

    @Nested
    class FlowCollections {
        @Test
        void blankLinesSplitItemsOntoLines() {
            assertEquals("[\n  1,\n\n  2,\n  3,\n\n  4\n]\n", roundTrip("[1,\n\n2,\n3,\n\n4\n\n]"));
        }

        @Test
        void compactFormWithoutComments() {
            assertEquals("[ a, b ]\n", roundTrip("[a,b]"));
            assertEquals("{ a: 1, b: [ x ] }\n", roundTrip("{a: 1, b: [x]}"));
            assertEquals("a: []\nb: {}\n", roundTrip("a: []\nb: {}\n"));
        }

        @Test
        void itemCommentsSplitItemsOntoLines() {
            assertEquals("[\n  a, #first\n  b\n]\n", roundTrip("[ a, #first\n  b ]\n"));
        }

        @Test
        void wideCollectionsBreak() {
            var doc = new Document(List.of("alpha", "beta", "gamma", "delta"));
            ((YamlSeq) doc.getContents()).setFlow(true);

            assertEquals("[ alpha, beta, gamma, delta ]\n", doc.toString());
            assertEquals("[\n  alpha,\n  beta,\n  gamma,\n  delta\n]\n",
                    doc.toString(new WriterSettings(2, 20)));
        }
    }

    @Nested
    class Values {
        @Test
        void createdNodes() {
            var value = new LinkedHashMap<String, Object>();
            value.put("name", "rtyaml");
            value.put("tags", List.of("yaml", "comments"));
            value.put("empty", null);

            assertEquals("name: rtyaml\ntags:\n  - yaml\n  - comments\nempty:\n",
                    new Document(value).toString());
        }

        @Test
        void scalarsNeedingQuotes() {
            var doc = new Document(List.of("a: b", "- x", " padded", "it's", "#tag", "line\nbreak",
                    ""));

            assertEquals("- \"a: b\"\n- \"- x\"\n- \" padded\"\n- it's\n- \"#tag\"\n"
                    + "- \"line\\nbreak\"\n- \"\"\n", doc.toString());
        }

        @Test
        void singleQuotedStyleIsKept() {
            assertEquals("a: 'it''s'\n", roundTrip("a: 'it''s'\n"));
        }

        @Test
        void nullRootScalar() {
            assertEquals("null\n", new Document(new Scalar(null)).toString());
        }

        @Test
        void emptySeqEntry() {
            assertEquals("-\n- b\n", roundTrip("-\n- b\n"));
        }

        @Test
        void indentWidth() {
            var doc = Yaml.parseDocument("a:\n  - b:\n      c: 1\n");

            assertEquals("a:\n    -   b:\n            c: 1\n",
                    Yaml.stringify(doc, WriterSettings.DEFAULT.withIndentWidth(4)));
        }

        @Test
        void blockKeysAreExplicit() {
            var map = new YamlMap();
            map.add(new Pair(new Scalar("key\n", ScalarStyle.BLOCK_LITERAL), new Scalar("v")));

            assertEquals("? |\n  key\n: v\n", new Document(map).toString());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "a: &x 1\nb: *x\n",
            "a: !!str 1\n",
            "a: !!null\nb: 1\n",
            "&k a: 1\n",
            "base: &b\n  x: 1\nderived:\n  <<: *b\n  y: 2\n",
            "- &m\n  a: 1\n- *m\n",
            "[ &a x, *a, !t {} ]\n",
            "a: !!binary |\n  R0lG\n"
        })
        void anchorsTagsAndAliasesAreKept(String src) {
            assertEquals(src, roundTrip(src));
        }

        @Test
        void literalBlockKeepsLeadingSpaces() {
            var doc = new Document(new Scalar("  indented\ntext\n", ScalarStyle.BLOCK_LITERAL));

            assertEquals("|2\n    indented\n  text\n", doc.toString());
        }
    }

    @Test
    void writerIsReusable() {
        var doc = Yaml.parseDocument("a: 1 #c\n");
        var writer = new YamlWriter();

        assertEquals(writer.write(doc), writer.write(doc));
        assertTrue(doc.toString().endsWith("\n"));
    }
}
