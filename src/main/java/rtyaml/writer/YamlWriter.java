package rtyaml.writer;

import java.util.ArrayList;
import java.util.List;
import rtyaml.model.Chomping;
import rtyaml.model.Collection;
import rtyaml.model.Commentable;
import rtyaml.model.Comments;
import rtyaml.model.Document;
import rtyaml.model.Node;
import rtyaml.model.Pair;
import rtyaml.model.Scalar;
import rtyaml.model.ScalarStyle;
import rtyaml.model.YamlMap;
import rtyaml.model.YamlSeq;

public class YamlWriter {
    private final WriterSettings settings;

    private final String step;

    private final String entry;

    private Document document;

    private List<String> out;

    public YamlWriter() {
        this(WriterSettings.DEFAULT);
    }

    public YamlWriter(WriterSettings settings) {
        this.settings = settings;
        this.step = " ".repeat(settings.indentWidth());
        this.entry = "-" + " ".repeat(settings.indentWidth() - 1);
    }

    public String write(Document doc) {
        document = doc;
        out = new ArrayList<>();

        boolean header = !doc.getDirectives().isEmpty() || doc.isDirectivesEndMarker();

        if (doc.getCommentBefore() != null) {
            commentLines("", doc.getCommentBefore());

            if (!doc.getDirectives().isEmpty() || !doc.isDirectivesEndMarker()) {
                out.add("");
            }
        }

        out.addAll(doc.getDirectives());

        if (header) {
            out.add("---");
        }

        var contents = doc.getContents();

        if (contents == null) {
            out.add("null");
        } else {
            if (contents.isSpaceBefore()) {
                blank();
            }

            commentLines("", contents.getCommentBefore());
            writeRoot(contents);
        }

        if (doc.getComment() != null) {
            if (!endsWithKeep(contents)) {
                blank();
            }

            commentLines("", doc.getComment());
        }

        var text = String.join("\n", out) + "\n";
        out = null;
        document = null;

        return text;
    }

    private void writeRoot(Node contents) {
        if (contents instanceof Scalar scalar && !scalar.getStyle().isBlock()) {
            var comment = scalar.getComment();
            var text = scalar.getValue() == null && scalar.getProperties() == null ? "null"
                    : withProperties(scalar, ScalarFormatter.inline(scalar, false));

            if (!Comments.isMultiline(comment)) {
                out.add(comment == null ? text : text + " #" + comment);
            } else if (ScalarFormatter.isPlain(scalar, false)) {
                commentLines("", comment);
                out.add(text);
            } else {
                out.add(text);
                commentLines("", comment);
            }

            return;
        }

        if (contents instanceof Scalar scalar) {
            // an empty body would otherwise take in the document comment below it
            boolean indicator = needsIndentIndicator(scalar) || document.getComment() != null
                    && ScalarFormatter.blockLines(scalar).isEmpty();
            writeBlockScalar(scalar, "", rootBlockIndent(scalar), indicator);

            return;
        }

        writeValue(contents, "", "");
    }

    private String rootBlockIndent(Scalar scalar) {
        if (document.getComment() != null || needsIndentIndicator(scalar)) {
            return step;
        }

        for (var line : ScalarFormatter.blockLines(scalar)) {
            if (line.startsWith("---") || line.startsWith("...") || line.startsWith("#")) {
                return step;
            }
        }

        return "";
    }

    private void writeValue(Object value, String prefix, String indent) {
        var node = asNode(value);

        if (node == null) {
            out.add(prefix.stripTrailing());
        } else if (node instanceof Scalar scalar) {
            if (scalar.getStyle().isBlock()) {
                writeBlockScalar(scalar, prefix, indent);
            } else {
                var text = withProperties(scalar, ScalarFormatter.inline(scalar, false));
                trailing(text.isEmpty() ? prefix.stripTrailing() : prefix + text,
                        scalar.getComment(), indentOf(prefix));
            }
        } else if (node instanceof Collection<?> collection
                && (collection.isFlow() || collection.isEmpty())) {
            writeFlow(collection, prefix, indent, "");
        } else if (node.getProperties() != null) {
            out.add(prefix + node.getProperties());

            if (node instanceof YamlSeq seq) {
                writeSeq(seq, indent, indent);
            } else {
                writeMap((YamlMap) node, indent, indent);
            }
        } else if (node instanceof YamlSeq seq) {
            writeSeq(seq, prefix, indent);
        } else if (node instanceof YamlMap map) {
            writeMap(map, prefix, indent);
        }
    }

    private void writeSeq(YamlSeq seq, String prefix, String indent) {
        Object previous = null;

        for (int i = 0; i < seq.size(); i++) {
            var item = seq.get(i);
            var linePrefix = i == 0 ? prefix : indent;

            leading(item, previous, i == 0 ? indentOf(prefix) : indent);

            if (item instanceof Pair pair) {
                writePair(pair, linePrefix + entry, indent + step);
            } else {
                writeValue(item, linePrefix + entry, indent + step);
            }

            previous = item;
        }

        commentLines(indent, seq.getComment());
    }

    private void writeMap(YamlMap map, String prefix, String indent) {
        Pair previous = null;

        for (int i = 0; i < map.size(); i++) {
            var pair = map.get(i);

            leading(pair, previous, i == 0 ? indentOf(prefix) : indent);
            writePair(pair, i == 0 ? prefix : indent, indent);
            previous = pair;
        }

        commentLines(indent, map.getComment());
    }

    private void leading(Object item, Object previous, String indent) {
        if (!(item instanceof Commentable commentable)) {
            return;
        }

        if (commentable.isSpaceBefore() && !endsWithKeep(previous)) {
            blank();
        }

        commentLines(indent, commentable.getCommentBefore());
    }

    /**
     * Writes one map entry. {@code indent} is the indentation of the map holding it. The value
     * moves to its own line when the key carries a comment, the value carries leading comments
     * or blank lines, or the value is a block collection.
     */
    private void writePair(Pair pair, String prefix, String indent) {
        var key = asNode(pair.getKey());
        var value = asNode(pair.getValue());
        var childIndent = indent + step;

        if (isExplicitKey(key)) {
            writeValue(key, prefix + "?" + step.substring(1), childIndent);

            if (value != null) {
                leading(value, key, indent);
                writeValue(value, indent + ":" + step.substring(1), childIndent);
            }

            return;
        }

        var line = prefix + (key == null ? "" : inline(key, false)) + ":";
        var keyComment = key == null ? null : key.getComment();

        if (keyComment != null) {
            if (Comments.isMultiline(keyComment)) {
                out.add(line);
                commentLines(childIndent, keyComment);
            } else {
                out.add(line + " #" + keyComment);
            }
        }

        if (value == null) {
            if (keyComment == null) {
                out.add(line);
            }

            return;
        }

        boolean below = keyComment != null || value.getCommentBefore() != null
                || value.isSpaceBefore()
                || isBlockCollection(value) && value.getProperties() == null;

        if (!below) {
            writeValue(value, line + " ", childIndent);

            return;
        }

        if (keyComment == null) {
            out.add(line);
        }

        if (value.isSpaceBefore()) {
            blank();
        }

        commentLines(childIndent, value.getCommentBefore());
        writeValue(value, childIndent, childIndent);
    }

    private boolean isExplicitKey(Node key) {
        if (key instanceof Scalar scalar) {
            return scalar.getStyle().isBlock();
        }

        return isBlockCollection(key);
    }

    private static boolean isBlockCollection(Node node) {
        return node instanceof Collection<?> collection && !collection.isFlow()
                && !collection.isEmpty();
    }

    private void writeBlockScalar(Scalar scalar, String prefix, String bodyIndent) {
        writeBlockScalar(scalar, prefix, bodyIndent, needsIndentIndicator(scalar));
    }

    private void writeBlockScalar(Scalar scalar, String prefix, String bodyIndent,
            boolean indicator) {
        var header = new StringBuilder(prefix);

        if (scalar.getProperties() != null) {
            header.append(scalar.getProperties()).append(' ');
        }

        header.append(scalar.getStyle() == ScalarStyle.BLOCK_FOLDED ? '>' : '|');

        if (indicator) {
            header.append(settings.indentWidth());
        }

        header.append(ScalarFormatter.chomping(scalar).indicator());

        if (scalar.getComment() != null) {
            header.append(" #").append(String.join(" ", Comments.lines(scalar.getComment())));
        }

        out.add(header.toString());

        for (var line : ScalarFormatter.blockLines(scalar)) {
            out.add(line.isEmpty() ? "" : bodyIndent + line);
        }

        if (scalar.getValue() != null) {
            int breaks = ScalarFormatter.trailingBreaks(scalar.getValue());

            for (int i = 1; i < breaks; i++) {
                out.add("");
            }
        }
    }

    private static boolean needsIndentIndicator(Scalar scalar) {
        for (var line : ScalarFormatter.blockLines(scalar)) {
            if (!line.isEmpty()) {
                return line.charAt(0) == ' ' || line.charAt(0) == '\t';
            }
        }

        return false;
    }

    private void writeFlow(Collection<?> collection, String prefix, String indent, String suffix) {
        var open = collection instanceof YamlMap ? "{" : "[";
        var close = collection instanceof YamlMap ? "}" : "]";

        if (collection.isEmpty() || !needsLines(collection)) {
            var line = prefix + inline(collection, false) + suffix;

            if (collection.isEmpty() || line.length() <= settings.lineWidth()) {
                trailing(line, collection.getComment(), indentOf(prefix));

                return;
            }
        }

        out.add(prefix + withProperties(collection, open));

        var itemIndent = indent + step;
        var items = collection.getItems();

        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            var separator = i < items.size() - 1 ? "," : "";

            if (item instanceof Commentable commentable) {
                if (commentable.isSpaceBefore()) {
                    blank();
                }

                commentLines(itemIndent, commentable.getCommentBefore());
            }

            if (item instanceof Pair pair) {
                writeFlowPair(pair, itemIndent, separator);
            } else {
                writeFlowItem(asNode(item), itemIndent, itemIndent, separator);
            }
        }

        trailing(indent + close + suffix, collection.getComment(), indent);
    }

    private void writeFlowItem(Node node, String prefix, String indent, String separator) {
        if (node instanceof Collection<?> nested) {
            writeFlow(nested, prefix, indent, separator);
        } else {
            var text = node == null ? "null" : inline(node, true);
            inlineTrailing(prefix + text + separator, node == null ? null : node.getComment(),
                    indentOf(prefix));
        }
    }

    private void writeFlowPair(Pair pair, String indent, String separator) {
        var key = asNode(pair.getKey());
        var value = asNode(pair.getValue());
        var line = indent + (key == null ? "" : inline(key, true)) + ":";
        var keyComment = key == null ? null : key.getComment();

        if (value == null) {
            inlineTrailing(line + separator, keyComment, indent);

            return;
        }

        boolean below = keyComment != null || value.getCommentBefore() != null
                || value.isSpaceBefore();

        if (!below) {
            writeFlowItem(value, line + " ", indent, separator);

            return;
        }

        var childIndent = indent + step;
        inlineTrailing(line, keyComment, childIndent);

        if (value.isSpaceBefore()) {
            blank();
        }

        commentLines(childIndent, value.getCommentBefore());
        writeFlowItem(value, childIndent, childIndent, separator);
    }

    private boolean needsLines(Collection<?> collection) {
        for (var item : collection.getItems()) {
            if (item instanceof Pair pair) {
                var key = asNode(pair.getKey());
                var value = asNode(pair.getValue());

                if (hasComments(key) || hasComments(value) || value != null
                        && value.isSpaceBefore()) {
                    return true;
                }

                if (pair.isSpaceBefore() || value instanceof Collection<?> nested
                        && needsLines(nested)) {
                    return true;
                }
            } else {
                var node = asNode(item);

                if (hasComments(node) || node != null && node.isSpaceBefore()
                        || node instanceof Collection<?> nested && needsLines(nested)) {
                    return true;
                }
            }
        }

        return false;
    }

    private static boolean hasComments(Node node) {
        return node != null && (node.getCommentBefore() != null || node.getComment() != null);
    }

    private String inline(Node node, boolean flow) {
        if (node instanceof Scalar scalar) {
            if (scalar.getValue() == null) {
                return scalar.getProperties() != null ? scalar.getProperties()
                        : flow ? "null" : "";
            }

            if (scalar.getStyle().isBlock()) {
                return withProperties(scalar, ScalarFormatter.doubleQuoted(scalar.getValue()));
            }

            return withProperties(scalar, ScalarFormatter.inline(scalar, flow));
        }

        var collection = (Collection<?>) node;
        var open = collection instanceof YamlMap ? "{" : "[";
        var close = collection instanceof YamlMap ? "}" : "]";

        if (collection.isEmpty()) {
            return withProperties(collection, open + close);
        }

        var parts = new ArrayList<String>();

        for (var item : collection.getItems()) {
            if (item instanceof Pair pair) {
                var key = asNode(pair.getKey());
                var value = asNode(pair.getValue());
                var text = (key == null ? "" : inline(key, true)) + ":";
                parts.add(value == null ? text : text + " " + inline(value, true));
            } else {
                var itemNode = asNode(item);
                parts.add(itemNode == null ? "null" : inline(itemNode, true));
            }
        }

        return withProperties(collection, open + " " + String.join(", ", parts) + " " + close);
    }

    private static String withProperties(Node node, String text) {
        if (node.getProperties() == null) {
            return text;
        }

        return text.isEmpty() ? node.getProperties() : node.getProperties() + " " + text;
    }

    /**
     * Adds {@code line} with a one-line comment appended. A multi-line comment follows the line
     * at {@code indent}, where it reads back as the same comment.
     */
    private void trailing(String line, String comment, String indent) {
        if (!Comments.isMultiline(comment)) {
            out.add(comment == null ? line : line + " #" + comment);

            return;
        }

        out.add(line);
        commentLines(indent, comment);
    }

    private void inlineTrailing(String line, String comment, String indent) {
        if (comment == null) {
            out.add(line);

            return;
        }

        var lines = Comments.lines(comment);
        out.add(line + " #" + lines.get(0));

        for (var rest : lines.subList(1, lines.size())) {
            out.add(indent + "#" + rest);
        }
    }

    private void commentLines(String indent, String comment) {
        for (var line : Comments.lines(comment)) {
            out.add(indent + "#" + line);
        }
    }

    private void blank() {
        if (!out.isEmpty() && !out.get(out.size() - 1).isEmpty()) {
            out.add("");
        }
    }

    private boolean endsWithKeep(Object item) {
        if (item instanceof Pair pair) {
            return endsWithKeep(pair.getValue());
        }

        if (item instanceof Scalar scalar) {
            return scalar.getStyle().isBlock() && scalar.getValue() != null
                    && ScalarFormatter.chomping(scalar) == Chomping.KEEP;
        }

        if (item instanceof Collection<?> collection && !collection.isFlow()
                && !collection.isEmpty()) {
            return endsWithKeep(collection.get(collection.size() - 1));
        }

        return false;
    }

    private Node asNode(Object value) {
        return value == null ? null : document.createNode(value);
    }

    private static String indentOf(String prefix) {
        int i = 0;

        while (i < prefix.length() && prefix.charAt(i) == ' ') {
            i++;
        }

        return prefix.substring(0, i);
    }
}
