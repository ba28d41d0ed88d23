package rtyaml.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import rtyaml.parser.YamlError;
import rtyaml.writer.WriterSettings;
import rtyaml.writer.YamlWriter;

public class Document {
    private String commentBefore;

    private String comment;

    private final List<String> directives = new ArrayList<>();

    private boolean directivesEndMarker;

    private Node contents;

    private final List<YamlError> errors = new ArrayList<>();

    private final List<YamlError> warnings = new ArrayList<>();

    public Document() {}

    public Document(Object contents) {
        this.contents = contents == null ? null : createNode(contents);
    }

    public String getCommentBefore() {
        return commentBefore;
    }

    public void setCommentBefore(String commentBefore) {
        this.commentBefore = commentBefore;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public List<String> getDirectives() {
        return directives;
    }

    public boolean isDirectivesEndMarker() {
        return directivesEndMarker;
    }

    public void setDirectivesEndMarker(boolean directivesEndMarker) {
        this.directivesEndMarker = directivesEndMarker;
    }

    public Node getContents() {
        return contents;
    }

    public void setContents(Node contents) {
        this.contents = contents;
    }

    public List<YamlError> getErrors() {
        return errors;
    }

    public List<YamlError> getWarnings() {
        return warnings;
    }

    public Node createNode(Object value) {
        if (value instanceof Node node) {
            return node;
        }

        if (value == null) {
            return new Scalar(null);
        }

        if (value instanceof Map<?, ?> map) {
            var node = new YamlMap();

            for (var entry : map.entrySet()) {
                node.add(new Pair(createNode(entry.getKey()), createNode(entry.getValue())));
            }

            return node;
        }

        if (value instanceof Object[] array) {
            return createNode(Arrays.asList(array));
        }

        if (value instanceof Iterable<?> iterable) {
            var node = new YamlSeq();

            for (var item : iterable) {
                node.add(createNode(item));
            }

            return node;
        }

        return new Scalar(String.valueOf(value));
    }

    public Object toJava() {
        return toJava(contents);
    }

    private static Object toJava(Object value) {
        if (value instanceof Scalar scalar) {
            return scalar.getValue();
        }

        if (value instanceof YamlMap map) {
            var result = new LinkedHashMap<Object, Object>();

            for (var pair : map.getItems()) {
                result.put(toJava(pair.getKey()), toJava(pair.getValue()));
            }

            return result;
        }

        if (value instanceof Pair pair) {
            var result = new LinkedHashMap<Object, Object>();
            result.put(toJava(pair.getKey()), toJava(pair.getValue()));

            return result;
        }

        if (value instanceof YamlSeq seq) {
            var result = new ArrayList<>();

            for (var item : seq.getItems()) {
                result.add(toJava(item));
            }

            return result;
        }

        return value;
    }

    public String toString(WriterSettings settings) {
        return new YamlWriter(settings).write(this);
    }

    @Override
    public String toString() {
        return toString(WriterSettings.DEFAULT);
    }
}
