package rtyaml.model;

import java.util.Objects;

/**
 * A key/value entry of a {@link YamlMap}. A pair is not a node itself: its comment and
 * blank-line accessors forward to the key node.
 *
 * <p>Writing one of them while the key is {@code null} first replaces the key with an empty
 * {@link Scalar}. Writing one of them while the key is some other, non-node value fails with
 * {@link InvalidKeyKindException}.
 */
public final class Pair implements Commentable {
    private Object key;

    private Object value;

    public Pair(Object key) {
        this(key, null);
    }

    public Pair(Object key, Object value) {
        this.key = key;
        this.value = value;
    }

    public Object getKey() {
        return key;
    }

    public void setKey(Object key) {
        this.key = key;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    @Override
    public String getCommentBefore() {
        return key instanceof Node node ? node.getCommentBefore() : null;
    }

    @Override
    public void setCommentBefore(String commentBefore) {
        if (commentBefore == null && key == null) {
            return;
        }

        keyNode("commentBefore").setCommentBefore(commentBefore);
    }

    @Override
    public String getComment() {
        return key instanceof Node node ? node.getComment() : null;
    }

    @Override
    public void setComment(String comment) {
        if (comment == null && key == null) {
            return;
        }

        keyNode("comment").setComment(comment);
    }

    @Override
    public boolean isSpaceBefore() {
        return key instanceof Node node && node.isSpaceBefore();
    }

    @Override
    public void setSpaceBefore(boolean spaceBefore) {
        if (!spaceBefore && key == null) {
            return;
        }

        keyNode("spaceBefore").setSpaceBefore(spaceBefore);
    }

    private Node keyNode(String property) {
        if (key == null) {
            key = new Scalar(null);
        }

        if (key instanceof Node node) {
            return node;
        }

        throw new InvalidKeyKindException(property, key);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Pair other && Objects.equals(key, other.key)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return "Pair[" + key + ": " + value + "]";
    }
}
