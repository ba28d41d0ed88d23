package rtyaml.model;

import java.util.Objects;

public abstract sealed class Node implements Commentable permits Scalar, Collection {
    private String commentBefore;

    private String comment;

    private boolean spaceBefore;

    private String properties;

    private SourceRange range;

    public abstract NodeType getType();

    @Override
    public String getCommentBefore() {
        return commentBefore;
    }

    @Override
    public void setCommentBefore(String commentBefore) {
        this.commentBefore = commentBefore;
    }

    @Override
    public String getComment() {
        return comment;
    }

    @Override
    public void setComment(String comment) {
        this.comment = comment;
    }

    @Override
    public boolean isSpaceBefore() {
        return spaceBefore;
    }

    @Override
    public void setSpaceBefore(boolean spaceBefore) {
        this.spaceBefore = spaceBefore;
    }

    /**
     * Anchor and tag text written in front of the node, such as {@code &base !!map}. It is kept
     * as written and never resolved.
     */
    public String getProperties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = properties;
    }

    public SourceRange getRange() {
        return range;
    }

    public void setRange(SourceRange range) {
        this.range = range;
    }

    protected void invalidateRange() {
        this.range = null;
    }

    protected boolean commentsEqual(Node other) {
        return Objects.equals(commentBefore, other.commentBefore)
                && Objects.equals(comment, other.comment) && spaceBefore == other.spaceBefore
                && Objects.equals(properties, other.properties);
    }
}
