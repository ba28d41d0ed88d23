package rtyaml.model;

public interface Commentable {
    String getCommentBefore();

    void setCommentBefore(String commentBefore);

    String getComment();

    void setComment(String comment);

    boolean isSpaceBefore();

    void setSpaceBefore(boolean spaceBefore);
}
