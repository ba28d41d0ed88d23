package rtyaml.model;

import java.util.List;

public final class Comments {
    private Comments() {}

    public static String join(String first, String second) {
        if (first == null) {
            return second;
        }

        if (second == null) {
            return first;
        }

        return first + "\n" + second;
    }

    public static String join(List<String> lines) {
        return lines.isEmpty() ? null : String.join("\n", lines);
    }

    public static List<String> lines(String comment) {
        return comment == null ? List.of() : List.of(comment.split("\n", -1));
    }

    public static boolean isMultiline(String comment) {
        return comment != null && comment.indexOf('\n') != -1;
    }

    public static void prependBefore(Commentable target, String comment) {
        if (comment != null) {
            target.setCommentBefore(join(comment, target.getCommentBefore()));
        }
    }

    public static void append(Commentable target, String comment) {
        if (comment != null) {
            target.setComment(join(target.getComment(), comment));
        }
    }
}
