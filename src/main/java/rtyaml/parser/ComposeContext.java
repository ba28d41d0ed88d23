package rtyaml.parser;

import java.util.ArrayList;
import java.util.List;
import rtyaml.model.Commentable;
import rtyaml.model.Comments;

class ComposeContext {
    private final List<Trivia> pending = new ArrayList<>();

    private int lastLine;

    private int depth;

    int lastLine() {
        return lastLine;
    }

    void setLastLine(int lastLine) {
        this.lastLine = lastLine;
    }

    void addComment(Token token) {
        pending.add(new Trivia(token, false, token.line() == lastLine));
    }

    void addBlank(Token token) {
        pending.add(new Trivia(token, true, false));
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    boolean hasPendingComment() {
        for (var trivia : pending) {
            if (!trivia.blank()) {
                return true;
            }
        }

        return false;
    }

    void enterCollection() {
        depth++;
    }

    void exitCollection() {
        depth--;
    }

    boolean isRootCollection() {
        return depth == 1;
    }

    String takeInline() {
        if (!pending.isEmpty() && pending.get(0).inline()) {
            return pending.remove(0).text();
        }

        return null;
    }

    String takeComments() {
        var lines = new ArrayList<String>();

        for (var trivia : pending) {
            if (!trivia.blank()) {
                lines.add(trivia.text());
            }
        }

        pending.clear();

        return Comments.join(lines);
    }

    Leading takeLeading() {
        var lines = new ArrayList<String>();
        boolean spaceBefore = false;

        for (var trivia : pending) {
            if (!trivia.blank()) {
                lines.add(trivia.text());
            } else if (lines.isEmpty()) {
                spaceBefore = true;
            }
        }

        pending.clear();

        return new Leading(Comments.join(lines), spaceBefore);
    }

    /**
     * Splits what was read between two items of one collection. Comments directly following the
     * previous item and closed by a blank line trail that item; the rest leads the next one.
     */
    Leading splitBetweenItems(Commentable previous) {
        int firstBlank = -1;

        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).blank()) {
                firstBlank = i;
                break;
            }
        }

        if (firstBlank > 0) {
            var trailing = new ArrayList<String>();

            for (var trivia : pending.subList(0, firstBlank)) {
                trailing.add(trivia.text());
            }

            pending.subList(0, firstBlank).clear();
            Comments.append(previous, Comments.join(trailing));
        }

        return takeLeading();
    }

    /**
     * Takes the comments ending a collection: those indented at least as far as its items and
     * not separated from them by a blank line. Less indented ones stay for the parent.
     */
    String takeCollectionEnd(int indent) {
        var lines = new ArrayList<String>();

        while (!pending.isEmpty()) {
            var trivia = pending.get(0);

            if (trivia.blank() || trivia.column() < indent) {
                break;
            }

            lines.add(pending.remove(0).text());
        }

        return Comments.join(lines);
    }

    int takeLeadingBlanks() {
        int count = 0;

        while (!pending.isEmpty() && pending.get(0).blank()) {
            pending.remove(0);
            count++;
        }

        return count;
    }

    List<Trivia> drain() {
        var drained = new ArrayList<>(pending);
        pending.clear();

        return drained;
    }
}
