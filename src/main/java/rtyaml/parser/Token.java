package rtyaml.parser;

public record Token(TokenType type, int start, int end, int line, int column, int indent,
        String text) {
    public Token(TokenType type, int start, int end, int line, int column, String text) {
        this(type, start, end, line, column, -1, text);
    }

    public int endLine() {
        int lines = line;
        int last = text.endsWith("\n") ? text.length() - 1 : text.length();

        for (int i = 0; i < last; i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }

        return lines;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "@" + line + ":" + column + " " + text.replace("\n", "\\n");
    }
}
