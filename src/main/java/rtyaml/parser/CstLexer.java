package rtyaml.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits YAML source into a lossless token stream: the texts of all tokens concatenated give
 * back the input. The lexer knows nothing about document structure; it only tracks flow
 * nesting and block scalar bodies, and it never fails.
 */
public class CstLexer {
    private final String src;

    private final List<Token> tokens = new ArrayList<>();

    private final List<YamlError> errors = new ArrayList<>();

    private int pos;

    private int line = 1;

    private int lineStart;

    private int flowDepth;

    private boolean blockHeaderPending;

    private int blockParentIndent;

    private int blockExplicitIndent;

    private int lineIndent;

    private int lastEntryColumn;

    private int keyColumn;

    private boolean sawMapValue;

    public CstLexer(String src) {
        this.src = src;
    }

    public List<Token> lex() {
        while (pos < src.length()) {
            lexLine();
        }

        return tokens;
    }

    public List<YamlError> getErrors() {
        return errors;
    }

    private void lexLine() {
        int p = pos;

        while (p < src.length() && isWhite(p)) {
            p++;
        }

        if (p >= src.length() || isLineBreak(p)) {
            int end = p >= src.length() ? p : afterLineBreak(p);
            add(TokenType.BLANK_LINE, pos, end);
            nextLine(end);

            return;
        }

        int spaces = pos;

        while (spaces < src.length() && src.charAt(spaces) == ' ') {
            spaces++;
        }

        if (spaces > pos) {
            tokens.add(new Token(TokenType.INDENT, pos, spaces, line, 0, spaces - pos,
                    src.substring(pos, spaces)));
        }

        if (src.charAt(spaces) == '\t' && flowDepth == 0) {
            errors.add(new YamlError(ErrorCode.TAB_INDENT, "Tabs are not allowed as indentation",
                    spaces, line, spaces - lineStart));
        }

        pos = spaces;
        lineIndent = pos - lineStart;
        lastEntryColumn = -1;
        keyColumn = -1;
        sawMapValue = false;

        if (flowDepth == 0 && pos == lineStart) {
            if (startsWithMarker("---")) {
                add(TokenType.DOCUMENT_START, pos, pos + 3);
                pos += 3;
            } else if (startsWithMarker("...")) {
                add(TokenType.DOCUMENT_END, pos, pos + 3);
                pos += 3;
            } else if (src.charAt(pos) == '%') {
                lexDirective();
            }
        }

        lexContent();

        if (pos < src.length()) {
            int end = afterLineBreak(pos);
            add(TokenType.NEWLINE, pos, end);
            nextLine(end);
        }

        if (blockHeaderPending) {
            blockHeaderPending = false;
            lexBlockBody();
        }
    }

    private void lexContent() {
        while (pos < src.length() && !isLineBreak(pos)) {
            char c = src.charAt(pos);

            if (isWhite(pos)) {
                int end = pos;

                while (end < src.length() && isWhite(end)) {
                    end++;
                }

                add(TokenType.WHITESPACE, pos, end);
                pos = end;
            } else if (c == '#' && (pos == lineStart || isWhite(pos - 1))) {
                int end = endOfLine(pos);
                add(TokenType.COMMENT, pos, end);
                pos = end;
            } else if (flowDepth == 0 && (c == '-' || c == '?') && isBlankOrEnd(pos + 1)) {
                add(c == '-' ? TokenType.SEQ_ENTRY : TokenType.MAP_KEY, pos, pos + 1);
                lastEntryColumn = pos - lineStart;
                keyColumn = -1;
                sawMapValue = false;
                pos++;
            } else if (c == ':' && isMapValueIndicator()) {
                add(TokenType.MAP_VALUE, pos, pos + 1);
                sawMapValue = true;
                pos++;
            } else if (flowDepth > 0 && c == '?' && isBlankOrEnd(pos + 1)) {
                add(TokenType.MAP_KEY, pos, pos + 1);
                pos++;
            } else if (flowDepth > 0 && c == ',') {
                add(TokenType.FLOW_COMMA, pos, pos + 1);
                pos++;
            } else if (c == '[' || c == '{') {
                markKey();
                add(c == '[' ? TokenType.FLOW_SEQ_START : TokenType.FLOW_MAP_START, pos, pos + 1);
                flowDepth++;
                pos++;
            } else if (flowDepth > 0 && (c == ']' || c == '}')) {
                add(c == ']' ? TokenType.FLOW_SEQ_END : TokenType.FLOW_MAP_END, pos, pos + 1);
                flowDepth--;
                pos++;
            } else if (c == '\'' || c == '"') {
                markKey();
                lexQuoted(c);
            } else if (flowDepth == 0 && (c == '|' || c == '>')) {
                lexBlockHeader();
            } else if (c == '&' || c == '!' || c == '*') {
                markKey();
                lexProperty(c);
            } else {
                markKey();
                lexPlain();
            }
        }
    }

    private boolean isMapValueIndicator() {
        if (isBlankOrEnd(pos + 1)) {
            return true;
        }

        if (flowDepth == 0) {
            return false;
        }

        if (isFlowIndicator(pos + 1)) {
            return true;
        }

        if (tokens.isEmpty()) {
            return false;
        }

        var previous = tokens.get(tokens.size() - 1);

        return previous.end() == pos && (previous.is(TokenType.SINGLE_QUOTED)
                || previous.is(TokenType.DOUBLE_QUOTED) || previous.type().isFlowEnd());
    }

    private void markKey() {
        if (keyColumn == -1) {
            keyColumn = pos - lineStart;
        }
    }

    private void lexDirective() {
        int end = pos;

        while (end < src.length() && !isLineBreak(end)
                && !(src.charAt(end) == '#' && isWhite(end - 1))) {
            end++;
        }

        while (end > pos && isWhite(end - 1)) {
            end--;
        }

        add(TokenType.DIRECTIVE, pos, end);
        pos = end;
    }

    private void lexProperty(char indicator) {
        int end = pos + 1;

        while (end < src.length() && !isBlankOrEnd(end)
                && !(src.charAt(end) == ':' && isBlankOrEnd(end + 1))
                && !(flowDepth > 0 && (isFlowIndicator(end) || src.charAt(end) == ':'
                        && isFlowIndicator(end + 1)))) {
            end++;
        }

        var type = switch (indicator) {
            case '&' -> TokenType.ANCHOR;
            case '!' -> TokenType.TAG;
            default -> TokenType.ALIAS;
        };

        add(type, pos, end);
        pos = end;
    }

    private void lexPlain() {
        int end = pos;

        while (end < src.length() && !isLineBreak(end)) {
            char c = src.charAt(end);

            if (c == ':' && (isBlankOrEnd(end + 1) || flowDepth > 0 && isFlowIndicator(end + 1))) {
                break;
            }

            if (c == '#' && end > pos && isWhite(end - 1)) {
                break;
            }

            if (flowDepth > 0 && isFlowIndicator(end)) {
                break;
            }

            end++;
        }

        while (end > pos && isWhite(end - 1)) {
            end--;
        }

        if (end == pos) {
            add(TokenType.ERROR, pos, pos + 1);
            errors.add(new YamlError(ErrorCode.UNEXPECTED_TOKEN,
                    "Unexpected character '" + src.charAt(pos) + "'", pos, line, pos - lineStart));
            pos++;

            return;
        }

        add(TokenType.PLAIN, pos, end);
        pos = end;
    }

    private void lexQuoted(char quote) {
        int start = pos;
        int startLine = line;
        int startColumn = pos - lineStart;
        int p = pos + 1;
        boolean closed = false;

        while (p < src.length()) {
            char c = src.charAt(p);

            if (quote == '"' && c == '\\' && p + 1 < src.length()) {
                if (src.charAt(p + 1) == '\n') {
                    line++;
                    lineStart = p + 2;
                }

                p += 2;
                continue;
            }

            if (c == quote) {
                if (quote == '\'' && p + 1 < src.length() && src.charAt(p + 1) == '\'') {
                    p += 2;
                    continue;
                }

                p++;
                closed = true;
                break;
            }

            if (c == '\n') {
                line++;
                lineStart = p + 1;
            }

            p++;
        }

        tokens.add(new Token(quote == '"' ? TokenType.DOUBLE_QUOTED : TokenType.SINGLE_QUOTED,
                start, p, startLine, startColumn, src.substring(start, p)));

        if (!closed) {
            errors.add(new YamlError(ErrorCode.UNTERMINATED_QUOTE,
                    "Missing closing " + quote + " quote", start, startLine, startColumn));
        }

        pos = p;
    }

    private void lexBlockHeader() {
        int end = pos + 1;

        while (end < src.length() && !isBlankOrEnd(end)) {
            end++;
        }

        int explicitIndent = 0;
        boolean chomp = false;
        boolean valid = true;

        for (int i = pos + 1; i < end; i++) {
            char c = src.charAt(i);

            if (c >= '1' && c <= '9' && explicitIndent == 0) {
                explicitIndent = c - '0';
            } else if ((c == '+' || c == '-') && !chomp) {
                chomp = true;
            } else {
                valid = false;
            }
        }

        if (!valid) {
            errors.add(new YamlError(ErrorCode.BAD_BLOCK_HEADER,
                    "Invalid block scalar header " + src.substring(pos, end), pos, line,
                    pos - lineStart));
        }

        if (sawMapValue) {
            blockParentIndent = keyColumn;
        } else if (lastEntryColumn >= 0) {
            blockParentIndent = lastEntryColumn;
        } else {
            blockParentIndent = lineIndent - 1;
        }

        blockExplicitIndent = explicitIndent;
        blockHeaderPending = true;
        add(TokenType.BLOCK_SCALAR_HEADER, pos, end);
        pos = end;
    }

    private void lexBlockBody() {
        int parentIndent = blockParentIndent;
        int contentIndent;

        if (blockExplicitIndent > 0) {
            contentIndent = Math.max(parentIndent, 0) + blockExplicitIndent;
        } else {
            contentIndent = firstContentIndent();

            if (contentIndent <= parentIndent) {
                return;
            }
        }

        int start = pos;
        int bodyEnd = pos;
        int p = pos;

        while (p < src.length()) {
            int spaces = p;

            while (spaces < src.length() && src.charAt(spaces) == ' ') {
                spaces++;
            }

            int q = spaces;

            while (q < src.length() && isWhite(q)) {
                q++;
            }

            int next = nextLineStart(q);

            if (q >= src.length() || isLineBreak(q)) {
                p = next;
                continue;
            }

            if (spaces - p < contentIndent
                    || spaces == p && (startsWithMarker(p, "---") || startsWithMarker(p, "..."))) {
                break;
            }

            p = next;
            bodyEnd = p;
        }

        if (bodyEnd == start) {
            return;
        }

        String text = src.substring(start, bodyEnd);
        tokens.add(new Token(TokenType.BLOCK_SCALAR_BODY, start, bodyEnd, line, 0, contentIndent,
                text));

        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }

        pos = bodyEnd;
        lineStart = bodyEnd;
    }

    private int firstContentIndent() {
        int p = pos;

        while (p < src.length()) {
            int spaces = p;

            while (spaces < src.length() && src.charAt(spaces) == ' ') {
                spaces++;
            }

            int q = spaces;

            while (q < src.length() && isWhite(q)) {
                q++;
            }

            if (q < src.length() && !isLineBreak(q)) {
                return spaces - p;
            }

            if (q >= src.length()) {
                break;
            }

            p = afterLineBreak(q);
        }

        return -1;
    }

    private void add(TokenType type, int start, int end) {
        tokens.add(new Token(type, start, end, line, start - lineStart, src.substring(start, end)));
    }

    private void nextLine(int end) {
        line++;
        lineStart = end;
        pos = end;
    }

    private boolean startsWithMarker(String marker) {
        return startsWithMarker(pos, marker);
    }

    private boolean startsWithMarker(int at, String marker) {
        return src.startsWith(marker, at) && isBlankOrEnd(at + marker.length());
    }

    private boolean isWhite(int i) {
        char c = src.charAt(i);

        return c == ' ' || c == '\t';
    }

    private boolean isLineBreak(int i) {
        char c = src.charAt(i);

        return c == '\n' || c == '\r' && i + 1 < src.length() && src.charAt(i + 1) == '\n';
    }

    private boolean isBlankOrEnd(int i) {
        return i >= src.length() || isWhite(i) || isLineBreak(i);
    }

    private boolean isFlowIndicator(int i) {
        if (i >= src.length()) {
            return false;
        }

        char c = src.charAt(i);

        return c == ',' || c == '[' || c == ']' || c == '{' || c == '}';
    }

    private int endOfLine(int i) {
        while (i < src.length() && !isLineBreak(i)) {
            i++;
        }

        return i;
    }

    private int nextLineStart(int i) {
        int end = endOfLine(i);

        return end >= src.length() ? end : afterLineBreak(end);
    }

    private int afterLineBreak(int i) {
        return src.charAt(i) == '\r' ? i + 2 : i + 1;
    }
}
