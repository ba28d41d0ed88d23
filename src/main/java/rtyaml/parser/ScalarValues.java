package rtyaml.parser;

import java.util.ArrayList;
import java.util.List;
import rtyaml.model.Chomping;

final class ScalarValues {
    private ScalarValues() {}

    static String singleQuoted(String text) {
        var body = stripQuotes(text, '\'');
        var sb = new StringBuilder(body.length());

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);

            if (c == '\'' && i + 1 < body.length() && body.charAt(i + 1) == '\'') {
                sb.append('\'');
                i++;
            } else if (c == '\n' || c == '\r') {
                i = fold(body, i, sb);
            } else {
                sb.append(c);
            }
        }

        return sb.toString();
    }

    static String doubleQuoted(String text) {
        var body = stripQuotes(text, '"');
        var sb = new StringBuilder(body.length());

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);

            if (c == '\\' && i + 1 < body.length()) {
                i = unescape(body, i + 1, sb);
            } else if (c == '\n' || c == '\r') {
                i = fold(body, i, sb);
            } else {
                sb.append(c);
            }
        }

        return sb.toString();
    }

    private static String stripQuotes(String text, char quote) {
        int end = text.length() > 1 && text.charAt(text.length() - 1) == quote
                ? text.length() - 1
                : text.length();

        return text.substring(1, end);
    }

    private static int fold(String body, int i, StringBuilder sb) {
        while (sb.length() > 0 && isWhite(sb.charAt(sb.length() - 1))) {
            sb.setLength(sb.length() - 1);
        }

        int breaks = 0;
        int p = i;

        while (p < body.length()) {
            char c = body.charAt(p);

            if (c == '\r' || isWhite(c)) {
                p++;
            } else if (c == '\n') {
                breaks++;
                p++;
            } else {
                break;
            }
        }

        sb.append(breaks <= 1 ? " " : "\n".repeat(breaks - 1));

        return p - 1;
    }

    private static int unescape(String body, int i, StringBuilder sb) {
        char c = body.charAt(i);

        switch (c) {
            case '0' -> sb.append('\0');
            case 'a' -> sb.append('\u0007');
            case 'b' -> sb.append('\b');
            case 't', '\t' -> sb.append('\t');
            case 'n' -> sb.append('\n');
            case 'v' -> sb.append('\u000b');
            case 'f' -> sb.append('\f');
            case 'r' -> sb.append('\r');
            case 'e' -> sb.append('\u001b');
            case 'N' -> sb.append('\u0085');
            case '_' -> sb.append('\u00a0');
            case 'L' -> sb.append('\u2028');
            case 'P' -> sb.append('\u2029');
            case 'x' -> {
                return hex(body, i, 2, sb);
            }
            case 'u' -> {
                return hex(body, i, 4, sb);
            }
            case 'U' -> {
                return hex(body, i, 8, sb);
            }
            case '\r', '\n' -> {
                int p = c == '\r' && i + 1 < body.length() && body.charAt(i + 1) == '\n' ? i + 2
                        : i + 1;

                while (p < body.length() && isWhite(body.charAt(p))) {
                    p++;
                }

                return p - 1;
            }
            default -> sb.append(c);
        }

        return i;
    }

    private static int hex(String body, int i, int digits, StringBuilder sb) {
        int end = Math.min(body.length(), i + 1 + digits);

        try {
            sb.appendCodePoint(Integer.parseInt(body.substring(i + 1, end), 16));
        } catch (IllegalArgumentException e) {
            sb.append(body, i - 1, end);
        }

        return end - 1;
    }

    /**
     * Resolves a block scalar body. {@code extraBreaks} counts the blank lines after the body
     * that belong to a keep-chomped scalar.
     */
    static String block(String body, int contentIndent, boolean folded, Chomping chomping,
            int extraBreaks) {
        var lines = new ArrayList<String>();
        boolean finalBreak = body.endsWith("\n");

        for (var line : body.split("\r?\n", -1)) {
            lines.add(line);
        }

        if (finalBreak) {
            lines.remove(lines.size() - 1);
        }

        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            int strip = 0;

            while (strip < contentIndent && strip < line.length() && line.charAt(strip) == ' ') {
                strip++;
            }

            line = line.substring(strip);
            lines.set(i, line.isBlank() && strip < contentIndent ? "" : line);
        }

        int trailing = 0;

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
            trailing++;
        }

        var content = folded ? foldLines(lines) : String.join("\n", lines);
        int breaks = (finalBreak ? 1 : 0) + trailing + extraBreaks;

        return switch (chomping) {
            case STRIP -> content;
            case CLIP -> content.isEmpty() ? "" : content + "\n";
            case KEEP -> content + "\n".repeat(breaks);
        };
    }

    private static String foldLines(List<String> lines) {
        var sb = new StringBuilder();
        boolean started = false;
        boolean previousText = false;
        int emptyLines = 0;

        for (var line : lines) {
            if (line.isEmpty()) {
                emptyLines++;
                continue;
            }

            boolean moreIndented = isWhite(line.charAt(0));

            if (!started) {
                sb.append("\n".repeat(emptyLines));
            } else if (previousText && !moreIndented) {
                sb.append(emptyLines == 0 ? " " : "\n".repeat(emptyLines));
            } else {
                sb.append("\n".repeat(emptyLines + 1));
            }

            sb.append(line);
            started = true;
            previousText = !moreIndented;
            emptyLines = 0;
        }

        return sb.toString();
    }

    private static boolean isWhite(char c) {
        return c == ' ' || c == '\t';
    }
}
