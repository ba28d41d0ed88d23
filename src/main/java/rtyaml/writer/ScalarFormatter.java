package rtyaml.writer;

import java.util.ArrayList;
import java.util.List;
import rtyaml.model.Chomping;
import rtyaml.model.Scalar;
import rtyaml.model.ScalarStyle;

final class ScalarFormatter {
    private static final String PLAIN_UNSAFE_START = "#,[]{}&*!|>'\"%@`";

    private static final String FLOW_INDICATORS = ",[]{}";

    private ScalarFormatter() {}

    static String inline(Scalar scalar, boolean flow) {
        var value = scalar.getValue();

        if (value == null) {
            return "";
        }

        var style = scalar.getStyle();

        if (style == ScalarStyle.ALIAS) {
            return "*" + value;
        }

        if (style == ScalarStyle.PLAIN && isPlainSafe(value, flow)) {
            return value;
        }

        if (style == ScalarStyle.QUOTE_SINGLE && isPrintable(value)) {
            return "'" + value.replace("'", "''") + "'";
        }

        return doubleQuoted(value);
    }

    static boolean isPlain(Scalar scalar, boolean flow) {
        return scalar.getValue() != null && scalar.getStyle() == ScalarStyle.PLAIN
                && isPlainSafe(scalar.getValue(), flow);
    }

    static boolean isPlainSafe(String value, boolean flow) {
        if (value.isEmpty() || !isPrintable(value) || value.indexOf('\t') != -1) {
            return false;
        }

        if (Character.isWhitespace(value.charAt(0))
                || Character.isWhitespace(value.charAt(value.length() - 1))) {
            return false;
        }

        char first = value.charAt(0);

        if (PLAIN_UNSAFE_START.indexOf(first) != -1) {
            return false;
        }

        if ((first == '-' || first == '?' || first == ':')
                && (value.length() == 1 || value.charAt(1) == ' ')) {
            return false;
        }

        if (value.startsWith("---") || value.startsWith("...")) {
            return false;
        }

        if (value.contains(": ") || value.contains(" #") || value.endsWith(":")) {
            return false;
        }

        if (flow) {
            for (int i = 0; i < value.length(); i++) {
                if (FLOW_INDICATORS.indexOf(value.charAt(i)) != -1) {
                    return false;
                }
            }
        }

        return true;
    }

    private static boolean isPrintable(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);

            if (c < 0x20 && c != '\t' || c == 0x7f) {
                return false;
            }
        }

        return true;
    }

    static String doubleQuoted(String value) {
        var sb = new StringBuilder(value.length() + 2).append('"');

        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);

            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\0' -> sb.append("\\0");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }

        return sb.append('"').toString();
    }

    static Chomping chomping(Scalar scalar) {
        int breaks = trailingBreaks(scalar.getValue());

        if (breaks == 0) {
            return Chomping.STRIP;
        }

        return breaks == 1 && scalar.getChomping() != Chomping.KEEP ? Chomping.CLIP
                : Chomping.KEEP;
    }

    static int trailingBreaks(String value) {
        int breaks = 0;

        for (int i = value.length() - 1; i >= 0 && value.charAt(i) == '\n'; i--) {
            breaks++;
        }

        return breaks;
    }

    /**
     * Body lines of a block scalar without indentation. Folded content is split back into the
     * source lines that fold into it.
     */
    static List<String> blockLines(Scalar scalar) {
        var value = scalar.getValue() == null ? "" : scalar.getValue();
        var content = value.substring(0, value.length() - trailingBreaks(value));
        var lines = new ArrayList<String>();

        if (content.isEmpty()) {
            return lines;
        }

        if (scalar.getStyle() == ScalarStyle.BLOCK_LITERAL) {
            lines.addAll(List.of(content.split("\n", -1)));

            return lines;
        }

        int i = 0;

        while (i < content.length() && content.charAt(i) == '\n') {
            lines.add("");
            i++;
        }

        String previous = null;
        int previousBreaks = 0;

        while (i < content.length()) {
            int end = content.indexOf('\n', i);
            end = end == -1 ? content.length() : end;
            var segment = content.substring(i, end);

            int breaks = 0;
            i = end;

            while (i < content.length() && content.charAt(i) == '\n') {
                breaks++;
                i++;
            }

            if (previous != null) {
                int empty = isMoreIndented(previous) || isMoreIndented(segment)
                        ? previousBreaks - 1
                        : previousBreaks;

                for (int k = 0; k < empty; k++) {
                    lines.add("");
                }
            }

            lines.add(segment);
            previous = segment;
            previousBreaks = breaks;
        }

        return lines;
    }

    private static boolean isMoreIndented(String line) {
        return !line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t');
    }
}
