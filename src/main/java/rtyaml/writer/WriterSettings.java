package rtyaml.writer;

public record WriterSettings(int indentWidth, int lineWidth) {
    public static final WriterSettings DEFAULT = new WriterSettings(2, 80);

    public WriterSettings {
        if (indentWidth < 2 || indentWidth > 9) {
            throw new IllegalArgumentException("Indent width must be between 2 and 9, got "
                    + indentWidth);
        }

        if (lineWidth < 20) {
            throw new IllegalArgumentException("Line width must be at least 20, got " + lineWidth);
        }
    }

    public WriterSettings withIndentWidth(int indentWidth) {
        return new WriterSettings(indentWidth, lineWidth);
    }
}
