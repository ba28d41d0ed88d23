package rtyaml.model;

public record SourceRange(int start, int end) {
    public SourceRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + "]");
        }
    }

    public int length() {
        return end - start;
    }
}
