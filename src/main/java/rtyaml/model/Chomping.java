package rtyaml.model;

public enum Chomping {
    STRIP("-"), CLIP(""), KEEP("+");

    private final String indicator;

    Chomping(String indicator) {
        this.indicator = indicator;
    }

    public String indicator() {
        return indicator;
    }

    public static Chomping fromIndicator(char c) {
        return switch (c) {
            case '-' -> STRIP;
            case '+' -> KEEP;
            default -> CLIP;
        };
    }
}
