package rtyaml.model;

public enum ScalarStyle {
    PLAIN, QUOTE_SINGLE, QUOTE_DOUBLE, BLOCK_LITERAL, BLOCK_FOLDED, ALIAS;

    public boolean isBlock() {
        return this == BLOCK_LITERAL || this == BLOCK_FOLDED;
    }

    public boolean isQuoted() {
        return this == QUOTE_SINGLE || this == QUOTE_DOUBLE;
    }
}
