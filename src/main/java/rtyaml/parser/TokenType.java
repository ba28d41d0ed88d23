package rtyaml.parser;

public enum TokenType {
    INDENT, WHITESPACE, NEWLINE, BLANK_LINE, COMMENT,

    DIRECTIVE, DOCUMENT_START, DOCUMENT_END,

    SEQ_ENTRY, MAP_KEY, MAP_VALUE,

    FLOW_SEQ_START, FLOW_SEQ_END, FLOW_MAP_START, FLOW_MAP_END, FLOW_COMMA,

    ANCHOR, TAG, ALIAS,

    PLAIN, SINGLE_QUOTED, DOUBLE_QUOTED, BLOCK_SCALAR_HEADER, BLOCK_SCALAR_BODY,

    ERROR;

    public boolean isTrivia() {
        return switch (this) {
            case INDENT, WHITESPACE, NEWLINE, BLANK_LINE, COMMENT -> true;
            default -> false;
        };
    }

    public boolean isScalar() {
        return this == PLAIN || this == SINGLE_QUOTED || this == DOUBLE_QUOTED || this == ALIAS;
    }

    public boolean isProperty() {
        return this == ANCHOR || this == TAG;
    }

    public boolean isFlowEnd() {
        return this == FLOW_SEQ_END || this == FLOW_MAP_END;
    }
}
