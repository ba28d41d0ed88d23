package rtyaml.parser;

public enum ErrorCode {
    BAD_INDENT, BAD_BLOCK_HEADER, TAB_INDENT, UNEXPECTED_TOKEN, UNTERMINATED_QUOTE,
    UNTERMINATED_FLOW, DUPLICATE_KEY, MULTILINE_IMPLICIT_KEY, NESTED_COMPACT_MAPPING,
    TRAILING_CONTENT, MULTIPLE_DOCUMENTS, UNKNOWN_DIRECTIVE, UNSUPPORTED_VERSION
}
