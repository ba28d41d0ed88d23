package rtyaml.parser;

public record YamlError(ErrorCode code, String message, int offset, int line, int column) {
    static YamlError at(ErrorCode code, String message, Token token) {
        return new YamlError(code, message, token.start(), token.line(), token.column());
    }

    @Override
    public String toString() {
        return code + " at line " + line + ", column " + (column + 1) + ": " + message;
    }
}
