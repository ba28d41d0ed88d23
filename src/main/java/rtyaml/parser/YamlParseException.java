package rtyaml.parser;

public class YamlParseException extends RuntimeException {
    private static final long serialVersionUID = -2215672960938713806L;

    public YamlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
