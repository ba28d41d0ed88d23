package rtyaml.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtyaml.model.Document;

public class YamlParser {
    private static final Logger log = LoggerFactory.getLogger(YamlParser.class);

    public Document parse(String src) {
        if (src.startsWith("\uFEFF")) {
            src = src.substring(1);
        }

        var lexer = new CstLexer(src);
        var tokens = lexer.lex();
        log.debug("Lexed {} tokens from {} chars", tokens.size(), src.length());

        var doc = new Composer(tokens).compose();
        doc.getErrors().addAll(0, lexer.getErrors());

        return doc;
    }

    public Document parse(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("Input stream must not be 'null'");
        }

        return parse(new InputStreamReader(new BOMInputStream(in, false), StandardCharsets.UTF_8));
    }

    public Document parse(Reader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("Reader must not be 'null'");
        }

        try {
            return parse(IOUtils.toString(reader));
        } catch (IOException e) {
            throw new YamlParseException("Failed to read YAML input", e);
        }
    }
}
