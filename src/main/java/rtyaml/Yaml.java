package rtyaml;

import java.io.InputStream;
import java.io.Reader;
import rtyaml.model.Document;
import rtyaml.parser.YamlParser;
import rtyaml.writer.WriterSettings;
import rtyaml.writer.YamlWriter;

public final class Yaml {
    private Yaml() {}

    public static Document parseDocument(String src) {
        return new YamlParser().parse(src);
    }

    public static Document parseDocument(InputStream in) {
        return new YamlParser().parse(in);
    }

    public static Document parseDocument(Reader reader) {
        return new YamlParser().parse(reader);
    }

    public static String stringify(Document doc) {
        return stringify(doc, WriterSettings.DEFAULT);
    }

    public static String stringify(Document doc, WriterSettings settings) {
        return new YamlWriter(settings).write(doc);
    }
}
