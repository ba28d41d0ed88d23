package rtyaml.parser;

record Trivia(Token token, boolean blank, boolean inline) {
    String text() {
        return blank ? "" : token.text().substring(1);
    }

    int column() {
        return token.column();
    }
}
