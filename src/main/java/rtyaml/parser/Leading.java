package rtyaml.parser;

record Leading(String comment, boolean spaceBefore) {
    static final Leading NONE = new Leading(null, false);
}
