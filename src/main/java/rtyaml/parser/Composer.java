package rtyaml.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtyaml.model.Chomping;
import rtyaml.model.Collection;
import rtyaml.model.Commentable;
import rtyaml.model.Comments;
import rtyaml.model.Document;
import rtyaml.model.Node;
import rtyaml.model.Pair;
import rtyaml.model.Scalar;
import rtyaml.model.ScalarStyle;
import rtyaml.model.SourceRange;
import rtyaml.model.YamlMap;
import rtyaml.model.YamlSeq;

/**
 * Builds a {@link Document} from the token stream of one document by recursive descent. Comment
 * and blank-line tokens met between two structural tokens are buffered in a
 * {@link ComposeContext} and attached to a node once the next structural position is known:
 * adjacent comments lead the following node, comments on a node's line trail it, and comments
 * closing a nested collection belong to that collection.
 *
 * <p>Malformed input is recorded on {@link Document#getErrors()} and composing carries on.
 */
public class Composer {
    private static final Logger log = LoggerFactory.getLogger(Composer.class);

    private final List<Token> tokens;

    private final Document doc = new Document();

    private final ComposeContext ctx = new ComposeContext();

    private int index;

    private int lastConsumed = -1;

    private String properties;

    public Composer(List<Token> tokens) {
        this.tokens = tokens;
    }

    public Document compose() {
        composeDirectives();

        var first = peek();

        if (first != null && first.is(TokenType.DOCUMENT_START)) {
            next();
            doc.setDirectivesEndMarker(true);
            doc.setCommentBefore(Comments.join(doc.getCommentBefore(), inlineComment()));
        } else if (!doc.getDirectives().isEmpty()) {
            error(ErrorCode.UNEXPECTED_TOKEN, "Missing --- after directives", first);
        }

        String leading = takeDocumentLeading();
        var contents = isNodeStart(peek()) ? composeBlockNode(-1) : null;

        if (contents == null) {
            doc.setCommentBefore(Comments.join(doc.getCommentBefore(), leading));
        } else {
            Comments.prependBefore(leadingTarget(contents), leading);
            doc.setContents(contents);
        }

        composeEpilogue();
        doc.setComment(Comments.join(doc.getComment(), ctx.takeComments()));

        return doc;
    }

    private void composeDirectives() {
        for (var t = peek(); t != null && t.is(TokenType.DIRECTIVE); t = peek()) {
            doc.setCommentBefore(Comments.join(doc.getCommentBefore(), ctx.takeComments()));
            next();
            doc.getDirectives().add(t.text());
            checkDirective(t);
        }

        if (!doc.getDirectives().isEmpty() || peekIs(TokenType.DOCUMENT_START)) {
            doc.setCommentBefore(Comments.join(doc.getCommentBefore(), ctx.takeComments()));
        }
    }

    private void checkDirective(Token t) {
        var parts = t.text().substring(1).trim().split("\\s+");

        switch (parts[0]) {
            case "YAML" -> {
                if (parts.length < 2 || !parts[1].equals("1.1") && !parts[1].equals("1.2")) {
                    warning(ErrorCode.UNSUPPORTED_VERSION,
                            "Unsupported YAML version in directive " + t.text(), t);
                }
            }
            case "TAG" -> {
                if (parts.length != 3) {
                    error(ErrorCode.UNEXPECTED_TOKEN, "Malformed directive " + t.text(), t);
                }
            }
            default -> warning(ErrorCode.UNKNOWN_DIRECTIVE, "Unknown directive " + t.text(), t);
        }
    }

    private String takeDocumentLeading() {
        var trivia = ctx.drain();
        int lastBlank = -1;

        if (!doc.isDirectivesEndMarker() && doc.getCommentBefore() == null) {
            boolean sawComment = false;

            for (int i = 0; i < trivia.size(); i++) {
                if (!trivia.get(i).blank()) {
                    sawComment = true;
                } else if (sawComment) {
                    lastBlank = i;
                }
            }
        }

        var before = new ArrayList<String>();
        var leading = new ArrayList<String>();

        for (int i = 0; i < trivia.size(); i++) {
            if (!trivia.get(i).blank()) {
                (i < lastBlank ? before : leading).add(trivia.get(i).text());
            }
        }

        if (!before.isEmpty()) {
            doc.setCommentBefore(Comments.join(before));
        }

        return Comments.join(leading);
    }

    private void composeEpilogue() {
        for (var t = peek(); t != null; t = peek()) {
            if (t.is(TokenType.DOCUMENT_END)) {
                next();
                doc.setComment(Comments.join(doc.getComment(), ctx.takeComments()));

                var after = peek();

                if (after != null) {
                    if (after.is(TokenType.DOCUMENT_START) || after.is(TokenType.DIRECTIVE)) {
                        error(ErrorCode.MULTIPLE_DOCUMENTS,
                                "Only a single document is supported; further documents ignored",
                                after);
                    } else {
                        warning(ErrorCode.TRAILING_CONTENT,
                                "Content after the document end marker is ignored", after);
                    }

                    index = tokens.size();
                }

                return;
            }

            if (t.is(TokenType.DOCUMENT_START) || t.is(TokenType.DIRECTIVE)) {
                error(ErrorCode.MULTIPLE_DOCUMENTS,
                        "Only a single document is supported; further documents ignored", t);
                index = tokens.size();

                return;
            }

            error(ErrorCode.TRAILING_CONTENT, "Unexpected content after the document", t);
            skipLine();
        }
    }

    private Node composeBlockNode(int parentIndent) {
        var t = peek();

        if (t.type().isProperty()) {
            return isImplicitKey() ? composeBlockMap(t.column())
                    : composeWithProperties(parentIndent);
        }

        return switch (t.type()) {
            case SEQ_ENTRY -> composeBlockSeq(t.column());
            case MAP_KEY, MAP_VALUE -> composeBlockMap(t.column());
            case PLAIN, SINGLE_QUOTED, DOUBLE_QUOTED, ALIAS, FLOW_SEQ_START, FLOW_MAP_START -> {
                if (isImplicitKey()) {
                    yield composeBlockMap(t.column());
                }

                yield t.type().isScalar() ? composeScalar(parentIndent) : composeFlow();
            }
            case BLOCK_SCALAR_HEADER -> composeBlockScalar();
            default -> {
                next();

                yield scalarFromError(t);
            }
        };
    }

    /**
     * Composes the node that anchor and tag tokens belong to. On the same line they go with the
     * following scalar or flow collection; alone on their line they go with the block node below
     * or, when none follows, with an empty scalar.
     */
    private Node composeWithProperties(int parentIndent) {
        var first = peek();
        var text = takeProperties();
        var t = peek();

        if (t != null && t.line() == ctx.lastLine() && isNodeStart(t) && !t.is(TokenType.SEQ_ENTRY)
                && !t.is(TokenType.MAP_KEY) && !t.is(TokenType.MAP_VALUE)) {
            properties = text;

            return applyProperties(composeBlockNode(parentIndent));
        }

        Node node;

        if (t != null && t.line() > ctx.lastLine() && isNodeStart(t) && !t.is(TokenType.MAP_VALUE)
                && t.column() > parentIndent) {
            String inline = ctx.takeInline();
            var leading = ctx.takeLeading();
            node = composeBlockNode(parentIndent);
            applyLeading(node, leading);
            Comments.prependBefore(node, inline);
        } else {
            node = new Scalar(null);
            node.setRange(new SourceRange(first.start(), nodeEnd()));
            node.setComment(inlineComment());
        }

        node.setProperties(node.getProperties() == null ? text : text + " " + node.getProperties());

        return node;
    }

    private String takeProperties() {
        var parts = new ArrayList<String>();

        for (var t = peek(); t != null && t.type().isProperty(); t = peek()) {
            parts.add(next().text());
        }

        return String.join(" ", parts);
    }

    private <T extends Node> T applyProperties(T node) {
        if (properties != null && node != null) {
            node.setProperties(properties);
            properties = null;
        }

        return node;
    }

    private YamlSeq composeBlockSeq(int indent) {
        var seq = new YamlSeq();
        int start = peek().start();
        Node previous = null;
        ctx.enterCollection();

        for (var t = peek(); t != null; t = peek()) {
            if (!t.is(TokenType.SEQ_ENTRY) || t.column() != indent) {
                if (!recoverWithin(t, indent)) {
                    break;
                }

                continue;
            }

            var leading = previous == null ? ctx.takeLeading()
                    : ctx.splitBetweenItems(previous);
            next();

            var item = composeEntryValue(indent);
            Comments.prependBefore(item, leading.comment());

            if (leading.spaceBefore()) {
                item.setSpaceBefore(true);
            }

            seq.add(item);
            previous = item;
        }

        closeCollection(seq, start, indent);

        return seq;
    }

    private YamlMap composeBlockMap(int indent) {
        var map = new YamlMap();
        int start = peek().start();
        Set<String> keys = new HashSet<>();
        Pair previous = null;
        ctx.enterCollection();

        for (var t = peek(); t != null; t = peek()) {
            boolean entry = t.column() == indent
                    && (previous == null || t.line() > ctx.lastLine())
                    && (t.is(TokenType.MAP_KEY) || t.is(TokenType.MAP_VALUE) || isImplicitKey());

            if (!entry) {
                if (!recoverWithin(t, indent)) {
                    break;
                }

                continue;
            }

            var leading = previous == null ? ctx.takeLeading()
                    : ctx.splitBetweenItems(trailingTarget(previous));
            var pair = composePair(indent);
            Comments.prependBefore(pair, leading.comment());

            if (leading.spaceBefore()) {
                pair.setSpaceBefore(true);
            }

            if (pair.getKey() instanceof Scalar key && key.getStyle() != ScalarStyle.ALIAS
                    && !keys.add(String.valueOf(key.getValue()))) {
                error(ErrorCode.DUPLICATE_KEY, "Map keys must be unique; \"" + key.getValue()
                        + "\" is repeated", t);
            }

            map.add(pair);
            previous = pair;
        }

        closeCollection(map, start, indent);

        return map;
    }

    private boolean recoverWithin(Token t, int indent) {
        if (t.line() <= ctx.lastLine()) {
            error(ErrorCode.UNEXPECTED_TOKEN, "Unexpected " + describe(t) + " after a value", t);
            skipLine();

            return true;
        }

        if (t.column() > indent && isNodeStart(t)) {
            error(ErrorCode.BAD_INDENT, "Bad indentation of " + describe(t), t);
            skipLine();

            return true;
        }

        return false;
    }

    private void closeCollection(Collection<?> collection, int start, int indent) {
        collection.setRange(new SourceRange(start, nodeEnd()));

        if (!ctx.isRootCollection()) {
            Comments.append(collection, ctx.takeCollectionEnd(indent));
        }

        ctx.exitCollection();
    }

    private Commentable trailingTarget(Pair pair) {
        return pair.getValue() instanceof Node value ? value : pair;
    }

    private Node composeEntryValue(int indent) {
        var t = peek();

        if (t != null && t.line() == ctx.lastLine() && isNodeStart(t)) {
            return composeBlockNode(indent);
        }

        String inline = ctx.takeInline();

        if (t == null || t.column() <= indent || !isNodeStart(t)) {
            var empty = new Scalar(null);
            empty.setComment(inline);

            return empty;
        }

        var leading = ctx.takeLeading();
        var node = composeBlockNode(indent);
        applyLeading(node, leading);
        Comments.prependBefore(node, inline);

        return node;
    }

    private Pair composePair(int indent) {
        var t = peek();
        Pair pair;

        if (t.is(TokenType.MAP_KEY)) {
            next();
            pair = new Pair(composeEntryValue(indent));

            var value = peek();

            if (value != null && value.is(TokenType.MAP_VALUE) && value.column() == indent) {
                next();
                composePairValue(pair, indent);
            }

            return pair;
        }

        if (t.is(TokenType.MAP_VALUE)) {
            pair = new Pair(null);
        } else {
            var key = composeImplicitKey(indent);

            if (t.line() != ctx.lastLine()) {
                error(ErrorCode.MULTILINE_IMPLICIT_KEY, "Implicit keys must be on a single line",
                        t);
            }

            pair = new Pair(key);
        }

        if (peekIs(TokenType.MAP_VALUE)) {
            next();
            composePairValue(pair, indent);
        }

        return pair;
    }

    private void composePairValue(Pair pair, int indent) {
        var t = peek();

        if (t != null && t.line() == ctx.lastLine()) {
            if (t.is(TokenType.SEQ_ENTRY) || t.is(TokenType.MAP_KEY)) {
                error(ErrorCode.UNEXPECTED_TOKEN, "Block collections cannot start on the line "
                        + "of their key", t);
                skipLine();

                return;
            }

            if (isNodeStart(t) && !t.is(TokenType.MAP_VALUE)) {
                if (isImplicitKey()) {
                    error(ErrorCode.NESTED_COMPACT_MAPPING,
                            "Nested mappings are not allowed in compact mappings", t);
                    pair.setValue(composeImplicitKey(indent));
                    skipLine();

                    return;
                }

                pair.setValue(composeBlockNode(indent));

                return;
            }
        }

        String inline = ctx.takeInline();

        if (t != null && isNodeStart(t) && !t.is(TokenType.MAP_VALUE)
                && (t.column() > indent || t.column() == indent && t.is(TokenType.SEQ_ENTRY))) {
            var leading = ctx.takeLeading();
            var value = composeBlockNode(indent);
            applyLeading(value, leading);
            pair.setValue(value);
        }

        if (inline != null) {
            Comments.append(pair, inline);
        }
    }

    private void applyLeading(Node node, Leading leading) {
        var target = leadingTarget(node);
        Comments.prependBefore(target, leading.comment());

        if (leading.spaceBefore()) {
            target.setSpaceBefore(true);
        }
    }

    private Commentable leadingTarget(Node node) {
        if (node instanceof Collection<?> collection && !collection.isFlow()
                && !collection.isEmpty() && collection.get(0) instanceof Commentable first) {
            return first;
        }

        return node;
    }

    private Node composeImplicitKey(int indent) {
        if (peek().type().isProperty()) {
            properties = takeProperties();
        }

        return peek().type().isScalar() ? composeScalar(indent) : composeFlow();
    }

    private Scalar composeScalar(int parentIndent) {
        var t = next();

        var scalar = switch (t.type()) {
            case SINGLE_QUOTED -> new Scalar(ScalarValues.singleQuoted(t.text()),
                    ScalarStyle.QUOTE_SINGLE);
            case DOUBLE_QUOTED -> new Scalar(ScalarValues.doubleQuoted(t.text()),
                    ScalarStyle.QUOTE_DOUBLE);
            case ALIAS -> new Scalar(t.text().substring(1), ScalarStyle.ALIAS);
            default -> new Scalar(plainValue(t, parentIndent), ScalarStyle.PLAIN);
        };

        applyProperties(scalar);
        scalar.setRange(new SourceRange(t.start(), nodeEnd()));
        scalar.setComment(inlineComment());

        return scalar;
    }

    private String plainValue(Token first, int parentIndent) {
        var value = new StringBuilder(first.text());

        for (var t = peek(); t != null && t.is(TokenType.PLAIN); t = peek()) {
            if (t.line() == ctx.lastLine() || t.column() <= parentIndent || isImplicitKey()
                    || ctx.hasPendingComment()) {
                break;
            }

            int blanks = ctx.takeLeadingBlanks();
            next();
            value.append(blanks == 0 ? " " : "\n".repeat(blanks)).append(t.text());
        }

        return value.toString();
    }

    private Scalar composeBlockScalar() {
        var scalar = applyProperties(new Scalar(null));
        var header = next();
        var indicators = header.text().substring(1);
        var chomping = Chomping.CLIP;

        for (int i = 0; i < indicators.length(); i++) {
            if (indicators.charAt(i) == '+' || indicators.charAt(i) == '-') {
                chomping = Chomping.fromIndicator(indicators.charAt(i));
            }
        }

        boolean folded = header.text().charAt(0) == '>';
        String comment = inlineComment();
        String body = "";
        int contentIndent = 0;

        if (peekIs(TokenType.BLOCK_SCALAR_BODY)) {
            var bodyToken = next();
            body = bodyToken.text();
            contentIndent = bodyToken.indent();
        }

        int end = nodeEnd();
        int extraBreaks = 0;

        if (chomping == Chomping.KEEP) {
            peek();
            extraBreaks = ctx.takeLeadingBlanks();
        }

        scalar.setValue(ScalarValues.block(body, contentIndent, folded, chomping, extraBreaks));
        scalar.setStyle(folded ? ScalarStyle.BLOCK_FOLDED : ScalarStyle.BLOCK_LITERAL);
        scalar.setChomping(chomping);
        scalar.setComment(comment);
        scalar.setRange(new SourceRange(header.start(), end));

        return scalar;
    }

    private Node composeFlow() {
        var open = next();
        boolean isMap = open.is(TokenType.FLOW_MAP_START);
        Collection<?> collection = isMap ? new YamlMap() : new YamlSeq();
        applyProperties(collection);
        collection.setFlow(true);
        Object previous = null;

        while (true) {
            var t = peek();

            if (t == null) {
                error(ErrorCode.UNTERMINATED_FLOW, "Missing closing " + (isMap ? "}" : "]"), open);
                break;
            }

            if (t.type().isFlowEnd()) {
                closeFlow(collection, previous, isMap, t);
                break;
            }

            if (t.is(TokenType.FLOW_COMMA)) {
                error(ErrorCode.UNEXPECTED_TOKEN, "Unexpected , in flow collection", t);
                next();
                continue;
            }

            var leading = ctx.takeLeading();
            Object item;

            if (isMap) {
                var pair = composeFlowPair();
                ((YamlMap) collection).add(pair);
                item = pair;
            } else if (t.is(TokenType.MAP_KEY) || t.is(TokenType.MAP_VALUE) || isImplicitKey()) {
                var pair = composeFlowPair();
                ((YamlSeq) collection).add(pair);
                item = pair;
            } else {
                var node = composeFlowNode();
                ((YamlSeq) collection).add(node);
                item = node;
            }

            if (item instanceof Commentable commentable) {
                Comments.prependBefore(commentable, leading.comment());

                if (leading.spaceBefore()) {
                    commentable.setSpaceBefore(true);
                }
            }

            previous = item;
            var separator = peek();

            if (separator != null && separator.is(TokenType.FLOW_COMMA)) {
                next();
                appendItemComment(item, inlineComment());
            } else if (separator != null && !separator.type().isFlowEnd()) {
                error(ErrorCode.UNEXPECTED_TOKEN, "Expected , or " + (isMap ? "}" : "]")
                        + " in flow collection", separator);
            }
        }

        collection.setRange(new SourceRange(open.start(), nodeEnd()));
        collection.setComment(inlineComment());

        return collection;
    }

    private void closeFlow(Collection<?> collection, Object last, boolean isMap, Token end) {
        if (isMap != end.is(TokenType.FLOW_MAP_END)) {
            error(ErrorCode.UNEXPECTED_TOKEN, "Mismatched " + end.text() + " in flow collection",
                    end);
        }

        String remaining = ctx.takeComments();

        if (last != null) {
            appendItemComment(last, remaining);
        } else {
            Comments.append(collection, remaining);
        }

        next();
    }

    private void appendItemComment(Object item, String comment) {
        if (item instanceof Pair pair) {
            Comments.append(trailingTarget(pair), comment);
        } else if (item instanceof Commentable commentable) {
            Comments.append(commentable, comment);
        }
    }

    private Pair composeFlowPair() {
        var t = peek();
        Node key = null;

        if (t.is(TokenType.MAP_KEY)) {
            next();

            if (!peekIs(TokenType.MAP_VALUE)) {
                key = composeFlowNode();
            }
        } else if (!t.is(TokenType.MAP_VALUE)) {
            key = composeFlowNode();
        }

        var pair = new Pair(key);

        if (peekIs(TokenType.MAP_VALUE)) {
            next();

            var value = peek();
            String inline = ctx.takeInline();

            if (value != null && !value.is(TokenType.FLOW_COMMA) && !value.type().isFlowEnd()) {
                var leading = ctx.takeLeading();
                var node = composeFlowNode();

                if (node != null) {
                    Comments.prependBefore(node, leading.comment());

                    if (leading.spaceBefore()) {
                        node.setSpaceBefore(true);
                    }
                }

                pair.setValue(node);
            }

            if (inline != null) {
                Comments.append(pair, inline);
            }
        }

        return pair;
    }

    private Node composeFlowNode() {
        var t = peek();

        if (t == null) {
            return null;
        }

        return switch (t.type()) {
            case PLAIN, SINGLE_QUOTED, DOUBLE_QUOTED, ALIAS -> composeScalar(-1);
            case FLOW_SEQ_START, FLOW_MAP_START -> composeFlow();
            case ANCHOR, TAG -> {
                properties = takeProperties();
                var node = composeFlowNode();

                if (node == null) {
                    node = new Scalar(null);
                    node.setRange(new SourceRange(t.start(), nodeEnd()));
                }

                yield applyProperties(node);
            }
            case FLOW_COMMA, FLOW_SEQ_END, FLOW_MAP_END, MAP_VALUE -> null;
            default -> {
                error(ErrorCode.UNEXPECTED_TOKEN, "Unexpected " + describe(t)
                        + " in flow collection", t);
                next();

                yield scalarFromError(t);
            }
        };
    }

    private Scalar scalarFromError(Token t) {
        var scalar = new Scalar(t.text(), ScalarStyle.PLAIN);
        scalar.setRange(new SourceRange(t.start(), t.end()));

        return scalar;
    }

    private boolean isImplicitKey() {
        int i = index;

        while (i < tokens.size() && (tokens.get(i).type().isProperty()
                || tokens.get(i).is(TokenType.WHITESPACE))) {
            i++;
        }

        if (i >= tokens.size()) {
            return false;
        }

        var t = tokens.get(i);

        if (t.is(TokenType.FLOW_SEQ_START) || t.is(TokenType.FLOW_MAP_START)) {
            int depth = 0;

            for (; i < tokens.size(); i++) {
                var type = tokens.get(i).type();

                if (type == TokenType.FLOW_SEQ_START || type == TokenType.FLOW_MAP_START) {
                    depth++;
                } else if (type.isFlowEnd() && --depth == 0) {
                    break;
                }
            }
        } else if (!t.type().isScalar()) {
            return false;
        }

        i++;

        while (i < tokens.size() && tokens.get(i).is(TokenType.WHITESPACE)) {
            i++;
        }

        return i < tokens.size() && tokens.get(i).is(TokenType.MAP_VALUE);
    }

    private boolean isNodeStart(Token t) {
        if (t == null) {
            return false;
        }

        return switch (t.type()) {
            case DIRECTIVE, DOCUMENT_START, DOCUMENT_END, FLOW_COMMA, FLOW_SEQ_END, FLOW_MAP_END,
                    BLOCK_SCALAR_BODY -> false;
            default -> true;
        };
    }

    /**
     * End offset of the last consumed node, stretched over a trailing comment and the line break
     * when nothing else follows on its line. A block scalar body already ends with its line.
     */
    private int nodeEnd() {
        int end = tokens.get(lastConsumed).end();

        if (tokens.get(lastConsumed).is(TokenType.BLOCK_SCALAR_BODY)) {
            return end;
        }

        for (int i = lastConsumed + 1; i < tokens.size(); i++) {
            var t = tokens.get(i);

            if (t.is(TokenType.NEWLINE)) {
                return t.end();
            }

            if (t.is(TokenType.COMMENT)) {
                end = t.end();
            } else if (!t.is(TokenType.WHITESPACE)) {
                break;
            }
        }

        return end;
    }

    private void skipLine() {
        while (index < tokens.size()) {
            var t = tokens.get(index);

            if (t.is(TokenType.NEWLINE) || t.is(TokenType.BLANK_LINE)) {
                break;
            }

            consume();

            if (t.is(TokenType.BLOCK_SCALAR_HEADER)) {
                while (index < tokens.size() && !tokens.get(index).is(TokenType.NEWLINE)) {
                    consume();
                }

                if (index + 1 < tokens.size()
                        && tokens.get(index + 1).is(TokenType.BLOCK_SCALAR_BODY)) {
                    consume();
                    consume();
                }

                break;
            }
        }
    }

    private Token peek() {
        while (index < tokens.size()) {
            var t = tokens.get(index);

            switch (t.type()) {
                case COMMENT -> ctx.addComment(t);
                case BLANK_LINE -> ctx.addBlank(t);
                case INDENT, WHITESPACE, NEWLINE -> {}
                default -> {
                    return t;
                }
            }

            index++;
        }

        return null;
    }

    private String inlineComment() {
        peek();

        return ctx.takeInline();
    }

    private boolean peekIs(TokenType type) {
        var t = peek();

        return t != null && t.is(type);
    }

    private Token next() {
        peek();

        return consume();
    }

    private Token consume() {
        var t = tokens.get(index);
        lastConsumed = index++;
        ctx.setLastLine(t.endLine());

        return t;
    }

    private static String describe(Token t) {
        return t.type().name().toLowerCase(Locale.ROOT).replace('_', ' ') + " '"
                + t.text().strip() + "'";
    }

    private void error(ErrorCode code, String message, Token t) {
        YamlError error;

        if (t != null) {
            error = YamlError.at(code, message, t);
        } else {
            var last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            error = last == null ? new YamlError(code, message, 0, 1, 0)
                    : new YamlError(code, message, last.end(), last.endLine(), 0);
        }

        log.debug("Recorded {}", error);
        doc.getErrors().add(error);
    }

    private void warning(ErrorCode code, String message, Token t) {
        var warning = YamlError.at(code, message, t);
        log.debug("Recorded warning {}", warning);
        doc.getWarnings().add(warning);
    }
}
