package org.quill.compiler.frontend.parser;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.directive.KeywordHandlerRegistry;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.AttributeNode;
import org.quill.compiler.frontend.parser.ast.BlockNode;
import org.quill.compiler.frontend.parser.ast.CaseNode;
import org.quill.compiler.frontend.parser.ast.CommentNode;
import org.quill.compiler.frontend.parser.ast.DoctypeNode;
import org.quill.compiler.frontend.parser.ast.ElementNode;
import org.quill.compiler.frontend.parser.ast.ExtendsNode;
import org.quill.compiler.frontend.parser.ast.IncludeNode;
import org.quill.compiler.frontend.parser.ast.MixinCallNode;
import org.quill.compiler.frontend.parser.ast.MixinDefNode;
import org.quill.compiler.frontend.parser.ast.Template;
import org.quill.compiler.frontend.parser.ast.TextNode;
import org.quill.compiler.frontend.parser.ast.TextSegment;
import org.quill.compiler.frontend.parser.features.mixin.MixinSignatures;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The parser for the template language. It consumes the tokens of one file from the
 * {@link org.quill.compiler.frontend.lexer.Lexer} and produces a {@link Template}.
 * <p>
 * Nesting is decided by an explicit stack of frames, one per open container. Each frame
 * knows the depth of its children. A line at depth D first closes every frame deeper
 * than D; a line deeper than the top frame opens a frame for the construct on the line
 * above, which must admit children. Keyword lines are delegated to the handlers of a
 * {@link KeywordHandlerRegistry}.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final KeywordHandlerRegistry keywordRegistry;
    private final String fileName;
    private int current = 0;

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Set<String> declaredBlocks = new HashSet<>();
    private OpenContainer pending;
    private int depth = 0;
    private boolean hasContent = false;

    /**
     * An open container: the position of its node in the parent frame and how deeper
     * lines attach to it.
     */
    private record OpenContainer(Frame parent, int index, ContainerAttach attach, int depth) {
        AstNode node() {
            return parent.children.get(index);
        }
    }

    private static final class Frame {
        private final int depth;
        private final OpenContainer owner;
        private final List<AstNode> children = new ArrayList<>();
        private boolean lastWasPipe;

        private Frame(int depth, OpenContainer owner) {
            this.depth = depth;
            this.owner = owner;
        }
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param fileName The logical name of the file, used in the resulting template.
     */
    public Parser(List<Token> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
        this.keywordRegistry = KeywordHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The parsed template.
     * @throws TemplateSyntaxException on the first malformed line.
     */
    public Template parse() throws TemplateSyntaxException {
        frames.push(new Frame(0, null));
        while (!isAtEnd()) {
            if (match(TokenType.INDENT)) {
                depth++;
            } else if (match(TokenType.DEDENT)) {
                depth--;
            } else if (!match(TokenType.NEWLINE)) {
                line();
            }
        }
        while (frames.size() > 1) {
            closeFrame();
        }
        return buildTemplate(frames.peek().children);
    }

    private void line() throws TemplateSyntaxException {
        Token head = peek();
        enterDepth(head);
        if (enclosingNode() instanceof CaseNode && !isCaseClause(head) && head.type() != TokenType.SILENT_COMMENT) {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Only 'when' and 'default' may appear inside 'case'", head.source(), "'when' or 'default'");
        }
        ParsedLine parsed = statement(head);
        if (!check(TokenType.NEWLINE) && !isAtEnd()) {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Unexpected '" + peek().text() + "'", peek().source(), "end of line");
        }
        match(TokenType.NEWLINE);
        place(parsed, head);
    }

    private void enterDepth(Token head) throws TemplateSyntaxException {
        if (depth > frames.peek().depth) {
            if (pending == null || pending.depth() + 1 != depth) {
                throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_INDENTATION,
                        "Unexpected indentation", head.source(), "a line at the depth of the previous line or above");
            }
            frames.push(new Frame(depth, pending));
        } else {
            while (frames.peek().depth > depth) {
                closeFrame();
            }
        }
        pending = null;
    }

    private void closeFrame() throws TemplateSyntaxException {
        Frame frame = frames.pop();
        OpenContainer owner = frame.owner;
        owner.parent().children.set(owner.index(), owner.attach().attach(owner.node(), frame.children));
    }

    private void place(ParsedLine parsed, Token head) {
        Frame top = frames.peek();
        boolean pipe = head.type() == TokenType.PIPE;
        int index;
        if (parsed.replacesPrevious()) {
            index = top.children.size() - 1;
            top.children.set(index, parsed.node());
        } else if (pipe && top.lastWasPipe) {
            index = top.children.size() - 1;
            top.children.set(index, ((TextNode) top.children.get(index)).joinLine((TextNode) parsed.node()));
        } else {
            top.children.add(parsed.node());
            index = top.children.size() - 1;
        }
        top.lastWasPipe = pipe;
        if (!(parsed.node() instanceof CommentNode comment) || comment.visible()) {
            hasContent = true;
        }
        if (parsed.container() != null) {
            pending = new OpenContainer(top, index, parsed.container(), depth);
        }
    }

    private ParsedLine statement(Token head) throws TemplateSyntaxException {
        switch (head.type()) {
            case KEYWORD:
                return keyword();
            case TAG:
                return element();
            case MIXIN_CALL:
                return mixinCall();
            case PIPE:
                advance();
                return ParsedLine.leaf(text(head.source()));
            case TEXT:
            case INTERPOLATION:
            case RAW_INTERPOLATION:
                return ParsedLine.leaf(text(head.source()));
            case BUFFERED_CODE:
            case UNESCAPED_CODE:
                return ParsedLine.leaf(code(advance()));
            case DOCTYPE:
                advance();
                return ParsedLine.leaf(new DoctypeNode(head.stringValue(), head.source()));
            case COMMENT:
                advance();
                return ParsedLine.leaf(new CommentNode(head.stringValue(), true, head.source()));
            case SILENT_COMMENT:
                advance();
                return ParsedLine.leaf(new CommentNode(head.stringValue(), false, head.source()));
            default:
                throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                        "Unexpected '" + head.text() + "'", head.source(), "a statement");
        }
    }

    private ParsedLine keyword() throws TemplateSyntaxException {
        Token keyword = advance();
        IKeywordHandler handler = keywordRegistry.get(keyword.text())
                .orElseThrow(() -> new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                        "Unknown keyword '" + keyword.text() + "'", keyword.source(), null));
        return handler.parse(keyword, this);
    }

    private ParsedLine element() throws TemplateSyntaxException {
        Token tag = advance();
        Set<String> classes = new LinkedHashSet<>();
        String id = null;
        List<AttributeNode> attributes = new ArrayList<>();
        while (true) {
            if (match(TokenType.CLASS)) {
                classes.add(previous().stringValue());
            } else if (match(TokenType.ID)) {
                id = previous().stringValue();
            } else if (match(TokenType.ATTRIBUTES)) {
                attributes.addAll(AttributeListParser.parse(previous()));
            } else {
                break;
            }
        }
        boolean selfClosing = match(TokenType.SELF_CLOSE);
        List<AstNode> inline = new ArrayList<>();
        if (check(TokenType.BUFFERED_CODE) || check(TokenType.UNESCAPED_CODE)) {
            inline.add(code(advance()));
        } else if (isTextToken(peek().type())) {
            inline.add(text(peek().source()));
        }
        ElementNode node = new ElementNode(tag.stringValue(), new ArrayList<>(classes), id, attributes,
                inline, selfClosing, tag.source());
        return ParsedLine.container(node, (currentNode, children) -> {
            ElementNode element = (ElementNode) currentNode;
            List<AstNode> all = new ArrayList<>(element.children());
            all.addAll(children);
            return element.withChildren(all);
        });
    }

    private ParsedLine mixinCall() throws TemplateSyntaxException {
        Token call = advance();
        List<String> args = match(TokenType.ATTRIBUTES)
                ? MixinSignatures.parseArguments(previous().stringValue(), previous().source())
                : List.of();
        MixinCallNode node = new MixinCallNode(call.stringValue(), args, null, call.source());
        return ParsedLine.container(node, (currentNode, children) -> ((MixinCallNode) currentNode).withBlockContent(children));
    }

    private TextNode text(SourceInfo source) {
        List<TextSegment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        while (isTextToken(peek().type())) {
            Token token = advance();
            if (token.type() == TokenType.TEXT) {
                literal.append(token.stringValue());
                continue;
            }
            if (literal.length() > 0) {
                segments.add(new TextSegment.Literal(literal.toString()));
                literal.setLength(0);
            }
            segments.add(new TextSegment.ExpressionSpan(token.stringValue(),
                    token.type() == TokenType.INTERPOLATION, token.source()));
        }
        if (literal.length() > 0) {
            segments.add(new TextSegment.Literal(literal.toString()));
        }
        return new TextNode(segments, false, source);
    }

    private TextNode code(Token token) {
        TextSegment span = new TextSegment.ExpressionSpan(token.stringValue(),
                token.type() == TokenType.BUFFERED_CODE, token.source());
        return new TextNode(List.of(span), false, token.source());
    }

    private Template buildTemplate(List<AstNode> nodes) throws TemplateSyntaxException {
        ExtendsNode extendsNode = null;
        List<AstNode> content = new ArrayList<>();
        for (AstNode node : nodes) {
            if (node instanceof ExtendsNode e) {
                extendsNode = e;
            } else {
                content.add(node);
            }
        }
        if (extendsNode != null) {
            for (AstNode node : content) {
                if (!(node instanceof BlockNode || node instanceof MixinDefNode
                        || node instanceof CommentNode || node instanceof IncludeNode)) {
                    throw new TemplateSyntaxException(CompilerErrorCode.INVALID_EXTENDS_CONTENT,
                            "A template that extends another may only contain blocks, mixins, includes and comments",
                            node.source(), null);
                }
            }
        }
        return new Template(fileName, extendsNode, content);
    }

    private static boolean isTextToken(TokenType type) {
        return type == TokenType.TEXT || type == TokenType.INTERPOLATION || type == TokenType.RAW_INTERPOLATION;
    }

    private static boolean isCaseClause(Token head) {
        return head.type() == TokenType.KEYWORD && (head.text().equals("when") || head.text().equals("default"));
    }

    // ParsingContext

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String expected) throws TemplateSyntaxException {
        if (check(type)) return advance();
        if (type == TokenType.ARGUMENT) {
            throw new TemplateSyntaxException(CompilerErrorCode.MISSING_ARGUMENT,
                    "Missing argument after '" + previous().text() + "'", previous().source(), expected);
        }
        throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                "Unexpected '" + peek().text() + "'", peek().source(), expected);
    }

    @Override
    public String fileName() {
        return fileName;
    }

    @Override
    public int currentDepth() {
        return depth;
    }

    @Override
    public AstNode previousSibling() {
        List<AstNode> children = frames.peek().children;
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    @Override
    public AstNode enclosingNode() {
        OpenContainer owner = frames.peek().owner;
        return owner != null ? owner.node() : null;
    }

    @Override
    public boolean insideMixinDefinition() {
        for (Frame frame : frames) {
            if (frame.owner != null && frame.owner.node() instanceof MixinDefNode) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasContent() {
        return hasContent;
    }

    @Override
    public void declareBlock(String name, SourceInfo source) throws TemplateSyntaxException {
        if (!declaredBlocks.add(name)) {
            throw new TemplateSyntaxException(CompilerErrorCode.DUPLICATE_BLOCK,
                    "Block '" + name + "' is declared more than once in " + fileName, source, null);
        }
    }
}
