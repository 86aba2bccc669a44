package org.quill.compiler.frontend.lexer;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.IndentationException;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.util.BalancedText;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts template source into a
 * sequence of tokens.
 * <p>
 * The source is scanned line by line. Every non-blank line produces its indentation
 * tokens ({@link TokenType#INDENT}, {@link TokenType#DEDENT}), the tokens of its line
 * head and a closing {@link TokenType#NEWLINE}. The indentation unit is fixed by the
 * first indented line; every later line must use an exact multiple of it.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "if", "unless", "else", "each", "for", "case", "when", "default",
            "mixin", "block", "append", "prepend", "extends", "include");

    private final String source;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    private String indentUnit;
    private int level = 0;

    /**
     * Creates a new Lexer.
     * @param source The template source as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The template source as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     * @throws TemplateSyntaxException on the first malformed line.
     */
    public List<Token> scanTokens() throws TemplateSyntaxException {
        while (!isAtEnd()) {
            scanLine();
        }
        while (level > 0) {
            addToken(TokenType.DEDENT, "", null, line, 1);
            level--;
        }
        addToken(TokenType.END_OF_FILE, "", null, line, column());
        return tokens;
    }

    private void scanLine() throws TemplateSyntaxException {
        int indentStart = current;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) advance();
        String whitespace = source.substring(indentStart, current);
        if (isAtEnd() || peek() == '\n') {
            if (!isAtEnd()) advance();
            return;
        }
        int newLevel = measureIndentation(whitespace);
        if (newLevel > level + 1) {
            throw new IndentationException("Indentation increased by more than one level", position());
        }
        if (newLevel > level) {
            addToken(TokenType.INDENT, whitespace, newLevel, line, 1);
        }
        for (int i = level; i > newLevel; i--) {
            addToken(TokenType.DEDENT, "", newLevel, line, 1);
        }
        level = newLevel;
        scanLineContent(whitespace.length());
        addToken(TokenType.NEWLINE, "\n", null, line, column());
        if (!isAtEnd()) advance();
    }

    private int measureIndentation(String whitespace) throws IndentationException {
        if (whitespace.isEmpty()) {
            return 0;
        }
        char c = whitespace.charAt(0);
        for (int i = 1; i < whitespace.length(); i++) {
            if (whitespace.charAt(i) != c) {
                throw new IndentationException("Indentation mixes tabs and spaces",
                        new SourceInfo(logicalFileName, line, i + 1));
            }
        }
        if (indentUnit == null) {
            indentUnit = c == '\t' ? "\t" : whitespace;
        }
        if (c != indentUnit.charAt(0)) {
            throw new IndentationException("Indentation uses " + describe(c)
                    + " but this file is indented with " + describe(indentUnit.charAt(0)),
                    new SourceInfo(logicalFileName, line, 1));
        }
        if (whitespace.length() % indentUnit.length() != 0) {
            throw new IndentationException("Indentation of " + whitespace.length()
                    + " is not a multiple of the indentation unit " + indentUnit.length(),
                    new SourceInfo(logicalFileName, line, 1));
        }
        return whitespace.length() / indentUnit.length();
    }

    private static String describe(char c) {
        return c == '\t' ? "tabs" : "spaces";
    }

    private void scanLineContent(int indentWidth) throws TemplateSyntaxException {
        int col = column();
        int ln = line;
        if (startsWith("//-")) {
            skip(3);
            String text = restOfLine() + swallowBlock(indentWidth, false);
            addToken(TokenType.SILENT_COMMENT, "//-", text, ln, col);
            return;
        }
        if (startsWith("//")) {
            skip(2);
            String text = restOfLine() + swallowBlock(indentWidth, true);
            addToken(TokenType.COMMENT, "//", text, ln, col);
            return;
        }
        if (peek() == '|') {
            advance();
            addToken(TokenType.PIPE, "|", null, ln, col);
            if (peek() == ' ') advance();
            scanText(restOfLine(), ln, column());
            return;
        }
        if (peek() == '<') {
            scanText(restOfLine(), ln, col);
            return;
        }
        if (startsWith("!=") || peek() == '=') {
            code();
            return;
        }
        if (peek() == '+' && isAlpha(peekNext())) {
            mixinCall();
            return;
        }
        if (isAlpha(peek())) {
            String word = peekWord();
            if (word.equals("doctype") && isWordBoundary(current + word.length())) {
                skip(word.length());
                String kind = restOfLine().trim();
                addToken(TokenType.DOCTYPE, "doctype", kind.isEmpty() ? "html" : kind, ln, col);
                return;
            }
            if (KEYWORDS.contains(word) && (isWordBoundary(current + word.length())
                    || (word.equals("include") && charAt(current + word.length()) == ':'))) {
                keyword(word);
                return;
            }
            String name = readWhile(this::isIdentifierPart);
            addToken(TokenType.TAG, name, name, ln, col);
            tagRest(indentWidth);
            return;
        }
        if ((peek() == '.' || peek() == '#') && isNamePart(peekNext())) {
            addToken(TokenType.TAG, "", "div", ln, col);
            tagRest(indentWidth);
            return;
        }
        throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                "Unexpected character '" + peek() + "'", position(), "a tag, keyword or text");
    }

    private void tagRest(int indentWidth) throws TemplateSyntaxException {
        boolean hasId = false;
        while (true) {
            if (peek() == '.' && isNamePart(peekNext())) {
                int col = column();
                advance();
                String name = readWhile(this::isNamePart);
                addToken(TokenType.CLASS, "." + name, name, line, col);
            } else if (peek() == '#' && isNamePart(peekNext())) {
                int col = column();
                if (hasId) {
                    throw new TemplateSyntaxException(CompilerErrorCode.DUPLICATE_ID_SHORTHAND,
                            "A tag can have only one #id shorthand", position(), null);
                }
                hasId = true;
                advance();
                String name = readWhile(this::isNamePart);
                addToken(TokenType.ID, "#" + name, name, line, col);
            } else if (peek() == '(') {
                parenthesized();
            } else {
                break;
            }
        }
        if (peek() == '/') {
            addToken(TokenType.SELF_CLOSE, "/", null, line, column());
            advance();
        }
        if (startsWith("!=") || peek() == '=') {
            code();
        } else if (peek() == '.' && restOfLineIsBlank(current + 1)) {
            restOfLine();
            blockText(indentWidth);
        } else if (peek() == ' ' || peek() == '\t') {
            advance();
            String text = restOfLine();
            if (!text.isBlank()) {
                scanText(text, line, column() - text.length());
            }
        } else if (!isAtEnd() && peek() != '\n') {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected character '" + peek() + "' after tag", position(), "text, '=' or end of line");
        }
    }

    private void code() throws TemplateSyntaxException {
        int col = column();
        boolean unescaped = peek() == '!';
        skip(unescaped ? 2 : 1);
        String expression = restOfLine().trim();
        if (expression.isEmpty()) {
            throw new TemplateSyntaxException(CompilerErrorCode.MISSING_ARGUMENT,
                    "Buffered code without an expression", new SourceInfo(logicalFileName, line, col), "an expression");
        }
        addToken(unescaped ? TokenType.UNESCAPED_CODE : TokenType.BUFFERED_CODE,
                unescaped ? "!=" : "=", expression, line, col);
    }

    private void mixinCall() throws TemplateSyntaxException {
        int col = column();
        advance();
        String name = readWhile(this::isIdentifierPart);
        addToken(TokenType.MIXIN_CALL, "+" + name, name, line, col);
        if (peek() == '(') {
            parenthesized();
        }
        String rest = restOfLine();
        if (!rest.isBlank()) {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected text after mixin call", new SourceInfo(logicalFileName, line, column() - rest.length()),
                    "end of line");
        }
    }

    private void keyword(String word) throws TemplateSyntaxException {
        int col = column();
        int ln = line;
        skip(word.length());
        String keyword = word;
        String filter = null;
        if (word.equals("else")) {
            int save = current;
            while (peek() == ' ' || peek() == '\t') advance();
            if (startsWith("if") && isWordBoundary(current + 2)) {
                skip(2);
                keyword = "else if";
            } else {
                current = save;
            }
        } else if (word.equals("include") && peek() == ':') {
            advance();
            filter = readWhile(this::isIdentifierPart);
            if (filter.isEmpty()) {
                throw new TemplateSyntaxException(CompilerErrorCode.MISSING_ARGUMENT,
                        "Missing filter name after 'include:'", position(), "a filter name");
            }
        }
        addToken(TokenType.KEYWORD, keyword, filter, ln, col);
        while (peek() == ' ' || peek() == '\t') advance();
        int argumentColumn = column();
        String argument = restOfLine().trim();
        if (!argument.isEmpty()) {
            addToken(TokenType.ARGUMENT, argument, argument, ln, argumentColumn);
        }
    }

    /**
     * Scans a parenthesized list, which may continue over several lines.
     */
    private void parenthesized() throws TemplateSyntaxException {
        int col = column();
        int ln = line;
        int close = BalancedText.findClosing(source, current + 1, ')');
        if (close < 0) {
            throw new TemplateSyntaxException(CompilerErrorCode.UNBALANCED_ATTRIBUTES,
                    "Unbalanced parenthesis", new SourceInfo(logicalFileName, ln, col), "')'");
        }
        String inner = source.substring(current + 1, close);
        while (current <= close) advance();
        addToken(TokenType.ATTRIBUTES, "(" + inner + ")", inner, ln, col);
    }

    /**
     * Scans the deeper indented lines below a tag ending in {@code .} as plain text.
     */
    private void blockText(int indentWidth) throws TemplateSyntaxException {
        List<int[]> spans = new ArrayList<>();
        List<String> lines = swallowLines(indentWidth, spans);
        int common = commonIndent(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                addToken(TokenType.TEXT, "\n", "\n", spans.get(i)[0], 1);
            }
            String text = lines.get(i);
            String stripped = text.isBlank() ? "" : text.substring(common);
            if (!stripped.isEmpty()) {
                scanText(stripped, spans.get(i)[0], common + 1);
            }
        }
    }

    private String swallowBlock(int indentWidth, boolean keep) {
        List<String> lines = swallowLines(indentWidth, new ArrayList<>());
        if (!keep || lines.isEmpty()) {
            return "";
        }
        int common = commonIndent(lines);
        StringBuilder sb = new StringBuilder();
        for (String text : lines) {
            sb.append('\n').append(text.isBlank() ? "" : text.substring(common));
        }
        return sb.toString();
    }

    /**
     * Consumes the following lines that are indented deeper than {@code indentWidth},
     * together with blank lines between them. Stops before the newline that ends the
     * last swallowed line.
     */
    private List<String> swallowLines(int indentWidth, List<int[]> lineNumbers) {
        List<String> lines = new ArrayList<>();
        int scan = current;
        int scanLine = line;
        int acceptedEnd = -1;
        List<String> pending = new ArrayList<>();
        List<int[]> pendingNumbers = new ArrayList<>();
        while (scan < source.length() && source.charAt(scan) == '\n') {
            int start = scan + 1;
            int end = source.indexOf('\n', start);
            if (end < 0) end = source.length();
            String text = source.substring(start, end);
            scanLine++;
            if (text.isBlank()) {
                pending.add("");
                pendingNumbers.add(new int[]{scanLine});
            } else {
                int width = 0;
                while (width < text.length() && (text.charAt(width) == ' ' || text.charAt(width) == '\t')) width++;
                if (width <= indentWidth) {
                    break;
                }
                pending.add(text);
                pendingNumbers.add(new int[]{scanLine});
                lines.addAll(pending);
                lineNumbers.addAll(pendingNumbers);
                pending.clear();
                pendingNumbers.clear();
                acceptedEnd = end;
            }
            scan = end;
        }
        if (acceptedEnd >= 0) {
            while (current < acceptedEnd) advance();
        }
        return lines;
    }

    private static int commonIndent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (String text : lines) {
            if (text.isBlank()) continue;
            int width = 0;
            while (width < text.length() && (text.charAt(width) == ' ' || text.charAt(width) == '\t')) width++;
            common = Math.min(common, width);
        }
        return common == Integer.MAX_VALUE ? 0 : common;
    }

    private void scanText(String text, int ln, int col) throws TemplateSyntaxException {
        SourceInfo origin = new SourceInfo(logicalFileName, ln, col);
        for (InterpolationScanner.Piece piece : InterpolationScanner.scan(text, origin)) {
            int pieceColumn = col + piece.offset();
            switch (piece.kind()) {
                case LITERAL -> addToken(TokenType.TEXT, piece.text(), piece.text(), ln, pieceColumn);
                case ESCAPED -> addToken(TokenType.INTERPOLATION, "#{" + piece.text() + "}", piece.text(), ln, pieceColumn);
                case RAW -> addToken(TokenType.RAW_INTERPOLATION, "!{" + piece.text() + "}", piece.text(), ln, pieceColumn);
            }
        }
    }

    private String restOfLine() {
        int start = current;
        while (!isAtEnd() && peek() != '\n') advance();
        return source.substring(start, current);
    }

    private boolean restOfLineIsBlank(int from) {
        for (int i = from; i < source.length() && source.charAt(i) != '\n'; i++) {
            if (source.charAt(i) != ' ' && source.charAt(i) != '\t') {
                return false;
            }
        }
        return true;
    }

    private String peekWord() {
        int end = current;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) end++;
        return source.substring(current, end);
    }

    private String readWhile(java.util.function.IntPredicate predicate) {
        int start = current;
        while (!isAtEnd() && predicate.test(peek())) advance();
        return source.substring(start, current);
    }

    private boolean isWordBoundary(int index) {
        char c = charAt(index);
        return c == 0 || c == ' ' || c == '\t' || c == '\n';
    }

    private boolean startsWith(String prefix) {
        return source.startsWith(prefix, current);
    }

    private void skip(int count) {
        for (int i = 0; i < count && !isAtEnd(); i++) advance();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return charAt(current);
    }

    private char peekNext() {
        return charAt(current + 1);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private int column() {
        return current - lineStart + 1;
    }

    private SourceInfo position() {
        return new SourceInfo(logicalFileName, line, column());
    }

    private boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isIdentifierPart(int c) {
        return isAlpha(c) || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private boolean isNamePart(int c) {
        return isIdentifierPart(c);
    }

    private void addToken(TokenType type, String text, Object value, int ln, int col) {
        tokens.add(new Token(type, text, value, ln, col, logicalFileName));
    }
}
