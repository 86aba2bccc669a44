package org.quill.script;

import org.quill.compiler.api.EvaluationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an expression into tokens.
 */
public class ScriptLexer {

    private static final Map<String, ScriptTokenType> KEYWORDS = Map.of(
            "true", ScriptTokenType.TRUE,
            "false", ScriptTokenType.FALSE,
            "null", ScriptTokenType.NULL,
            "undefined", ScriptTokenType.UNDEFINED,
            "typeof", ScriptTokenType.TYPEOF);

    private final String source;
    private final List<ScriptToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * @param source The expression text.
     */
    public ScriptLexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole expression.
     * @return The tokens, terminated by {@link ScriptTokenType#END}.
     * @throws EvaluationException on a character that starts no token or an unterminated string.
     */
    public List<ScriptToken> scanTokens() throws EvaluationException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new ScriptToken(ScriptTokenType.END, "", null, current));
        return tokens;
    }

    private void scanToken() throws EvaluationException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '(' -> add(ScriptTokenType.LEFT_PAREN);
            case ')' -> add(ScriptTokenType.RIGHT_PAREN);
            case '[' -> add(ScriptTokenType.LEFT_BRACKET);
            case ']' -> add(ScriptTokenType.RIGHT_BRACKET);
            case '{' -> add(ScriptTokenType.LEFT_BRACE);
            case '}' -> add(ScriptTokenType.RIGHT_BRACE);
            case ',' -> add(ScriptTokenType.COMMA);
            case ':' -> add(ScriptTokenType.COLON);
            case '+' -> add(ScriptTokenType.PLUS);
            case '-' -> add(ScriptTokenType.MINUS);
            case '*' -> add(ScriptTokenType.STAR);
            case '/' -> add(ScriptTokenType.SLASH);
            case '%' -> add(ScriptTokenType.PERCENT);
            case '.' -> {
                if (Character.isDigit(peek())) {
                    number();
                } else {
                    add(ScriptTokenType.DOT);
                }
            }
            case '?' -> {
                if (match('?')) {
                    add(ScriptTokenType.QUESTION_QUESTION);
                } else if (peek() == '.' && !Character.isDigit(peekNext())) {
                    advance();
                    add(ScriptTokenType.QUESTION_DOT);
                } else {
                    add(ScriptTokenType.QUESTION);
                }
            }
            case '!' -> {
                if (match('=')) {
                    add(match('=') ? ScriptTokenType.BANG_EQUAL_EQUAL : ScriptTokenType.BANG_EQUAL);
                } else {
                    add(ScriptTokenType.BANG);
                }
            }
            case '=' -> {
                if (!match('=')) {
                    throw error("Assignment is not supported");
                }
                add(match('=') ? ScriptTokenType.EQUAL_EQUAL_EQUAL : ScriptTokenType.EQUAL_EQUAL);
            }
            case '<' -> add(match('=') ? ScriptTokenType.LESS_EQUAL : ScriptTokenType.LESS);
            case '>' -> add(match('=') ? ScriptTokenType.GREATER_EQUAL : ScriptTokenType.GREATER);
            case '&' -> {
                if (!match('&')) {
                    throw error("Bitwise operators are not supported");
                }
                add(ScriptTokenType.AND_AND);
            }
            case '|' -> {
                if (!match('|')) {
                    throw error("Bitwise operators are not supported");
                }
                add(ScriptTokenType.OR_OR);
            }
            case '"', '\'' -> string(c);
            default -> {
                if (Character.isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void number() {
        while (Character.isDigit(peek())) advance();
        if (peek() == '.' && Character.isDigit(peekNext())) {
            advance();
            while (Character.isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (Character.isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && Character.isDigit(peekAt(2))))) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (Character.isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        tokens.add(new ScriptToken(ScriptTokenType.NUMBER, text, Double.parseDouble(text), start));
    }

    private void string(char quote) throws EvaluationException {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (isAtEnd()) {
                break;
            }
            char escaped = advance();
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case 'b' -> value.append('\b');
                case 'f' -> value.append('\f');
                case '0' -> value.append('\0');
                case 'u' -> {
                    if (current + 4 > source.length()) {
                        throw error("Malformed unicode escape");
                    }
                    try {
                        value.append((char) Integer.parseInt(source.substring(current, current + 4), 16));
                    } catch (NumberFormatException e) {
                        throw error("Malformed unicode escape");
                    }
                    current += 4;
                }
                default -> value.append(escaped);
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        advance();
        tokens.add(new ScriptToken(ScriptTokenType.STRING, source.substring(start, current), value.toString(), start));
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        tokens.add(new ScriptToken(KEYWORDS.getOrDefault(text, ScriptTokenType.IDENTIFIER), text, null, start));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    private void add(ScriptTokenType type) {
        tokens.add(new ScriptToken(type, source.substring(start, current), null, start));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        return current + offset < source.length() ? source.charAt(current + offset) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private EvaluationException error(String message) {
        return new EvaluationException(message + " at offset " + start + " in '" + source + "'");
    }
}
