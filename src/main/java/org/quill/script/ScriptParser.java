package org.quill.script;

import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.eval.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for expressions. Precedence from loosest to tightest:
 * conditional, nullish, logical or, logical and, equality, relational, additive,
 * multiplicative, unary, member/index/call, primary.
 */
public class ScriptParser {

    private final List<ScriptToken> tokens;
    private final String source;
    private int current = 0;

    /**
     * @param tokens The tokens from {@link ScriptLexer}.
     * @param source The expression text, for messages.
     */
    public ScriptParser(List<ScriptToken> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    /**
     * Parses one complete expression.
     * @return The expression tree.
     * @throws EvaluationException if the tokens do not form exactly one expression.
     */
    public ScriptNode parse() throws EvaluationException {
        if (check(ScriptTokenType.END)) {
            throw error(peek(), "Expected an expression");
        }
        ScriptNode node = conditional();
        if (!check(ScriptTokenType.END)) {
            throw error(peek(), "Unexpected '" + peek().text() + "'");
        }
        return node;
    }

    private ScriptNode conditional() throws EvaluationException {
        ScriptNode condition = nullish();
        if (match(ScriptTokenType.QUESTION)) {
            ScriptNode whenTrue = conditional();
            consume(ScriptTokenType.COLON, "Expected ':' in conditional expression");
            ScriptNode whenFalse = conditional();
            return new ScriptNode.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private ScriptNode nullish() throws EvaluationException {
        ScriptNode left = or();
        while (match(ScriptTokenType.QUESTION_QUESTION)) {
            left = new ScriptNode.Logical(ScriptTokenType.QUESTION_QUESTION, left, or());
        }
        return left;
    }

    private ScriptNode or() throws EvaluationException {
        ScriptNode left = and();
        while (match(ScriptTokenType.OR_OR)) {
            left = new ScriptNode.Logical(ScriptTokenType.OR_OR, left, and());
        }
        return left;
    }

    private ScriptNode and() throws EvaluationException {
        ScriptNode left = equality();
        while (match(ScriptTokenType.AND_AND)) {
            left = new ScriptNode.Logical(ScriptTokenType.AND_AND, left, equality());
        }
        return left;
    }

    private ScriptNode equality() throws EvaluationException {
        ScriptNode left = relational();
        while (match(ScriptTokenType.EQUAL_EQUAL, ScriptTokenType.BANG_EQUAL,
                ScriptTokenType.EQUAL_EQUAL_EQUAL, ScriptTokenType.BANG_EQUAL_EQUAL)) {
            ScriptTokenType operator = previous().type();
            left = new ScriptNode.Binary(operator, left, relational());
        }
        return left;
    }

    private ScriptNode relational() throws EvaluationException {
        ScriptNode left = additive();
        while (match(ScriptTokenType.LESS, ScriptTokenType.LESS_EQUAL,
                ScriptTokenType.GREATER, ScriptTokenType.GREATER_EQUAL)) {
            ScriptTokenType operator = previous().type();
            left = new ScriptNode.Binary(operator, left, additive());
        }
        return left;
    }

    private ScriptNode additive() throws EvaluationException {
        ScriptNode left = multiplicative();
        while (match(ScriptTokenType.PLUS, ScriptTokenType.MINUS)) {
            ScriptTokenType operator = previous().type();
            left = new ScriptNode.Binary(operator, left, multiplicative());
        }
        return left;
    }

    private ScriptNode multiplicative() throws EvaluationException {
        ScriptNode left = unary();
        while (match(ScriptTokenType.STAR, ScriptTokenType.SLASH, ScriptTokenType.PERCENT)) {
            ScriptTokenType operator = previous().type();
            left = new ScriptNode.Binary(operator, left, unary());
        }
        return left;
    }

    private ScriptNode unary() throws EvaluationException {
        if (match(ScriptTokenType.BANG, ScriptTokenType.MINUS, ScriptTokenType.PLUS, ScriptTokenType.TYPEOF)) {
            ScriptTokenType operator = previous().type();
            return new ScriptNode.Unary(operator, unary());
        }
        return postfix();
    }

    private ScriptNode postfix() throws EvaluationException {
        ScriptNode node = primary();
        while (true) {
            if (match(ScriptTokenType.DOT)) {
                node = member(node, consume(ScriptTokenType.IDENTIFIER, "Expected a property name after '.'"), false);
            } else if (match(ScriptTokenType.QUESTION_DOT)) {
                if (match(ScriptTokenType.LEFT_BRACKET)) {
                    node = index(node, true);
                } else {
                    node = member(node, consume(ScriptTokenType.IDENTIFIER, "Expected a property name after '?.'"), true);
                }
            } else if (match(ScriptTokenType.LEFT_BRACKET)) {
                node = index(node, false);
            } else if (check(ScriptTokenType.LEFT_PAREN)) {
                throw error(peek(), "Only methods can be called");
            } else {
                return node;
            }
        }
    }

    private ScriptNode member(ScriptNode target, ScriptToken name, boolean optional) throws EvaluationException {
        if (match(ScriptTokenType.LEFT_PAREN)) {
            return new ScriptNode.Call(target, name.text(), arguments(ScriptTokenType.RIGHT_PAREN), optional);
        }
        return new ScriptNode.Member(target, name.text(), optional);
    }

    private ScriptNode index(ScriptNode target, boolean optional) throws EvaluationException {
        ScriptNode index = conditional();
        consume(ScriptTokenType.RIGHT_BRACKET, "Expected ']'");
        return new ScriptNode.Index(target, index, optional);
    }

    private List<ScriptNode> arguments(ScriptTokenType closing) throws EvaluationException {
        List<ScriptNode> arguments = new ArrayList<>();
        if (!check(closing)) {
            do {
                if (check(closing)) {
                    break;
                }
                arguments.add(conditional());
            } while (match(ScriptTokenType.COMMA));
        }
        consume(closing, "Expected '" + (closing == ScriptTokenType.RIGHT_PAREN ? ")" : "]") + "'");
        return arguments;
    }

    private ScriptNode primary() throws EvaluationException {
        ScriptToken token = advance();
        switch (token.type()) {
            case NUMBER:
                return new ScriptNode.Literal(Value.of(((Double) token.value()).doubleValue()));
            case STRING:
                return new ScriptNode.Literal(Value.of((String) token.value()));
            case TRUE:
                return new ScriptNode.Literal(Value.TRUE);
            case FALSE:
                return new ScriptNode.Literal(Value.FALSE);
            case NULL:
            case UNDEFINED:
                return new ScriptNode.Literal(Value.NULL);
            case IDENTIFIER:
                return new ScriptNode.Variable(token.text());
            case LEFT_PAREN: {
                ScriptNode inner = conditional();
                consume(ScriptTokenType.RIGHT_PAREN, "Expected ')'");
                return inner;
            }
            case LEFT_BRACKET:
                return new ScriptNode.ArrayLiteral(arguments(ScriptTokenType.RIGHT_BRACKET));
            case LEFT_BRACE:
                return objectLiteral();
            default:
                throw error(token, token.type() == ScriptTokenType.END
                        ? "Unexpected end of expression"
                        : "Unexpected '" + token.text() + "'");
        }
    }

    private ScriptNode objectLiteral() throws EvaluationException {
        Map<String, ScriptNode> entries = new LinkedHashMap<>();
        while (!check(ScriptTokenType.RIGHT_BRACE)) {
            ScriptToken key = advance();
            String name;
            if (key.type() == ScriptTokenType.STRING) {
                name = (String) key.value();
            } else if (key.type() == ScriptTokenType.NUMBER) {
                name = Value.formatNumber((Double) key.value());
            } else if (key.type() == ScriptTokenType.END) {
                throw error(key, "Expected '}'");
            } else if (!key.text().isEmpty() && Character.isLetter(key.text().charAt(0))) {
                name = key.text();
            } else {
                throw error(key, "Expected a property name");
            }
            if (match(ScriptTokenType.COLON)) {
                entries.put(name, conditional());
            } else if (key.type() == ScriptTokenType.IDENTIFIER) {
                entries.put(name, new ScriptNode.Variable(name));
            } else {
                throw error(peek(), "Expected ':' after property name");
            }
            if (!match(ScriptTokenType.COMMA)) {
                break;
            }
        }
        consume(ScriptTokenType.RIGHT_BRACE, "Expected '}'");
        return new ScriptNode.ObjectLiteral(entries);
    }

    private boolean match(ScriptTokenType... types) {
        for (ScriptTokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private ScriptToken consume(ScriptTokenType type, String message) throws EvaluationException {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(ScriptTokenType type) {
        return peek().type() == type;
    }

    private ScriptToken advance() {
        ScriptToken token = peek();
        if (token.type() != ScriptTokenType.END) current++;
        return token;
    }

    private ScriptToken peek() {
        return tokens.get(current);
    }

    private ScriptToken previous() {
        return tokens.get(current - 1);
    }

    private EvaluationException error(ScriptToken token, String message) {
        return new EvaluationException(message + " at offset " + token.position() + " in '" + source + "'");
    }
}
