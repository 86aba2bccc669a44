package org.quill.script;

import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.eval.Scope;
import org.quill.compiler.eval.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates expression trees against a {@link Scope}.
 * <p>
 * Semantics follow the script languages templates are usually written against:
 * {@code +} concatenates as soon as one operand is a string, {@code &&}, {@code ||} and
 * {@code ??} return one of their operands, and unknown names evaluate to null. Reading a
 * property of null fails unless the access is optional. Only a fixed set of string and
 * list methods can be called.
 */
public class ScriptInterpreter {

    /**
     * Evaluates a node.
     * @param node The node.
     * @param scope The bindings visible to the expression.
     * @return The value.
     * @throws EvaluationException if an operation is not defined for its operands.
     */
    public Value evaluate(ScriptNode node, Scope scope) throws EvaluationException {
        if (node instanceof ScriptNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof ScriptNode.Variable variable) {
            return scope.lookup(variable.name()).orElse(Value.NULL);
        }
        if (node instanceof ScriptNode.Member member) {
            Value target = evaluate(member.target(), scope);
            if (target.isNull()) {
                if (member.optional()) return Value.NULL;
                throw new EvaluationException("Cannot read property '" + member.name() + "' of null");
            }
            return property(target, member.name());
        }
        if (node instanceof ScriptNode.Index index) {
            Value target = evaluate(index.target(), scope);
            if (target.isNull()) {
                if (index.optional()) return Value.NULL;
                throw new EvaluationException("Cannot index null");
            }
            return element(target, evaluate(index.index(), scope));
        }
        if (node instanceof ScriptNode.Call call) {
            Value target = evaluate(call.target(), scope);
            if (target.isNull()) {
                if (call.optional()) return Value.NULL;
                throw new EvaluationException("Cannot call '" + call.method() + "' on null");
            }
            List<Value> arguments = new ArrayList<>();
            for (ScriptNode argument : call.arguments()) {
                arguments.add(evaluate(argument, scope));
            }
            return BuiltinMethods.invoke(target, call.method(), arguments);
        }
        if (node instanceof ScriptNode.ArrayLiteral array) {
            List<Value> elements = new ArrayList<>();
            for (ScriptNode element : array.elements()) {
                elements.add(evaluate(element, scope));
            }
            return new Value.ListVal(elements);
        }
        if (node instanceof ScriptNode.ObjectLiteral object) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<String, ScriptNode> entry : object.entries().entrySet()) {
                entries.put(entry.getKey(), evaluate(entry.getValue(), scope));
            }
            return new Value.MapVal(entries);
        }
        if (node instanceof ScriptNode.Unary unary) {
            return unary(unary.operator(), evaluate(unary.operand(), scope));
        }
        if (node instanceof ScriptNode.Binary binary) {
            return binary(binary.operator(), evaluate(binary.left(), scope), evaluate(binary.right(), scope));
        }
        if (node instanceof ScriptNode.Logical logical) {
            Value left = evaluate(logical.left(), scope);
            switch (logical.operator()) {
                case AND_AND:
                    return left.isTruthy() ? evaluate(logical.right(), scope) : left;
                case OR_OR:
                    return left.isTruthy() ? left : evaluate(logical.right(), scope);
                default:
                    return left.isNull() ? evaluate(logical.right(), scope) : left;
            }
        }
        ScriptNode.Conditional conditional = (ScriptNode.Conditional) node;
        return evaluate(conditional.condition(), scope).isTruthy()
                ? evaluate(conditional.whenTrue(), scope)
                : evaluate(conditional.whenFalse(), scope);
    }

    private static Value property(Value target, String name) {
        if (target instanceof Value.MapVal map) {
            return map.entries().getOrDefault(name, Value.NULL);
        }
        if (name.equals("length")) {
            if (target instanceof Value.Str str) return Value.of((double) str.value().length());
            if (target instanceof Value.ListVal list) return Value.of((double) list.elements().size());
        }
        return Value.NULL;
    }

    private static Value element(Value target, Value index) throws EvaluationException {
        if (target instanceof Value.MapVal map) {
            return map.entries().getOrDefault(toText(index), Value.NULL);
        }
        if (!(index instanceof Value.Num)) {
            return property(target, toText(index));
        }
        double position = ((Value.Num) index).value();
        if (position != Math.floor(position) || position < 0) {
            return Value.NULL;
        }
        if (target instanceof Value.ListVal list) {
            return position < list.elements().size() ? list.elements().get((int) position) : Value.NULL;
        }
        if (target instanceof Value.Str str) {
            return position < str.value().length()
                    ? Value.of(String.valueOf(str.value().charAt((int) position)))
                    : Value.NULL;
        }
        return Value.NULL;
    }

    private static Value unary(ScriptTokenType operator, Value operand) {
        switch (operator) {
            case BANG:
                return Value.of(!operand.isTruthy());
            case MINUS:
                return Value.of(-toNumber(operand));
            case PLUS:
                return Value.of(toNumber(operand));
            default:
                return Value.of(typeOf(operand));
        }
    }

    private static Value binary(ScriptTokenType operator, Value left, Value right) throws EvaluationException {
        switch (operator) {
            case PLUS:
                if (left instanceof Value.Str || right instanceof Value.Str
                        || left instanceof Value.ListVal || right instanceof Value.ListVal
                        || left instanceof Value.MapVal || right instanceof Value.MapVal) {
                    return Value.of(toText(left) + toText(right));
                }
                return Value.of(toNumber(left) + toNumber(right));
            case MINUS:
                return Value.of(toNumber(left) - toNumber(right));
            case STAR:
                return Value.of(toNumber(left) * toNumber(right));
            case SLASH:
                return Value.of(toNumber(left) / toNumber(right));
            case PERCENT:
                return Value.of(toNumber(left) % toNumber(right));
            case EQUAL_EQUAL_EQUAL:
                return Value.of(strictEquals(left, right));
            case BANG_EQUAL_EQUAL:
                return Value.of(!strictEquals(left, right));
            case EQUAL_EQUAL:
                return Value.of(looseEquals(left, right));
            case BANG_EQUAL:
                return Value.of(!looseEquals(left, right));
            default:
                return Value.of(compare(operator, left, right));
        }
    }

    private static boolean compare(ScriptTokenType operator, Value left, Value right) {
        int order;
        if (left instanceof Value.Str a && right instanceof Value.Str b) {
            order = a.value().compareTo(b.value());
        } else {
            double a = toNumber(left);
            double b = toNumber(right);
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return false;
            }
            order = Double.compare(a, b);
            if (a == b) {
                order = 0;
            }
        }
        switch (operator) {
            case LESS:
                return order < 0;
            case LESS_EQUAL:
                return order <= 0;
            case GREATER:
                return order > 0;
            default:
                return order >= 0;
        }
    }

    static boolean strictEquals(Value left, Value right) {
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            return a.value() == b.value();
        }
        if (left instanceof Value.ListVal || left instanceof Value.MapVal) {
            return left == right;
        }
        return left.equals(right);
    }

    private static boolean looseEquals(Value left, Value right) {
        if (left.getClass() == right.getClass() || left.isNull() || right.isNull()) {
            return strictEquals(left, right);
        }
        if (left instanceof Value.ListVal || left instanceof Value.MapVal
                || right instanceof Value.ListVal || right instanceof Value.MapVal) {
            return false;
        }
        return toNumber(left) == toNumber(right);
    }

    /**
     * Numeric conversion: null is NaN, booleans are 0 and 1, strings are parsed after
     * trimming (the empty string is 0).
     */
    static double toNumber(Value value) {
        if (value instanceof Value.Num num) return num.value();
        if (value instanceof Value.Bool bool) return bool.value() ? 1 : 0;
        if (value instanceof Value.Str str) {
            String text = str.value().trim();
            if (text.isEmpty()) return 0;
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * String conversion for concatenation, where lists join their elements with commas.
     */
    static String toText(Value value) {
        if (value instanceof Value.ListVal list) {
            List<String> parts = new ArrayList<>();
            for (Value element : list.elements()) {
                parts.add(element.isNull() ? "" : toText(element));
            }
            return String.join(",", parts);
        }
        if (value instanceof Value.MapVal) return "[object Object]";
        if (value instanceof Value.Null) return "null";
        if (value instanceof Value.Num num) return Value.formatNumber(num.value());
        if (value instanceof Value.Bool bool) return Boolean.toString(bool.value());
        return ((Value.Str) value).value();
    }

    private static String typeOf(Value value) {
        if (value instanceof Value.Null) return "undefined";
        if (value instanceof Value.Bool) return "boolean";
        if (value instanceof Value.Num) return "number";
        if (value instanceof Value.Str) return "string";
        return "object";
    }
}
