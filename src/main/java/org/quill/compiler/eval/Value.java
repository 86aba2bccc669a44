package org.quill.compiler.eval;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.EvaluationException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tagged value union that crosses the evaluator boundary. It is the only data type
 * the renderer consumes, so conversion, truthiness and stringification are defined here
 * once instead of on untyped objects.
 */
public sealed interface Value permits Value.Null, Value.Bool, Value.Num, Value.Str, Value.ListVal, Value.MapVal {

    /** The null/undefined value. */
    Value NULL = new Null();
    /** Boolean true. */
    Value TRUE = new Bool(true);
    /** Boolean false. */
    Value FALSE = new Bool(false);

    /**
     * Represents null and undefined.
     */
    record Null() implements Value {}

    /**
     * Represents a boolean.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements Value {}

    /**
     * Represents a number. All numbers are doubles, as in the expression languages this
     * boundary is designed for.
     * @param value The numeric value.
     */
    record Num(double value) implements Value {}

    /**
     * Represents a string.
     * @param value The string value, never null.
     */
    record Str(String value) implements Value {}

    /**
     * Represents a list of values.
     * @param elements The elements in index order.
     */
    record ListVal(List<Value> elements) implements Value {
        public ListVal {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    /**
     * Represents a map of string keys to values, iterated in insertion order.
     * @param entries The entries.
     */
    record MapVal(Map<String, Value> entries) implements Value {
        public MapVal {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(double value) {
        return new Num(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new Str(value);
    }

    /**
     * Converts plain Java data into a value. Maps become {@link MapVal} (keys via
     * {@code toString()}), iterables and arrays become {@link ListVal}, numbers,
     * booleans and char sequences their scalar counterparts. Anything else is
     * converted through its {@code toString()}.
     *
     * @param object The object to convert, may be null.
     * @return The converted value.
     */
    static Value of(Object object) {
        if (object == null) return NULL;
        if (object instanceof Value value) return value;
        if (object instanceof Boolean b) return of(b.booleanValue());
        if (object instanceof Number n) return new Num(n.doubleValue());
        if (object instanceof CharSequence s) return new Str(s.toString());
        if (object instanceof Character c) return new Str(String.valueOf(c));
        if (object instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
            return new MapVal(entries);
        }
        if (object instanceof Iterable<?> iterable) {
            List<Value> elements = new ArrayList<>();
            iterable.forEach(e -> elements.add(of(e)));
            return new ListVal(elements);
        }
        if (object.getClass().isArray()) {
            List<Value> elements = new ArrayList<>();
            for (int i = 0; i < Array.getLength(object); i++) {
                elements.add(of(Array.get(object, i)));
            }
            return new ListVal(elements);
        }
        return new Str(object.toString());
    }

    /**
     * Truthiness: {@code false}, null, {@code 0}, {@code NaN}, the empty string, the empty
     * list and the empty map are falsy, everything else is truthy.
     *
     * @return Whether this value counts as true in a condition.
     */
    default boolean isTruthy() {
        if (this instanceof Null) return false;
        if (this instanceof Bool b) return b.value();
        if (this instanceof Num n) return n.value() != 0 && !Double.isNaN(n.value());
        if (this instanceof Str s) return !s.value().isEmpty();
        if (this instanceof ListVal l) return !l.elements().isEmpty();
        return !((MapVal) this).entries().isEmpty();
    }

    /**
     * @return Whether this value is null/undefined.
     */
    default boolean isNull() {
        return this instanceof Null;
    }

    /**
     * Text-interpolation stringification. Lists and maps have no default text form.
     *
     * @return The canonical text of this value; the empty string for null.
     * @throws EvaluationException for lists and maps.
     */
    default String asText() throws EvaluationException {
        if (this instanceof Null) return "";
        if (this instanceof Bool b) return Boolean.toString(b.value());
        if (this instanceof Num n) return formatNumber(n.value());
        if (this instanceof Str s) return s.value();
        throw new EvaluationException(CompilerErrorCode.UNPRINTABLE_VALUE,
                "A " + typeName() + " value has no text form in this context");
    }

    /**
     * @return A short name of the variant, used in messages.
     */
    default String typeName() {
        if (this instanceof Null) return "null";
        if (this instanceof Bool) return "boolean";
        if (this instanceof Num) return "number";
        if (this instanceof Str) return "string";
        if (this instanceof ListVal) return "list";
        return "map";
    }

    /**
     * Formats a number the way script engines print them: integral values without a
     * fractional part, {@code NaN}, {@code Infinity}, plain notation between 1e-6 and 1e21
     * and exponent notation outside of it.
     *
     * @param value The number.
     * @return The canonical text.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        if (value == 0) return "0";
        double abs = Math.abs(value);
        if (abs >= 1e-6 && abs < 1e21) {
            BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
            return decimal.toPlainString();
        }
        String text = Double.toString(value);
        int e = text.indexOf('E');
        String mantissa = text.substring(0, e);
        String exponent = text.substring(e + 1);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }
}
