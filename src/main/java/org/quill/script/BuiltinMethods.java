package org.quill.script;

import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.eval.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * The string and list methods an expression may call. Everything else is rejected.
 */
final class BuiltinMethods {

    private BuiltinMethods() {}

    static Value invoke(Value target, String method, List<Value> arguments) throws EvaluationException {
        if (target instanceof Value.Str str) {
            return stringMethod(str.value(), method, arguments);
        }
        if (target instanceof Value.ListVal list) {
            return listMethod(list.elements(), method, arguments);
        }
        throw unsupported(target, method);
    }

    private static Value stringMethod(String text, String method, List<Value> args) throws EvaluationException {
        switch (method) {
            case "toUpperCase":
                return Value.of(text.toUpperCase());
            case "toLowerCase":
                return Value.of(text.toLowerCase());
            case "trim":
                return Value.of(text.trim());
            case "includes":
                return Value.of(text.contains(textArg(args, 0)));
            case "startsWith":
                return Value.of(text.startsWith(textArg(args, 0)));
            case "endsWith":
                return Value.of(text.endsWith(textArg(args, 0)));
            case "indexOf":
                return Value.of((double) text.indexOf(textArg(args, 0)));
            case "charAt": {
                int index = (int) numberArg(args, 0, 0);
                return Value.of(index >= 0 && index < text.length() ? String.valueOf(text.charAt(index)) : "");
            }
            case "slice": {
                int[] range = sliceRange(text.length(), args);
                return Value.of(text.substring(range[0], range[1]));
            }
            case "substring": {
                int from = clamp(numberArg(args, 0, 0), text.length());
                int to = clamp(numberArg(args, 1, text.length()), text.length());
                return Value.of(text.substring(Math.min(from, to), Math.max(from, to)));
            }
            case "split": {
                List<Value> parts = new ArrayList<>();
                if (args.isEmpty() || args.get(0).isNull()) {
                    parts.add(Value.of(text));
                } else {
                    String separator = textArg(args, 0);
                    if (separator.isEmpty()) {
                        for (char c : text.toCharArray()) {
                            parts.add(Value.of(String.valueOf(c)));
                        }
                    } else {
                        int from = 0;
                        int at;
                        while ((at = text.indexOf(separator, from)) >= 0) {
                            parts.add(Value.of(text.substring(from, at)));
                            from = at + separator.length();
                        }
                        parts.add(Value.of(text.substring(from)));
                    }
                }
                return new Value.ListVal(parts);
            }
            case "replace": {
                String search = textArg(args, 0);
                int at = text.indexOf(search);
                if (at < 0) {
                    return Value.of(text);
                }
                return Value.of(text.substring(0, at) + textArg(args, 1) + text.substring(at + search.length()));
            }
            case "repeat": {
                double count = numberArg(args, 0, 0);
                if (count < 0 || Double.isInfinite(count)) {
                    throw new EvaluationException("Invalid repeat count " + Value.formatNumber(count));
                }
                return Value.of(text.repeat((int) count));
            }
            default:
                throw unsupported(Value.of(text), method);
        }
    }

    private static Value listMethod(List<Value> elements, String method, List<Value> args) throws EvaluationException {
        switch (method) {
            case "join": {
                String separator = args.isEmpty() || args.get(0).isNull() ? "," : textArg(args, 0);
                List<String> parts = new ArrayList<>();
                for (Value element : elements) {
                    parts.add(element.isNull() ? "" : ScriptInterpreter.toText(element));
                }
                return Value.of(String.join(separator, parts));
            }
            case "includes":
                return Value.of(indexOf(elements, args) >= 0);
            case "indexOf":
                return Value.of((double) indexOf(elements, args));
            case "slice": {
                int[] range = sliceRange(elements.size(), args);
                return new Value.ListVal(elements.subList(range[0], range[1]));
            }
            default:
                throw unsupported(new Value.ListVal(elements), method);
        }
    }

    private static int indexOf(List<Value> elements, List<Value> args) {
        Value needle = args.isEmpty() ? Value.NULL : args.get(0);
        for (int i = 0; i < elements.size(); i++) {
            if (ScriptInterpreter.strictEquals(elements.get(i), needle)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Negative positions count from the end.
     */
    private static int[] sliceRange(int length, List<Value> args) {
        int from = relative(numberArg(args, 0, 0), length);
        int to = relative(numberArg(args, 1, length), length);
        return new int[]{from, Math.max(from, to)};
    }

    private static int relative(double position, int length) {
        if (Double.isNaN(position)) return 0;
        double resolved = position < 0 ? length + position : position;
        return (int) Math.max(0, Math.min(length, resolved));
    }

    private static int clamp(double position, int length) {
        if (Double.isNaN(position)) return 0;
        return (int) Math.max(0, Math.min(length, position));
    }

    private static String textArg(List<Value> args, int index) {
        return index < args.size() ? ScriptInterpreter.toText(args.get(index)) : "undefined";
    }

    private static double numberArg(List<Value> args, int index, double fallback) {
        if (index >= args.size() || args.get(index).isNull()) {
            return fallback;
        }
        double value = ScriptInterpreter.toNumber(args.get(index));
        if (Double.isNaN(value)) {
            return 0;
        }
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static EvaluationException unsupported(Value target, String method) {
        return new EvaluationException("Method '" + method + "' is not available on a " + target.typeName() + " value");
    }
}
