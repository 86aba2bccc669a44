package org.quill.compiler.frontend.parser.features.mixin;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.parser.ast.MixinParameter;
import org.quill.compiler.util.BalancedText;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses mixin signatures {@code name(p1, p2=default, ...rest)} and call argument lists.
 */
public final class MixinSignatures {

    private static final Pattern MIXIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    /**
     * A parsed signature.
     *
     * @param name The mixin name.
     * @param params The positional parameters.
     * @param restParam The rest parameter, or null.
     */
    public record Signature(String name, List<MixinParameter> params, String restParam) {}

    private MixinSignatures() {}

    /**
     * Parses the text after the {@code mixin} keyword.
     *
     * @param text The signature text.
     * @param source The position of the text.
     * @return The signature.
     * @throws TemplateSyntaxException if the signature is malformed.
     */
    public static Signature parseDefinition(String text, SourceInfo source) throws TemplateSyntaxException {
        int paren = text.indexOf('(');
        String name = (paren < 0 ? text : text.substring(0, paren)).trim();
        if (!MIXIN_NAME.matcher(name).matches()) {
            throw invalid("Invalid mixin name '" + name + "'", source);
        }
        List<MixinParameter> params = new ArrayList<>();
        String rest = null;
        if (paren >= 0) {
            int close = BalancedText.findClosing(text, paren + 1, ')');
            if (close < 0 || !text.substring(close + 1).isBlank()) {
                throw invalid("Malformed parameter list of mixin '" + name + "'", source);
            }
            Set<String> seen = new HashSet<>();
            for (String part : BalancedText.splitTopLevel(text.substring(paren + 1, close), ',')) {
                if (rest != null) {
                    throw invalid("The rest parameter must be the last parameter", source);
                }
                if (part.startsWith("...")) {
                    rest = parameterName(part.substring(3).trim(), seen, source);
                    continue;
                }
                int assignment = BalancedText.indexOfAssignment(part);
                String paramName = parameterName(assignment < 0 ? part : part.substring(0, assignment).trim(), seen, source);
                String defaultExpr = assignment < 0 ? null : part.substring(assignment + 1).trim();
                if (defaultExpr != null && defaultExpr.isEmpty()) {
                    throw invalid("Missing default value of parameter '" + paramName + "'", source);
                }
                params.add(new MixinParameter(paramName, defaultExpr));
            }
        }
        return new Signature(name, params, rest);
    }

    /**
     * Splits the text between the parentheses of a call into argument expressions.
     *
     * @param text The argument text.
     * @param source The position of the argument list.
     * @return The argument expressions.
     * @throws TemplateSyntaxException if an argument is empty.
     */
    public static List<String> parseArguments(String text, SourceInfo source) throws TemplateSyntaxException {
        List<String> args = BalancedText.splitTopLevel(text.replace('\n', ' '), ',');
        if (args.stream().anyMatch(String::isEmpty)) {
            throw invalid("Empty argument in mixin call", source);
        }
        return args;
    }

    private static String parameterName(String name, Set<String> seen, SourceInfo source) throws TemplateSyntaxException {
        if (!PARAMETER_NAME.matcher(name).matches()) {
            throw invalid("Invalid parameter name '" + name + "'", source);
        }
        if (!seen.add(name)) {
            throw invalid("Duplicate parameter '" + name + "'", source);
        }
        return name;
    }

    private static TemplateSyntaxException invalid(String message, SourceInfo source) {
        return new TemplateSyntaxException(CompilerErrorCode.INVALID_MIXIN_SIGNATURE, message, source,
                "'name(param, param=default, ...rest)'");
    }
}
