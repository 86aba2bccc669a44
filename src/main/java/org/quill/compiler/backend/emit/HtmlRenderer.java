package org.quill.compiler.backend.emit;

import org.quill.compiler.api.CompilationException;
import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.api.RenderException;
import org.quill.compiler.api.RenderMode;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.eval.IExpressionEvaluator;
import org.quill.compiler.eval.Scope;
import org.quill.compiler.eval.Value;
import org.quill.compiler.eval.VariableEnvironment;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.AttributeNode;
import org.quill.compiler.frontend.parser.ast.AttributeValue;
import org.quill.compiler.frontend.parser.ast.BlockNode;
import org.quill.compiler.frontend.parser.ast.CallerBlockNode;
import org.quill.compiler.frontend.parser.ast.CaseClause;
import org.quill.compiler.frontend.parser.ast.CaseNode;
import org.quill.compiler.frontend.parser.ast.CommentNode;
import org.quill.compiler.frontend.parser.ast.ConditionalBranch;
import org.quill.compiler.frontend.parser.ast.ConditionalNode;
import org.quill.compiler.frontend.parser.ast.DefaultNode;
import org.quill.compiler.frontend.parser.ast.DoctypeNode;
import org.quill.compiler.frontend.parser.ast.EachNode;
import org.quill.compiler.frontend.parser.ast.ElementNode;
import org.quill.compiler.frontend.parser.ast.MixinScopeNode;
import org.quill.compiler.frontend.parser.ast.ParameterBinding;
import org.quill.compiler.frontend.parser.ast.TextNode;
import org.quill.compiler.frontend.parser.ast.TextSegment;
import org.quill.compiler.frontend.parser.ast.WhenNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the expanded node list depth-first and writes HTML.
 * <p>
 * Compact and pretty output carry identical tags, attributes and text. Pretty output
 * starts every element, comment and doctype on a new line indented by its nesting
 * depth, and puts a closing tag on its own line when the element contained any of
 * those. Elements that only contain text therefore stay on one line.
 */
public class HtmlRenderer {

    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    private final IExpressionEvaluator evaluator;
    private final RenderMode mode;
    private final String indentUnit;

    private StringBuilder out;
    private boolean terse;
    private Scope rootScope;
    // scopes active at the mixin calls being rendered, innermost first
    private final Deque<Scope> callerScopes = new ArrayDeque<>();

    /**
     * @param evaluator The evaluator for embedded expressions.
     * @param mode The output formatting.
     * @param indentUnit The indentation of one level in pretty mode.
     */
    public HtmlRenderer(IExpressionEvaluator evaluator, RenderMode mode, String indentUnit) {
        this.evaluator = evaluator;
        this.mode = mode;
        this.indentUnit = indentUnit;
    }

    /**
     * Renders an expanded node list.
     * @param nodes The nodes, free of mixin, extends and include nodes.
     * @param environment The variables visible to expressions.
     * @return The HTML.
     * @throws CompilationException if an expression fails or the tree cannot be rendered.
     */
    public String render(List<AstNode> nodes, VariableEnvironment environment) throws CompilationException {
        out = new StringBuilder();
        terse = true;
        rootScope = Scope.root(environment);
        callerScopes.clear();
        renderNodes(nodes, rootScope, 0);
        return out.toString();
    }

    /**
     * @return Whether any element, comment or doctype was written.
     */
    private boolean renderNodes(List<AstNode> nodes, Scope scope, int depth) throws CompilationException {
        boolean structural = false;
        for (AstNode node : nodes) {
            structural |= renderNode(node, scope, depth);
        }
        return structural;
    }

    private boolean renderNode(AstNode node, Scope scope, int depth) throws CompilationException {
        if (node instanceof ElementNode element) {
            renderElement(element, scope, depth);
            return true;
        }
        if (node instanceof TextNode text) {
            renderText(text, scope);
            return false;
        }
        if (node instanceof ConditionalNode conditional) {
            return renderConditional(conditional, scope, depth);
        }
        if (node instanceof EachNode each) {
            return renderEach(each, scope, depth);
        }
        if (node instanceof CaseNode caseNode) {
            return renderCase(caseNode, scope, depth);
        }
        if (node instanceof BlockNode block) {
            return renderNodes(block.content(), scope, depth);
        }
        if (node instanceof MixinScopeNode mixinScope) {
            return renderMixinScope(mixinScope, scope, depth);
        }
        if (node instanceof CallerBlockNode callerBlock) {
            return renderCallerBlock(callerBlock, depth);
        }
        if (node instanceof CommentNode comment) {
            if (!comment.visible()) {
                return false;
            }
            newline(depth);
            out.append("<!--").append(comment.text()).append("-->");
            return true;
        }
        if (node instanceof DoctypeNode doctype) {
            terse = Doctypes.isTerse(doctype.kind());
            newline(depth);
            out.append(Doctypes.literal(doctype.kind()));
            return true;
        }
        throw new RenderException(CompilerErrorCode.UNEXPANDED_NODE,
                node.getClass().getSimpleName() + " must be resolved before rendering", node.source());
    }

    private void renderElement(ElementNode element, Scope scope, int depth) throws CompilationException {
        newline(depth);
        out.append('<').append(element.name());
        renderAttributes(element, scope);
        boolean isVoid = element.selfClosing() || VOID_ELEMENTS.contains(element.name().toLowerCase(Locale.ROOT));
        if (isVoid) {
            if (!element.children().isEmpty()) {
                throw new RenderException(CompilerErrorCode.INVALID_VOID_CONTENT,
                        "<" + element.name() + "> is a void element and cannot have content", element.source());
            }
            out.append(element.selfClosing() || !terse ? "/>" : ">");
            return;
        }
        out.append('>');
        if (renderNodes(element.children(), scope, depth + 1)) {
            newline(depth);
        }
        out.append("</").append(element.name()).append('>');
    }

    private void renderAttributes(ElementNode element, Scope scope) throws CompilationException {
        String id = element.id() != null ? HtmlEscaper.escape(element.id()) : null;
        Set<String> classes = new LinkedHashSet<>(element.classes());
        StringBuilder others = new StringBuilder();
        for (AttributeNode attribute : element.attributes()) {
            if (attribute.value() instanceof AttributeValue.Interpolated interpolated
                    && !attribute.name().equals("class")) {
                String text = interpolatedText(interpolated, scope, attribute.escaped());
                if (attribute.name().equals("id")) {
                    id = text;
                } else {
                    others.append(' ').append(attribute.name()).append("=\"").append(text).append('"');
                }
                continue;
            }
            Value value = attributeValue(attribute, scope);
            if (attribute.name().equals("class")) {
                addClasses(value, classes, attribute.source());
            } else if (attribute.name().equals("id")) {
                if (rendersValue(value)) {
                    String text = text(value, attribute.source());
                    id = attribute.escaped() ? HtmlEscaper.escape(text) : text;
                }
            } else {
                appendAttribute(others, attribute, value);
            }
        }
        if (id != null) {
            out.append(" id=\"").append(id).append('"');
        }
        if (!classes.isEmpty()) {
            out.append(" class=\"").append(HtmlEscaper.escape(String.join(" ", classes))).append('"');
        }
        out.append(others);
    }

    private void appendAttribute(StringBuilder sb, AttributeNode attribute, Value value) throws EvaluationException {
        if (!rendersValue(value)) {
            return;
        }
        String name = attribute.name();
        if (value instanceof Value.Bool) {
            sb.append(' ').append(name);
            if (!terse) {
                sb.append("=\"").append(name).append('"');
            }
            return;
        }
        String text = name.equals("style") && value instanceof Value.MapVal map
                ? styleText(map, attribute.source())
                : text(value, attribute.source());
        sb.append(' ').append(name).append("=\"")
                .append(attribute.escaped() ? HtmlEscaper.escape(text) : text)
                .append('"');
    }

    private Value attributeValue(AttributeNode attribute, Scope scope) throws CompilationException {
        AttributeValue value = attribute.value();
        if (value instanceof AttributeValue.Flag) {
            return Value.TRUE;
        }
        if (value instanceof AttributeValue.Expression expression) {
            return evaluate(expression.expression(), scope, attribute.source());
        }
        StringBuilder sb = new StringBuilder();
        for (TextSegment segment : ((AttributeValue.Interpolated) value).segments()) {
            if (segment instanceof TextSegment.Literal literal) {
                sb.append(literal.text());
            } else {
                TextSegment.ExpressionSpan span = (TextSegment.ExpressionSpan) segment;
                sb.append(text(evaluate(span.expression(), scope, span.source()), span.source()));
            }
        }
        return Value.of(sb.toString());
    }

    /**
     * Builds a quoted attribute value with {@code #{}} and {@code !{}} spans. When the
     * attribute is escaped, literals and {@code #{}} spans are escaped and {@code !{}}
     * spans are written as they are.
     */
    private String interpolatedText(AttributeValue.Interpolated value, Scope scope, boolean escaped)
            throws CompilationException {
        StringBuilder sb = new StringBuilder();
        for (TextSegment segment : value.segments()) {
            if (segment instanceof TextSegment.Literal literal) {
                sb.append(escaped ? HtmlEscaper.escape(literal.text()) : literal.text());
            } else {
                TextSegment.ExpressionSpan span = (TextSegment.ExpressionSpan) segment;
                String text = text(evaluate(span.expression(), scope, span.source()), span.source());
                sb.append(escaped && span.escaped() ? HtmlEscaper.escape(text) : text);
            }
        }
        return sb.toString();
    }

    private void addClasses(Value value, Set<String> classes, SourceInfo source) throws EvaluationException {
        if (value instanceof Value.Str str) {
            for (String name : str.value().trim().split("\\s+")) {
                if (!name.isEmpty()) {
                    classes.add(name);
                }
            }
        } else if (value instanceof Value.ListVal list) {
            for (Value element : list.elements()) {
                addClasses(element, classes, source);
            }
        } else if (value instanceof Value.MapVal map) {
            for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
                if (entry.getValue().isTruthy()) {
                    classes.add(entry.getKey());
                }
            }
        } else if (rendersValue(value)) {
            classes.add(text(value, source));
        }
    }

    private String styleText(Value.MapVal map, SourceInfo source) throws EvaluationException {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
            if (rendersValue(entry.getValue())) {
                sb.append(entry.getKey()).append(':').append(text(entry.getValue(), source)).append(';');
            }
        }
        return sb.toString();
    }

    private void renderText(TextNode node, Scope scope) throws CompilationException {
        for (TextSegment segment : node.segments()) {
            if (segment instanceof TextSegment.Literal literal) {
                out.append(node.escaped() ? HtmlEscaper.escape(literal.text()) : literal.text());
            } else {
                TextSegment.ExpressionSpan span = (TextSegment.ExpressionSpan) segment;
                String text = text(evaluate(span.expression(), scope, span.source()), span.source());
                out.append(span.escaped() ? HtmlEscaper.escape(text) : text);
            }
        }
    }

    private boolean renderConditional(ConditionalNode conditional, Scope scope, int depth) throws CompilationException {
        for (ConditionalBranch branch : conditional.branches()) {
            boolean truthy = evaluate(branch.predicate(), scope, branch.source()).isTruthy();
            if (truthy != branch.negated()) {
                return renderNodes(branch.body(), scope, depth);
            }
        }
        return conditional.elseBody() != null && renderNodes(conditional.elseBody(), scope, depth);
    }

    private boolean renderEach(EachNode each, Scope scope, int depth) throws CompilationException {
        Value iterable = evaluate(each.iterableExpr(), scope, each.source());
        List<Value[]> entries = new ArrayList<>();
        if (iterable instanceof Value.ListVal list) {
            for (int i = 0; i < list.elements().size(); i++) {
                entries.add(new Value[]{list.elements().get(i), Value.of((double) i)});
            }
        } else if (iterable instanceof Value.MapVal map) {
            for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
                entries.add(new Value[]{entry.getValue(), Value.of(entry.getKey())});
            }
        } else if (!iterable.isNull()) {
            throw new EvaluationException(CompilerErrorCode.NOT_ITERABLE,
                    "Cannot iterate over a " + iterable.typeName() + " value of '" + each.iterableExpr() + "'",
                    each.source(), null);
        }
        if (entries.isEmpty()) {
            return each.elseBody() != null && renderNodes(each.elseBody(), scope, depth);
        }
        boolean structural = false;
        for (Value[] entry : entries) {
            Scope iteration = scope.child();
            iteration.bind(each.itemVar(), entry[0]);
            if (each.indexVar() != null) {
                iteration.bind(each.indexVar(), entry[1]);
            }
            structural |= renderNodes(each.body(), iteration, depth);
        }
        return structural;
    }

    private boolean renderCase(CaseNode caseNode, Scope scope, int depth) throws CompilationException {
        Value subject = evaluate(caseNode.subject(), scope, caseNode.source());
        List<CaseClause> clauses = caseNode.clauses();
        int matched = -1;
        int fallback = -1;
        for (int i = 0; i < clauses.size() && matched < 0; i++) {
            CaseClause clause = clauses.get(i);
            if (clause instanceof DefaultNode) {
                if (fallback < 0) {
                    fallback = i;
                }
                continue;
            }
            for (String candidate : ((WhenNode) clause).values()) {
                if (strictEquals(subject, evaluate(candidate, scope, clause.source()))) {
                    matched = i;
                    break;
                }
            }
        }
        int start = matched >= 0 ? matched : fallback;
        if (start < 0) {
            return false;
        }
        for (int i = start; i < clauses.size(); i++) {
            if (!clauses.get(i).body().isEmpty()) {
                return renderNodes(clauses.get(i).body(), scope, depth);
            }
        }
        return false;
    }

    /**
     * Binds the parameters of one expansion in a scope of its own below the root scope, so
     * neither the caller's bindings nor those of an enclosing expansion are visible.
     */
    private boolean renderMixinScope(MixinScopeNode mixinScope, Scope caller, int depth) throws CompilationException {
        Scope scope = rootScope.child();
        for (ParameterBinding binding : mixinScope.bindings()) {
            Value value;
            switch (binding.kind()) {
                case ARGUMENT:
                    value = evaluate(binding.expressions().get(0), caller, mixinScope.source());
                    break;
                case DEFAULT:
                    value = evaluate(binding.expressions().get(0), scope, mixinScope.source());
                    break;
                case REST:
                    List<Value> rest = new ArrayList<>();
                    for (String expression : binding.expressions()) {
                        rest.add(evaluate(expression, caller, mixinScope.source()));
                    }
                    value = new Value.ListVal(rest);
                    break;
                default:
                    value = Value.NULL;
            }
            scope.bind(binding.name(), value);
        }
        callerScopes.push(caller);
        try {
            return renderNodes(mixinScope.body(), scope, depth);
        } finally {
            callerScopes.pop();
        }
    }

    private boolean renderCallerBlock(CallerBlockNode callerBlock, int depth) throws CompilationException {
        if (callerScopes.isEmpty()) {
            throw new RenderException(CompilerErrorCode.UNEXPANDED_NODE,
                    "Mixin block content outside of a mixin expansion", callerBlock.source());
        }
        // the content may itself hold the block of an enclosing call, which belongs to the next scope out
        Scope caller = callerScopes.pop();
        try {
            return renderNodes(callerBlock.content(), caller, depth);
        } finally {
            callerScopes.push(caller);
        }
    }

    private Value evaluate(String expression, Scope scope, SourceInfo source) throws EvaluationException {
        try {
            Value value = evaluator.evaluate(expression, scope);
            return value != null ? value : Value.NULL;
        } catch (EvaluationException e) {
            if (e.getSourceInfo() != null) {
                throw e;
            }
            throw new EvaluationException(e.getErrorCode(),
                    "Cannot evaluate '" + expression + "': " + e.getMessage(), source, e);
        } catch (RuntimeException e) {
            throw new EvaluationException(CompilerErrorCode.EXPRESSION_FAILED,
                    "Cannot evaluate '" + expression + "': " + e.getMessage(), source, e);
        }
    }

    private static String text(Value value, SourceInfo source) throws EvaluationException {
        try {
            return value.asText();
        } catch (EvaluationException e) {
            throw new EvaluationException(e.getErrorCode(), e.getMessage(), source, e);
        }
    }

    private static boolean rendersValue(Value value) {
        return !value.isNull() && !(value instanceof Value.Bool b && !b.value());
    }

    private static boolean strictEquals(Value left, Value right) {
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            return a.value() == b.value();
        }
        return left.equals(right);
    }

    private void newline(int depth) {
        if (mode == RenderMode.PRETTY && out.length() > 0) {
            out.append('\n').append(indentUnit.repeat(depth));
        }
    }
}
