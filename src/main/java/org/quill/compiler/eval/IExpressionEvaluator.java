package org.quill.compiler.eval;

import org.quill.compiler.api.EvaluationException;

/**
 * The single capability the renderer needs from an embedded expression language.
 * Implementations may interpret, restrict or pre-compile expressions; they must be
 * safe to use from concurrent compiles.
 */
@FunctionalInterface
public interface IExpressionEvaluator {

    /**
     * Evaluates one expression.
     *
     * @param expression The expression source as written in the template.
     * @param scope The bindings visible at the point of evaluation.
     * @return The resulting value, never null.
     * @throws EvaluationException if the expression cannot be evaluated.
     */
    Value evaluate(String expression, Scope scope) throws EvaluationException;
}
