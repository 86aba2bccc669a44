package org.quill.script;

import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.eval.IExpressionEvaluator;
import org.quill.compiler.eval.Scope;
import org.quill.compiler.eval.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A restricted, side-effect free expression evaluator with JavaScript-like syntax.
 * <p>
 * Supported: number, string, boolean, null and undefined literals; variables;
 * member, optional member and index access; array and object literals; the unary
 * operators {@code ! - + typeof}; arithmetic, comparison, equality, logical, nullish
 * and conditional operators; and the string methods {@code toUpperCase toLowerCase
 * trim includes startsWith endsWith indexOf charAt slice substring split replace
 * repeat} and list methods {@code join includes indexOf slice}.
 * <p>
 * Parsed expressions are kept in a least-recently-used cache, so an instance is best
 * shared between compiles. It is thread-safe.
 */
public class ScriptEvaluator implements IExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ScriptEvaluator.class);

    /** The capacity used when none is configured; matches {@code quill.script.parse-cache-max-entries}. */
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 1024;

    private final Map<String, ScriptNode> parsed;
    private final ScriptInterpreter interpreter = new ScriptInterpreter();

    public ScriptEvaluator() {
        this(DEFAULT_CACHE_MAX_ENTRIES);
    }

    /**
     * @param cacheMaxEntries The maximum number of cached expression trees; 0 disables the cache.
     */
    public ScriptEvaluator(int cacheMaxEntries) {
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cacheMaxEntries must not be negative, was " + cacheMaxEntries);
        }
        this.parsed = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ScriptNode> eldest) {
                return size() > cacheMaxEntries;
            }
        };
    }

    @Override
    public Value evaluate(String expression, Scope scope) throws EvaluationException {
        return interpreter.evaluate(parse(expression), scope);
    }

    /**
     * Parses an expression, or returns the cached tree.
     * @param expression The expression text.
     * @return The tree.
     * @throws EvaluationException on a syntax error.
     */
    public ScriptNode parse(String expression) throws EvaluationException {
        synchronized (parsed) {
            ScriptNode cached = parsed.get(expression);
            if (cached != null) {
                return cached;
            }
        }
        ScriptNode node = new ScriptParser(new ScriptLexer(expression).scanTokens(), expression).parse();
        log.debug("Parsed expression '{}'", expression);
        synchronized (parsed) {
            parsed.put(expression, node);
        }
        return node;
    }

    /**
     * @return The number of cached expression trees.
     */
    public int cacheSize() {
        synchronized (parsed) {
            return parsed.size();
        }
    }
}
