package org.quill.compiler.backend.expand;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.ExpansionException;
import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.TreeWalker;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.BlockSlotNode;
import org.quill.compiler.frontend.parser.ast.CallerBlockNode;
import org.quill.compiler.frontend.parser.ast.MixinCallNode;
import org.quill.compiler.frontend.parser.ast.MixinDefNode;
import org.quill.compiler.frontend.parser.ast.MixinParameter;
import org.quill.compiler.frontend.parser.ast.MixinScopeNode;
import org.quill.compiler.frontend.parser.ast.ParameterBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inlines mixin calls.
 * <p>
 * The first pass hoists every mixin definition of the linked tree into a name map, so a
 * call may precede its definition. The second pass replaces each call by a
 * {@link MixinScopeNode} that carries the parameter bindings of that one expansion and
 * a copy of the definition's body, with every bare {@code block} replaced by a
 * {@link CallerBlockNode} holding the call's block content. Expansion is bounded by a
 * nesting limit, so recursive mixins fail instead of diverging.
 */
public class MixinExpander {

    private static final Logger log = LoggerFactory.getLogger(MixinExpander.class);

    private final int recursionLimit;
    private final DiagnosticsEngine diagnostics;
    private final Map<String, MixinDefNode> definitions = new HashMap<>();

    /**
     * @param recursionLimit The maximum nesting of mixin expansions.
     * @param diagnostics The engine for non-fatal diagnostics.
     */
    public MixinExpander(int recursionLimit, DiagnosticsEngine diagnostics) {
        this.recursionLimit = recursionLimit;
        this.diagnostics = diagnostics;
    }

    /**
     * Expands all mixin calls.
     * @param linked The linked node list.
     * @return The node list without mixin definitions and calls.
     * @throws ExpansionException if a call names an unknown mixin or the nesting limit is exceeded.
     */
    public List<AstNode> expand(List<AstNode> linked) throws ExpansionException {
        new TreeWalker(Map.of(MixinDefNode.class, node -> register((MixinDefNode) node))).walk(linked);
        List<AstNode> withoutDefinitions = stripDefinitions(linked);
        log.debug("Hoisted {} mixin definition(s)", definitions.size());
        return expandNodes(withoutDefinitions, 0);
    }

    private void register(MixinDefNode definition) {
        MixinDefNode stripped = new MixinDefNode(definition.name(), definition.params(), definition.restParam(),
                stripDefinitions(definition.body()), definition.source());
        MixinDefNode previous = definitions.put(definition.name(), stripped);
        if (previous != null) {
            diagnostics.reportWarning("Mixin '" + definition.name() + "' is defined again; the definition at "
                    + previous.source() + " is replaced", definition.source());
        }
    }

    private static List<AstNode> stripDefinitions(List<AstNode> nodes) {
        return TreeWalker.rewrite(nodes, node -> node instanceof MixinDefNode ? List.of() : null);
    }

    private List<AstNode> expandNodes(List<AstNode> nodes, int depth) throws ExpansionException {
        return TreeWalker.rewrite(nodes, node -> {
            if (node instanceof MixinCallNode call) {
                return List.of(expandCall(call, depth));
            }
            return null;
        });
    }

    private AstNode expandCall(MixinCallNode call, int depth) throws ExpansionException {
        MixinDefNode definition = definitions.get(call.name());
        if (definition == null) {
            throw new ExpansionException(CompilerErrorCode.UNKNOWN_MIXIN,
                    "Unknown mixin '" + call.name() + "'", call.source());
        }
        if (depth >= recursionLimit) {
            throw new ExpansionException(CompilerErrorCode.MIXIN_RECURSION_LIMIT,
                    "Mixin expansion nested deeper than " + recursionLimit + " levels while expanding '"
                            + call.name() + "'", call.source());
        }

        List<AstNode> callerBlock = call.blockContent() != null ? expandNodes(call.blockContent(), depth) : null;
        boolean[] slotFound = {false};
        List<AstNode> body = TreeWalker.rewrite(definition.body(), node -> {
            if (node instanceof BlockSlotNode) {
                slotFound[0] = true;
                return callerBlock != null ? List.of(new CallerBlockNode(callerBlock, call.source())) : List.of();
            }
            return null;
        });
        if (callerBlock != null && !slotFound[0]) {
            log.debug("Mixin '{}' has no block marker; the block given at {} is discarded", call.name(), call.source());
        }

        return new MixinScopeNode(call.name(), bind(definition, call), expandNodes(body, depth + 1), call.source());
    }

    private List<ParameterBinding> bind(MixinDefNode definition, MixinCallNode call) {
        List<ParameterBinding> bindings = new ArrayList<>();
        List<String> args = call.args();
        List<MixinParameter> params = definition.params();
        for (int i = 0; i < params.size(); i++) {
            MixinParameter param = params.get(i);
            if (i < args.size()) {
                bindings.add(ParameterBinding.argument(param.name(), args.get(i)));
            } else if (param.defaultExpr() != null) {
                bindings.add(ParameterBinding.defaulted(param.name(), param.defaultExpr()));
            } else {
                bindings.add(ParameterBinding.undefined(param.name()));
            }
        }
        List<String> remaining = args.size() > params.size() ? args.subList(params.size(), args.size()) : List.of();
        if (definition.restParam() != null) {
            bindings.add(ParameterBinding.rest(definition.restParam(), remaining));
        } else if (!remaining.isEmpty()) {
            diagnostics.reportWarning("Mixin '" + definition.name() + "' takes " + params.size()
                    + " argument(s) but was called with " + args.size() + "; the extra arguments are ignored",
                    call.source());
        }
        return bindings;
    }
}
