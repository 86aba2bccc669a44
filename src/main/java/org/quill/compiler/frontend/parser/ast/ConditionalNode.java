package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} / {@code unless} chain with its {@code else if} branches and optional {@code else}.
 *
 * @param branches The guarded branches in order.
 * @param elseBody The else body, or null if there is none.
 * @param source The position of the first keyword.
 */
public record ConditionalNode(List<ConditionalBranch> branches, List<AstNode> elseBody, SourceInfo source) implements AstNode {

    public ConditionalNode {
        branches = List.copyOf(branches);
        elseBody = elseBody != null ? List.copyOf(elseBody) : null;
    }

    @Override
    public List<List<AstNode>> getBodies() {
        List<List<AstNode>> bodies = new ArrayList<>();
        branches.forEach(b -> bodies.add(b.body()));
        if (elseBody != null) {
            bodies.add(elseBody);
        }
        return bodies;
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        List<ConditionalBranch> newBranches = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            newBranches.add(branches.get(i).withBody(bodies.get(i)));
        }
        return new ConditionalNode(newBranches, elseBody != null ? bodies.get(branches.size()) : null, source);
    }

    /**
     * @param branch A further branch.
     * @return A copy with the branch appended.
     */
    public ConditionalNode withBranch(ConditionalBranch branch) {
        List<ConditionalBranch> newBranches = new ArrayList<>(branches);
        newBranches.add(branch);
        return new ConditionalNode(newBranches, elseBody, source);
    }

    /**
     * @param index The branch index.
     * @param body The new body of that branch.
     * @return A copy with the body replaced.
     */
    public ConditionalNode withBranchBody(int index, List<AstNode> body) {
        List<ConditionalBranch> newBranches = new ArrayList<>(branches);
        newBranches.set(index, branches.get(index).withBody(body));
        return new ConditionalNode(newBranches, elseBody, source);
    }

    /**
     * @param body The else body.
     * @return A copy with the else body set.
     */
    public ConditionalNode withElse(List<AstNode> body) {
        return new ConditionalNode(branches, body, source);
    }
}
