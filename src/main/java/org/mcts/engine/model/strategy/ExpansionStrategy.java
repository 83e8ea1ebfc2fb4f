package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

import java.util.List;
import java.util.Random;

/**
 * Turns one untried action of a node into a new child.
 */
public abstract class ExpansionStrategy<A> {

    public SearchTreeNode<A> execute(SearchTreeNode<A> node, Random random) {
        if (node.isTerminal()) {
            throw new IllegalStateException("Should not expand a terminal node: " + node);
        }
        if (node.isExpanded()) {
            throw new IllegalStateException("Should not expand a node that has already been expanded: " + node);
        }
        A action = chooseAction(node.getUntriedActions(), random);
        return node.addChild(action);
    }

    /**
     * @param untriedActions - the untried actions of the node being expanded, never empty.
     * @param random - the source of randomness for this choice.
     *
     * @return the action to materialize.
     */
    protected abstract A chooseAction(List<A> untriedActions, Random random);
}
