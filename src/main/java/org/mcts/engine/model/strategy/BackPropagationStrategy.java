package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

public interface BackPropagationStrategy<A> {

    /**
     * Record a playout result on the node it started from and on every ancestor up to the root.
     */
    void execute(SearchTreeNode<A> node, double playoutScore);
}
