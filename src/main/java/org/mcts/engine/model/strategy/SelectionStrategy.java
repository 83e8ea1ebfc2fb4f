package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

import java.util.Random;

public interface SelectionStrategy<A> {

    /**
     * Choose the most promising child of an expanded node.
     *
     * @param node - the parent; it must have children, all of them visited at least once.
     * @param explorationConstant - the weight of the exploration term; 0 means pure exploitation.
     * @param random - the source used to break ties.
     *
     * @return the chosen child.
     */
    SearchTreeNode<A> execute(SearchTreeNode<A> node, double explorationConstant, Random random);
}
