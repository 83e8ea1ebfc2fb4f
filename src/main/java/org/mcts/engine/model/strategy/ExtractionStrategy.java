package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

import java.util.List;
import java.util.Random;

public interface ExtractionStrategy<A> {

    /**
     * Read the recommended actions off an already sampled tree.
     *
     * @param root - the node to start from.
     * @param searchDepth - the maximum number of actions wanted.
     * @param random - the source used to break ties, if the strategy breaks them at random.
     *
     * @return up to {@code searchDepth} actions, empty when the root is terminal or has no children.
     */
    List<A> execute(SearchTreeNode<A> root, int searchDepth, Random random);
}
