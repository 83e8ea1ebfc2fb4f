package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

/**
 * Adds the playout score unchanged to every node on the path.  The score is never negated between plies.
 */
public class CumulativeBackPropagationStrategy<A> implements BackPropagationStrategy<A> {

    @Override
    public void execute(SearchTreeNode<A> node, double playoutScore) {
        for (SearchTreeNode<A> current = node; current != null; current = current.getParent()) {
            current.getStatistics().update(playoutScore);
        }
    }
}
