package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Follows the child with the best mean reward one ply at a time.
 */
public class GreedyExtractionStrategy<A> implements ExtractionStrategy<A> {

    private final SelectionStrategy<A> selectionStrategy;

    public GreedyExtractionStrategy(SelectionStrategy<A> selectionStrategy) {
        this.selectionStrategy = selectionStrategy;
    }

    @Override
    public List<A> execute(SearchTreeNode<A> root, int searchDepth, Random random) {
        List<A> actions = new ArrayList<>();
        SearchTreeNode<A> node = root;
        for (int i = 0; i < searchDepth; i++) {
            if (node.isTerminal() || node.isLeaf()) {
                break;
            }
            node = selectionStrategy.execute(node, 0.0, random);
            actions.add(node.getPrecedingAction());
        }
        return actions;
    }
}
