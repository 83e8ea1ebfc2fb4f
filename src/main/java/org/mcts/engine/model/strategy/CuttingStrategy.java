package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

/**
 * Moves the root of the tree to the child reached by a committed action, discarding every sibling subtree.
 */
public class CuttingStrategy<A> {

    public SearchTreeNode<A> execute(SearchTreeNode<A> root, A action) {
        SearchTreeNode<A> newRoot = root.getChild(action);
        if (newRoot == null) {
            newRoot = root.addChild(action);
        }
        root.removeChild(newRoot);
        return newRoot;
    }
}
