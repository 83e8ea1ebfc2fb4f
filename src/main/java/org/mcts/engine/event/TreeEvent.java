package org.mcts.engine.event;

import org.mcts.engine.model.SearchTree;

public class TreeEvent extends Event {

    private final SearchTree<?> tree;
    private final int searchNumber;
    private final int iterations;

    public TreeEvent(SearchTree<?> tree, int searchNumber, int iterations) {
        this.tree = tree;
        this.searchNumber = searchNumber;
        this.iterations = iterations;
    }

    public SearchTree<?> getTree() {
        return tree;
    }

    public int getSearchNumber() {
        return searchNumber;
    }

    public int getIterations() {
        return iterations;
    }
}
