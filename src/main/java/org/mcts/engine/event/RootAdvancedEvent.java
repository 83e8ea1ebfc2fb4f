package org.mcts.engine.event;

import org.mcts.engine.model.SearchTree;

public class RootAdvancedEvent extends Event {

    private final SearchTree<?> tree;
    private final Object action;

    public RootAdvancedEvent(SearchTree<?> tree, Object action) {
        this.tree = tree;
        this.action = action;
    }

    public SearchTree<?> getTree() {
        return tree;
    }

    public Object getAction() {
        return action;
    }
}
