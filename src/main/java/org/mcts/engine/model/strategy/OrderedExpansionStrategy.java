package org.mcts.engine.model.strategy;

import java.util.List;
import java.util.Random;

/**
 * Expands untried actions in the order the domain lists them.
 */
public class OrderedExpansionStrategy<A> extends ExpansionStrategy<A> {

    @Override
    protected A chooseAction(List<A> untriedActions, Random random) {
        return untriedActions.get(0);
    }
}
