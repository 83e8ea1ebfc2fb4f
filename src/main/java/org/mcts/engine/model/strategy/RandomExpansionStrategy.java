package org.mcts.engine.model.strategy;

import java.util.List;
import java.util.Random;

public class RandomExpansionStrategy<A> extends ExpansionStrategy<A> {

    @Override
    protected A chooseAction(List<A> untriedActions, Random random) {
        return untriedActions.get(random.nextInt(untriedActions.size()));
    }
}
