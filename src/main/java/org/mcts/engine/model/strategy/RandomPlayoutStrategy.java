package org.mcts.engine.model.strategy;

import org.mcts.engine.model.State;

import java.util.List;
import java.util.Random;

public class RandomPlayoutStrategy<A> implements PlayoutStrategy<A> {

    @Override
    public double execute(State<A> startState, Random random) {
        State<A> state = startState;
        while (!state.isTerminal()) {
            List<A> actions = state.getPossibleActions();
            state = state.executeAction(actions.get(random.nextInt(actions.size())));
        }
        return state.getReward();
    }
}
