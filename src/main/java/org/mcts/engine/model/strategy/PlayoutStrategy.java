package org.mcts.engine.model.strategy;

import org.mcts.engine.model.State;

import java.util.Random;

public interface PlayoutStrategy<A> {

    /**
     * Simulate from the given state until a terminal state is reached.
     *
     * @param startState - the state to play out from; it is not modified.
     * @param random - the source of randomness for the simulation.
     *
     * @return a value derived only from the reward of the terminal state reached.
     */
    double execute(State<A> startState, Random random);
}
