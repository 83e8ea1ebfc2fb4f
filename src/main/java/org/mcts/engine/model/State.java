package org.mcts.engine.model;

import java.util.List;

/**
 * The capabilities the search needs from a domain state.
 *
 * States are treated as values: {@link #executeAction(Object)} returns a new state and leaves the receiver untouched.
 * Actions are used as map keys, so {@code A} must implement {@code equals} and {@code hashCode} consistently.
 *
 * @param <A> the action type of the domain
 */
public interface State<A> {

    /**
     * @return the actions available in this state; never empty unless the state is terminal.
     */
    List<A> getPossibleActions();

    State<A> executeAction(A action);

    boolean isTerminal();

    /**
     * @return the reward of this state, from the point of view of the fixed reward subject of the domain.  Must be
     * stable across repeated reads of a terminal state.
     */
    double getReward();
}
