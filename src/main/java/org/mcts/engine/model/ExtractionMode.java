package org.mcts.engine.model;

/**
 * How the chosen actions are read off the tree once the sampling budget is spent.
 */
public enum ExtractionMode {

    /**
     * Follow the child with the best mean reward one ply at a time, breaking ties at random.
     */
    GREEDY,

    /**
     * Search the built tree exhaustively for the path whose deepest node has the best mean reward, keeping the first
     * path found on ties.
     */
    LOOKAHEAD
}
