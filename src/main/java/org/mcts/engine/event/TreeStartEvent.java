package org.mcts.engine.event;

/**
 * Sent to an observer when it starts watching a tree.
 */
public class TreeStartEvent extends Event {
}
