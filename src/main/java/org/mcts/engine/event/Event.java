package org.mcts.engine.event;

public abstract class Event {
}
