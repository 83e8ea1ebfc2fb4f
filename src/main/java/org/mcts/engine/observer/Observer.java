package org.mcts.engine.observer;

import org.mcts.engine.event.Event;

public interface Observer {

    void observe(Event event);
}
