package org.mcts.engine.observer;

import org.mcts.engine.event.Event;

public interface Subject {

    void addObserver(Observer observer);

    void notifyObservers(Event event);
}
