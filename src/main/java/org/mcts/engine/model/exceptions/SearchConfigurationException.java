package org.mcts.engine.model.exceptions;

/**
 * Thrown when search settings are rejected at construction time.
 */
public class SearchConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public SearchConfigurationException(String message) {
        super(message);
    }
}
