package org.mcts.engine.model.exceptions;

/**
 * Thrown when a node is asked to release a child it does not own.
 */
public class NodeNotChildException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public NodeNotChildException(String message) {
        super(message);
    }
}
