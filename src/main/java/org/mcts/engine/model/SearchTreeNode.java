package org.mcts.engine.model;

import org.mcts.engine.model.exceptions.NodeNotChildException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SearchTreeNode<A> {

    private final State<A> state;
    private final A precedingAction;

    private SearchTreeNode<A> parent;
    private final Map<A, SearchTreeNode<A>> children;
    private final List<A> untriedActions;

    private final CumulativeStatistics statistics;

    public SearchTreeNode(State<A> state) {
        this(state, null);
    }

    private SearchTreeNode(State<A> state, A precedingAction) {
        this.state = state;
        this.precedingAction = precedingAction;
        children = new LinkedHashMap<>();
        if (state.isTerminal()) {
            untriedActions = new ArrayList<>();
        } else {
            untriedActions = new ArrayList<>(state.getPossibleActions());
            if (untriedActions.isEmpty()) {
                throw new IllegalArgumentException("A non-terminal state must offer at least one action: " + state);
            }
        }
        statistics = new CumulativeStatistics();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    // All possible actions have been materialized as children
    public boolean isExpanded() {
        return untriedActions.isEmpty();
    }

    /**
     * @return the number of nodes on the path from the root to this node, so the root is at depth 1.
     */
    public int getDepth() {
        int depth = 0;
        for (SearchTreeNode<A> node = this; node != null; node = node.parent) {
            depth++;
        }
        return depth;
    }

    public SearchTreeNode<A> getParent() {
        return parent;
    }

    public SearchTreeNode<A> getChild(A action) {
        return children.get(action);
    }

    public Map<A, SearchTreeNode<A>> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public List<A> getUntriedActions() {
        return Collections.unmodifiableList(untriedActions);
    }

    /**
     * Create the child reached by playing the given action in this node's state.
     *
     * The action is normally one of the untried actions, but any action that is legal in this state is accepted.
     *
     * @param action - the action leading from this node to the new child.
     *
     * @return the new child.
     */
    public SearchTreeNode<A> addChild(A action) {
        if (children.containsKey(action)) {
            throw new IllegalStateException("Action " + action + " already has a child in " + this);
        }
        SearchTreeNode<A> childNode = new SearchTreeNode<>(state.executeAction(action), action);
        untriedActions.remove(action);
        linkChildToParent(this, childNode, action);
        return childNode;
    }

    public void removeChild(SearchTreeNode<A> child) {
        Iterator<Map.Entry<A, SearchTreeNode<A>>> iterator = children.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue() == child) {
                child.parent = null;
                iterator.remove();
                return;
            }
        }
        throw new NodeNotChildException("The node does not have the given child node: " + child);
    }

    private static <A> void linkChildToParent(SearchTreeNode<A> parentNode, SearchTreeNode<A> childNode, A action) {
        childNode.parent = parentNode;
        parentNode.children.put(action, childNode);
    }

    public CumulativeStatistics getStatistics() {
        return statistics;
    }

    public State<A> getState() {
        return state;
    }

    public A getPrecedingAction() {
        return precedingAction;
    }

    @Override
    public String toString() {
        return "SearchTreeNode[action=" + precedingAction + ", " + statistics + ", state=" + state + "]";
    }
}
