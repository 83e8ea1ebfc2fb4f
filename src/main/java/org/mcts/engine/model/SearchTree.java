package org.mcts.engine.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.engine.event.Event;
import org.mcts.engine.event.RootAdvancedEvent;
import org.mcts.engine.event.TreeEvent;
import org.mcts.engine.event.TreeStartEvent;
import org.mcts.engine.model.strategy.PoolOfStrategies;
import org.mcts.engine.observer.Observer;
import org.mcts.engine.observer.Subject;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A Monte Carlo search tree over a caller-supplied domain.
 *
 * Each call to {@link #searchForActions(int)} spends the configured sample budget growing the tree from the current
 * root and then reads the recommended actions off it.  Once the caller commits to an action in the real domain,
 * {@link #updateRoot(Object)} keeps the subtree below that action for the next search.
 *
 * Instances are not thread safe.
 *
 * @param <A> the action type of the domain
 */
public class SearchTree<A> implements Subject {

    private static final Logger LOGGER = LogManager.getLogger();

    private final SearchSettings settings;
    private final PoolOfStrategies<A> strategies;
    private final Random random;
    private final List<Observer> observers = new ArrayList<>();

    private SearchTreeNode<A> root;
    private int searchCount = 0;

    public SearchTree(State<A> initialState, SearchSettings settings) {
        this(initialState, settings, PoolOfStrategies.defaults(settings.getExtractionMode()));
    }

    public SearchTree(State<A> initialState, SearchSettings settings, PoolOfStrategies<A> strategies) {
        this.settings = settings;
        this.strategies = strategies;
        random = settings.hasRandomSeed() ? new Random(settings.getRandomSeed()) : new Random();
        root = new SearchTreeNode<>(initialState);
    }

    /**
     * Perform a single round: select, expand, play out and back-propagate.
     */
    public void grow() {
        SearchTreeNode<A> node = root;
        int maxTreeDepth = settings.getMaxTreeDepth();

        // Descend through fully expanded nodes
        while (node.isExpanded() && !node.isTerminal() && node.getDepth() < maxTreeDepth) {
            node = strategies.getSelectionStrategy().execute(node, settings.getExplorationConstant(), random);
        }

        // Never expand beyond the depth cap or below a terminal state
        SearchTreeNode<A> simulationNode = node;
        if (!node.isTerminal() && node.getDepth() < maxTreeDepth) {
            simulationNode = strategies.getExpansionStrategy().execute(node, random);
        }

        double playoutScore = strategies.getPlayoutStrategy().execute(simulationNode.getState(), random);

        strategies.getBackPropagationStrategy().execute(simulationNode, playoutScore);
    }

    /**
     * Spend the sample budget and return the best actions found.
     *
     * @param searchDepth - how many consecutive actions are wanted.
     *
     * @return up to {@code searchDepth} actions; empty if the root is terminal.
     */
    public List<A> searchForActions(int searchDepth) {
        if (searchDepth < 0) {
            throw new IllegalArgumentException("The search depth must not be negative, got " + searchDepth);
        }

        long finishBy = settings.getTimeLimitMillis() > 0 ?
                System.currentTimeMillis() + settings.getTimeLimitMillis() : Long.MAX_VALUE;
        int iterations = 0;
        while (iterations < settings.getSamples()) {
            if (System.currentTimeMillis() >= finishBy) {
                LOGGER.warn("Time limit reached after {} of {} iterations", iterations, settings.getSamples());
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Search interrupted after {} of {} iterations", iterations, settings.getSamples());
                break;
            }
            grow();
            iterations++;
        }

        List<A> actions = strategies.getExtractionStrategy().execute(root, searchDepth, random);
        LOGGER.info("Processed {} iterations, and playing: {}", iterations, actions);
        searchCount++;
        notifyObservers(new TreeEvent(this, searchCount, iterations));
        return actions;
    }

    /**
     * Reseed the random source, then search as {@link #searchForActions(int)} does.
     */
    public List<A> searchForActions(int searchDepth, long randomSeed) {
        random.setSeed(randomSeed);
        return searchForActions(searchDepth);
    }

    /**
     * Make the child reached by the given action the new root, creating it if it was never explored.  The statistics
     * already gathered below that action are kept; every other subtree of the old root is dropped.
     *
     * @param action - the action committed to in the real domain.
     */
    public SearchTree<A> updateRoot(A action) {
        root = strategies.getCuttingStrategy().execute(root, action);
        LOGGER.debug("Advanced root by {} ({} visits kept)", action, root.getStatistics().getNumVisits());
        notifyObservers(new RootAdvancedEvent(this, action));
        return this;
    }

    public SearchTreeNode<A> getRoot() {
        return root;
    }

    public boolean isComplete() {
        return root.isTerminal();
    }

    public SearchSettings getSettings() {
        return settings;
    }

    public PoolOfStrategies<A> getStrategies() {
        return strategies;
    }

    public int getSearchCount() {
        return searchCount;
    }

    @Override
    public void addObserver(Observer observer) {
        observers.add(observer);
        observer.observe(new TreeStartEvent());
    }

    @Override
    public void notifyObservers(Event event) {
        for (Observer observer : observers) {
            observer.observe(event);
        }
    }
}
