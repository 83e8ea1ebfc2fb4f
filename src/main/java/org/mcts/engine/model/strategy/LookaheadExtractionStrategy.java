package org.mcts.engine.model.strategy;

import org.mcts.engine.model.SearchTreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Searches the built tree exhaustively, to the requested number of plies, for the action path whose deepest reached
 * node has the highest mean reward.  Unvisited nodes are never scored.  On ties the first path found is kept, so the
 * random source is not used.
 */
public class LookaheadExtractionStrategy<A> implements ExtractionStrategy<A> {

    @Override
    public List<A> execute(SearchTreeNode<A> root, int searchDepth, Random random) {
        Line<A> best = findBestLine(root, searchDepth);
        List<A> actions = new ArrayList<>(best.actions);
        Collections.reverse(actions);
        return actions;
    }

    private Line<A> findBestLine(SearchTreeNode<A> node, int pliesLeft) {
        Line<A> best = null;
        if (pliesLeft > 0 && !node.isTerminal()) {
            for (SearchTreeNode<A> child : node.getChildren().values()) {
                if (!child.getStatistics().isVisited()) {
                    continue;
                }
                Line<A> line = findBestLine(child, pliesLeft - 1);
                if (best == null || line.score > best.score) {
                    line.actions.add(child.getPrecedingAction());
                    best = line;
                }
            }
        }
        if (best == null) {
            double score = node.getStatistics().isVisited() ?
                    node.getStatistics().getMeanReward() : Double.NEGATIVE_INFINITY;
            best = new Line<>(score);
        }
        return best;
    }

    // Actions are collected leaf first and reversed once at the top.
    private static class Line<T> {
        private final List<T> actions = new ArrayList<>();
        private final double score;

        Line(double score) {
            this.score = score;
        }
    }
}
