package org.mcts.engine.model.strategy;

import org.mcts.engine.model.CumulativeStatistics;
import org.mcts.engine.model.SearchTreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class Ucb1SelectionStrategy<A> implements SelectionStrategy<A> {

    @Override
    public SearchTreeNode<A> execute(SearchTreeNode<A> node, double explorationConstant, Random random) {
        if (node.isLeaf()) {
            throw new IllegalStateException("Cannot select among the children of a leaf: " + node);
        }

        double bestScore = Double.NEGATIVE_INFINITY;
        List<SearchTreeNode<A>> bestChildren = new ArrayList<>();
        int parentNumVisits = node.getStatistics().getNumVisits();
        for (SearchTreeNode<A> child : node.getChildren().values()) {
            double score = getExploitationScore(child.getStatistics()) +
                    explorationConstant * getExplorationScore(parentNumVisits, child.getStatistics());
            if (score > bestScore) {
                bestScore = score;
                bestChildren.clear();
                bestChildren.add(child);
            } else if (score == bestScore) {
                bestChildren.add(child);
            }
        }

        if (bestChildren.size() == 1) {
            return bestChildren.get(0);
        }
        return bestChildren.get(random.nextInt(bestChildren.size()));
    }

    private double getExplorationScore(int parentNumVisits, CumulativeStatistics childStatistics) {
        if (!childStatistics.isVisited()) {
            throw new IllegalStateException("A child must be visited before it can be selected");
        }
        return Math.sqrt(2 * Math.log(parentNumVisits) / childStatistics.getNumVisits());
    }

    private double getExploitationScore(CumulativeStatistics childStatistics) {
        return childStatistics.getMeanReward();
    }
}
