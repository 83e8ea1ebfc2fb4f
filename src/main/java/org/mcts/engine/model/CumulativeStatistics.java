package org.mcts.engine.model;

public class CumulativeStatistics {

    private int numVisits;
    private double totalReward;

    public CumulativeStatistics() {
        numVisits = 0;
        totalReward = 0;
    }

    public int getNumVisits() {
        return numVisits;
    }

    public double getTotalReward() {
        return totalReward;
    }

    public boolean isVisited() {
        return numVisits > 0;
    }

    public double getMeanReward() {
        if (numVisits == 0) {
            throw new IllegalStateException("Mean reward is undefined for an unvisited node");
        }
        return totalReward / numVisits;
    }

    public void update(double reward) {
        numVisits++;
        totalReward += reward;
    }

    @Override
    public String toString() {
        return "visits=" + numVisits + ", totalReward=" + totalReward;
    }
}
