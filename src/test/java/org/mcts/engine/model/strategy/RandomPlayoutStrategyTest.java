package org.mcts.engine.model.strategy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;
import org.mcts.engine.domain.BranchingState;
import org.mcts.engine.domain.TicTacToeState;

public class RandomPlayoutStrategyTest
{
  private final RandomPlayoutStrategy<Integer> strategy = new RandomPlayoutStrategy<>();

  @Test
  public void testTerminalStateReturnsItsOwnReward()
  {
    BranchingState terminal = new BranchingState(2, 2).executeAction(1).executeAction(1);
    assertEquals(1.0, strategy.execute(terminal, new Random(0)), 0.0);
  }

  @Test
  public void testStartStateIsNotModified()
  {
    BranchingState start = new BranchingState(2, 6).executeAction(1);
    strategy.execute(start, new Random(7));
    assertEquals(1, start.getPath().size());
    assertEquals(2, start.getPossibleActions().size());
  }

  @Test
  public void testUniformPlayoutAverages()
  {
    // Every action is a fair coin flip, so the reward averages 0.5
    BranchingState start = new BranchingState(2, 10);
    Random random = new Random(99);
    double total = 0;
    int playouts = 2000;
    for (int i = 0; i < playouts; i++)
    {
      total += strategy.execute(start, random);
    }
    double mean = total / playouts;
    assertTrue("Mean reward " + mean, mean > 0.45 && mean < 0.55);
  }

  @Test
  public void testPlayoutReachesEveryOutcome()
  {
    TicTacToeState start = new TicTacToeState();
    Random random = new Random(11);
    Set<Double> outcomes = new HashSet<>();
    for (int i = 0; i < 500; i++)
    {
      outcomes.add(strategy.execute(start, random));
    }
    assertEquals(3, outcomes.size());
    assertTrue(outcomes.contains(1.0));
    assertTrue(outcomes.contains(-1.0));
    assertTrue(outcomes.contains(0.0));
  }
}
