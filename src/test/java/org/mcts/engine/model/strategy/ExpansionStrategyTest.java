package org.mcts.engine.model.strategy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;
import org.mcts.engine.domain.BranchingState;
import org.mcts.engine.model.SearchTreeNode;

public class ExpansionStrategyTest
{
  @Test
  public void testRandomExpansionIsUniform()
  {
    int numActions = 4;
    int trials = 500 * numActions;
    int[] counts = new int[numActions];
    RandomExpansionStrategy<Integer> strategy = new RandomExpansionStrategy<>();
    Random random = new Random(2024);

    for (int i = 0; i < trials; i++)
    {
      SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(numActions, 1));
      SearchTreeNode<Integer> child = strategy.execute(node, random);
      counts[child.getPrecedingAction()]++;
    }

    double expected = (double) trials / numActions;
    for (int action = 0; action < numActions; action++)
    {
      assertTrue("Action " + action + " expanded " + counts[action] + " times",
                 Math.abs(counts[action] - expected) < 0.2 * expected);
    }
  }

  @Test
  public void testExpansionRemovesTheChosenAction()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(3, 2));
    RandomExpansionStrategy<Integer> strategy = new RandomExpansionStrategy<>();
    Random random = new Random(5);

    for (int expanded = 1; expanded <= 3; expanded++)
    {
      SearchTreeNode<Integer> child = strategy.execute(node, random);
      assertSame(node, child.getParent());
      assertEquals(3 - expanded, node.getUntriedActions().size());
      assertEquals(expanded, node.getChildren().size());
    }
    assertTrue(node.isExpanded());
  }

  @Test
  public void testOrderedExpansionFollowsDomainOrder()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(3, 2));
    OrderedExpansionStrategy<Integer> strategy = new OrderedExpansionStrategy<>();
    Random random = new Random(0);

    assertEquals(Integer.valueOf(0), strategy.execute(node, random).getPrecedingAction());
    assertEquals(Integer.valueOf(1), strategy.execute(node, random).getPrecedingAction());
    assertEquals(Integer.valueOf(2), strategy.execute(node, random).getPrecedingAction());
  }

  @Test(expected = IllegalStateException.class)
  public void testExpandingFullyExpandedNodeFails()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(2, 2));
    node.addChild(0);
    node.addChild(1);
    new RandomExpansionStrategy<Integer>().execute(node, new Random(0));
  }

  @Test(expected = IllegalStateException.class)
  public void testExpandingTerminalNodeFails()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(2, 0));
    new RandomExpansionStrategy<Integer>().execute(node, new Random(0));
  }
}
