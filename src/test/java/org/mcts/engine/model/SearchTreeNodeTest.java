package org.mcts.engine.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.mcts.engine.domain.BranchingState;
import org.mcts.engine.model.exceptions.NodeNotChildException;

public class SearchTreeNodeTest
{
  @Test
  public void testNewNodeHasAllActionsUntried()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(3, 2));

    assertEquals(Arrays.asList(0, 1, 2), node.getUntriedActions());
    assertTrue(node.isLeaf());
    assertTrue(node.isRoot());
    assertFalse(node.isExpanded());
    assertFalse(node.isTerminal());
    assertEquals(1, node.getDepth());
    assertNull(node.getPrecedingAction());
    assertEquals(0, node.getStatistics().getNumVisits());
  }

  @Test
  public void testTerminalNodeIsExpandedWithoutChildren()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(2, 0));

    assertTrue(node.isTerminal());
    assertTrue(node.isExpanded());
    assertTrue(node.isLeaf());
  }

  @Test
  public void testAddChildLinksBothWays()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(3, 2));
    SearchTreeNode<Integer> child = root.addChild(1);

    assertSame(root, child.getParent());
    assertSame(child, root.getChild(1));
    assertEquals(Integer.valueOf(1), child.getPrecedingAction());
    assertEquals(Arrays.asList(0, 2), root.getUntriedActions());
    assertEquals(Collections.singletonList(1), ((BranchingState) child.getState()).getPath());
    assertEquals(2, child.getDepth());
    assertFalse(root.isLeaf());
  }

  @Test
  public void testExpandedOnceEveryActionHasAChild()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(2, 2));
    root.addChild(0);
    assertFalse(root.isExpanded());
    root.addChild(1);
    assertTrue(root.isExpanded());
    assertEquals(2, root.getChildren().size());
  }

  @Test
  public void testDepthGrowsByOnePerGeneration()
  {
    SearchTreeNode<Integer> node = new SearchTreeNode<>(new BranchingState(2, 5));
    for (int i = 0; i < 5; i++)
    {
      node = node.addChild(i % 2);
    }
    assertEquals(6, node.getDepth());
    assertTrue(node.isTerminal());
  }

  @Test(expected = IllegalStateException.class)
  public void testDuplicateChildRejected()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(2, 2));
    root.addChild(0);
    root.addChild(0);
  }

  @Test
  public void testRemoveChildDetaches()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(2, 2));
    SearchTreeNode<Integer> left = root.addChild(0);
    SearchTreeNode<Integer> right = root.addChild(1);

    root.removeChild(left);

    assertNull(left.getParent());
    assertTrue(left.isRoot());
    assertNull(root.getChild(0));
    assertSame(right, root.getChild(1));
    assertEquals(1, left.getDepth());
  }

  @Test
  public void testRemoveChildComparesByIdentity()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(2, 2));
    root.addChild(0);

    // Same state and action, but a different node
    SearchTreeNode<Integer> lookalike = new SearchTreeNode<>(new BranchingState(2, 2)).addChild(0);
    try
    {
      root.removeChild(lookalike);
      fail("Expected NodeNotChildException");
    }
    catch (NodeNotChildException e)
    {
      assertEquals(1, root.getChildren().size());
      assertSame(lookalike.getParent().getChild(0), lookalike);
    }
  }

  @Test(expected = NodeNotChildException.class)
  public void testRemovingGrandchildFails()
  {
    SearchTreeNode<Integer> root = new SearchTreeNode<>(new BranchingState(2, 3));
    SearchTreeNode<Integer> grandchild = root.addChild(0).addChild(1);
    root.removeChild(grandchild);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonTerminalStateWithoutActionsRejected()
  {
    new SearchTreeNode<>(new State<Integer>()
    {
      @Override
      public List<Integer> getPossibleActions()
      {
        return Collections.emptyList();
      }

      @Override
      public State<Integer> executeAction(Integer action)
      {
        return this;
      }

      @Override
      public boolean isTerminal()
      {
        return false;
      }

      @Override
      public double getReward()
      {
        return 0;
      }
    });
  }
}
