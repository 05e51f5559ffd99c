// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class BlockGraphUtils {

  private BlockGraphUtils() {}

  public static FluentIterable<BasicBlock> successorsOf(BasicBlock pBlock) {
    return FluentIterable.from(pBlock.getLeavingEdges()).transform(BlockEdge::getSuccessor);
  }

  public static FluentIterable<BasicBlock> predecessorsOf(BasicBlock pBlock) {
    return FluentIterable.from(pBlock.getEnteringEdges()).transform(BlockEdge::getPredecessor);
  }

  /**
   * Blocks reachable from the entry block, in postorder of a depth-first traversal that follows
   * successor edges in branch order.
   */
  public static ImmutableList<BasicBlock> postorder(BlockGraph pGraph) {
    List<BasicBlock> result = new ArrayList<>(pGraph.getNumBlocks());
    Set<BasicBlock> visited = new HashSet<>();
    // pairs of block and index of the next leaving edge to follow
    Deque<BasicBlock> blockStack = new ArrayDeque<>();
    Deque<Integer> edgeStack = new ArrayDeque<>();

    BasicBlock entry = pGraph.getEntryBlock();
    visited.add(entry);
    blockStack.push(entry);
    edgeStack.push(0);

    while (!blockStack.isEmpty()) {
      BasicBlock block = blockStack.peek();
      int nextEdge = edgeStack.pop();

      if (nextEdge == block.getNumLeavingEdges()) {
        blockStack.pop();
        result.add(block);
        continue;
      }

      edgeStack.push(nextEdge + 1);
      BasicBlock successor = block.getLeavingEdge(nextEdge).getSuccessor();
      if (visited.add(successor)) {
        blockStack.push(successor);
        edgeStack.push(0);
      }
    }

    return ImmutableList.copyOf(result);
  }

  /** Blocks reachable from the entry block in reverse postorder, so the entry block is first. */
  public static ImmutableList<BasicBlock> reversePostorder(BlockGraph pGraph) {
    return postorder(pGraph).reverse();
  }
}
