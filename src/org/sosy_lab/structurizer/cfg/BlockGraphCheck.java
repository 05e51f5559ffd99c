// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import java.util.HashSet;
import java.util.Set;

/** Consistency checks for the edge bookkeeping of a {@link BlockGraph}. */
public final class BlockGraphCheck {

  private BlockGraphCheck() {}

  /**
   * Checks every block of the graph.
   *
   * @param pGraph the graph to check
   * @return true if all checks succeed
   * @throws VerifyException if not all checks succeed
   */
  public static boolean check(BlockGraph pGraph) throws VerifyException {
    for (BasicBlock block : pGraph.getBlocks()) {
      verify(
          block.getGraph() == pGraph,
          "Block %s is not from function %s",
          debugFormat(block),
          pGraph.getFunctionName());
      isConsistentAsGraphNode(block);
    }

    for (BlockEdge edge : pGraph.getEdges()) {
      verify(
          edge.getPredecessor().getGraph() == pGraph && edge.getSuccessor().getGraph() == pGraph,
          "Edge %s leaves function %s",
          edge,
          pGraph.getFunctionName());
    }
    return true;
  }

  /**
   * This method returns a lazy object where {@link Object#toString} can be called. In most cases we
   * do not need to build the String, thus we can avoid some overhead here.
   */
  static Object debugFormat(BasicBlock pBlock) {
    return new Object() {
      @Override
      public String toString() {
        return pBlock.getGraph().getFunctionName()
            + ":"
            + pBlock
            + " (#"
            + pBlock.getBlockNumber()
            + ", "
            + pBlock.getKind()
            + ") with edges\n"
            + Joiner.on('\n').join(pBlock.getEnteringEdges())
            + "\n"
            + Joiner.on('\n').join(pBlock.getLeavingEdges());
      }
    };
  }

  /**
   * Check all entering and leaving edges for corresponding leaving/entering edges at
   * predecessor/successor blocks, and that no edge is listed twice. Parallel edges between the same
   * two blocks are allowed, redirecting both sides of a branch creates them.
   */
  private static void isConsistentAsGraphNode(BasicBlock pBlock) {
    Set<BlockEdge> seenEdges = new HashSet<>();

    for (BlockEdge edge : pBlock.getLeavingEdges()) {
      verify(
          seenEdges.add(edge), "Duplicate leaving edge %s on block %s", edge, debugFormat(pBlock));
      verify(
          edge.getPredecessor() == pBlock,
          "Block %s lists leaving edge %s of another block",
          debugFormat(pBlock),
          edge);

      BasicBlock successor = edge.getSuccessor();
      verify(
          successor.getEnteringEdges().contains(edge),
          "Block %s has leaving edge %s, but block %s does not have this edge as entering edge!",
          debugFormat(pBlock),
          edge,
          debugFormat(successor));
    }

    seenEdges.clear();

    for (BlockEdge edge : pBlock.getEnteringEdges()) {
      verify(
          seenEdges.add(edge), "Duplicate entering edge %s on block %s", edge, debugFormat(pBlock));
      verify(
          edge.getSuccessor() == pBlock,
          "Block %s lists entering edge %s of another block",
          debugFormat(pBlock),
          edge);

      BasicBlock predecessor = edge.getPredecessor();
      verify(
          predecessor.getLeavingEdges().contains(edge),
          "Block %s has entering edge %s, but block %s does not have this edge as leaving edge!",
          debugFormat(pBlock),
          edge,
          debugFormat(predecessor));
    }
  }
}
