// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.structurizer.ast.Statement;

/**
 * Node of a {@link BlockGraph}: an original basic block of the function, or a block synthesized
 * while normalizing loops or folding regions. Blocks are owned by their graph and identified by
 * their block number, which is their index in the graph.
 */
public final class BasicBlock {

  public enum BlockKind {
    /** basic block of the decompiled function */
    ORIGINAL,
    /** merges several edges into one entry or exit of a loop */
    REDIRECTOR,
    /** stands for a region that was folded into one statement */
    REGION
  }

  private final BlockGraph graph;
  private final int blockNumber;
  private final String label;
  private final BlockKind kind;

  // edges are added and removed only through BlockGraph
  final List<BlockEdge> leavingEdges = new ArrayList<>();
  final List<BlockEdge> enteringEdges = new ArrayList<>();

  private Statement statement;

  BasicBlock(
      BlockGraph pGraph, int pBlockNumber, String pLabel, BlockKind pKind, Statement pStatement) {
    graph = checkNotNull(pGraph);
    blockNumber = pBlockNumber;
    label = checkNotNull(pLabel);
    kind = checkNotNull(pKind);
    statement = checkNotNull(pStatement);
  }

  public BlockGraph getGraph() {
    return graph;
  }

  public int getBlockNumber() {
    return blockNumber;
  }

  public String getLabel() {
    return label;
  }

  public BlockKind getKind() {
    return kind;
  }

  public Statement getStatement() {
    return statement;
  }

  public void setStatement(Statement pStatement) {
    statement = checkNotNull(pStatement);
  }

  public int getNumLeavingEdges() {
    return leavingEdges.size();
  }

  public BlockEdge getLeavingEdge(int pIndex) {
    return leavingEdges.get(pIndex);
  }

  public int getNumEnteringEdges() {
    return enteringEdges.size();
  }

  public BlockEdge getEnteringEdge(int pIndex) {
    return enteringEdges.get(pIndex);
  }

  /** Successor edges in branch order. The returned list is a snapshot. */
  public ImmutableList<BlockEdge> getLeavingEdges() {
    return ImmutableList.copyOf(leavingEdges);
  }

  /** Predecessor edges in the order they were attached. The returned list is a snapshot. */
  public ImmutableList<BlockEdge> getEnteringEdges() {
    return ImmutableList.copyOf(enteringEdges);
  }

  public boolean hasEdgeTo(BasicBlock pOther) {
    for (BlockEdge edge : leavingEdges) {
      if (edge.getSuccessor() == pOther) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return label;
  }
}
