// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.Expression;
import org.sosy_lab.structurizer.ast.Statement;
import org.sosy_lab.structurizer.cfg.BasicBlock.BlockKind;

/**
 * Blocks and edges of one function. The graph owns all of its blocks, blocks are never removed,
 * even if they become unreachable after they were folded into a region. The first block created is
 * the entry block of the function.
 *
 * <p>All changes of the edge lists of blocks go through this class, so that the successor list of
 * the source and the predecessor list of the target of an edge stay consistent.
 */
public final class BlockGraph {

  private final String functionName;
  private final AstContext context;
  private final List<BasicBlock> blocks = new ArrayList<>();
  private final List<BlockEdge> edges = new ArrayList<>();

  public BlockGraph(String pFunctionName, AstContext pContext) {
    functionName = checkNotNull(pFunctionName);
    context = checkNotNull(pContext);
  }

  public String getFunctionName() {
    return functionName;
  }

  public AstContext getContext() {
    return context;
  }

  /** Creates a block for a basic block of the function. */
  public BasicBlock createBlock(String pLabel, Statement pStatement) {
    return addBlock(pLabel, BlockKind.ORIGINAL, pStatement);
  }

  /** Creates a block that does not correspond to a basic block of the function. */
  public BasicBlock createSyntheticBlock(BlockKind pKind, Statement pStatement) {
    checkArgument(pKind != BlockKind.ORIGINAL);
    String prefix = pKind == BlockKind.REDIRECTOR ? "redirector" : "region";
    return addBlock(prefix + blocks.size(), pKind, pStatement);
  }

  private BasicBlock addBlock(String pLabel, BlockKind pKind, Statement pStatement) {
    BasicBlock block = new BasicBlock(this, blocks.size(), pLabel, pKind, pStatement);
    blocks.add(block);
    return block;
  }

  public BlockEdge createEdge(BasicBlock pFrom, BasicBlock pTo, Expression pCondition) {
    checkOwnBlock(pFrom);
    checkOwnBlock(pTo);
    BlockEdge edge = new BlockEdge(pFrom, pTo, pCondition);
    pFrom.leavingEdges.add(edge);
    pTo.enteringEdges.add(edge);
    edges.add(edge);
    return edge;
  }

  /** Lets the edge point to a new target, keeping its source and condition. */
  public void retarget(BlockEdge pEdge, BasicBlock pNewSuccessor) {
    checkOwnBlock(pNewSuccessor);
    BasicBlock oldSuccessor = pEdge.getSuccessor();
    checkArgument(oldSuccessor.enteringEdges.remove(pEdge), "edge %s is not attached", pEdge);
    pEdge.setSuccessor(pNewSuccessor);
    pNewSuccessor.enteringEdges.add(pEdge);
  }

  /** Detaches the edge from both of its blocks. */
  public void removeEdge(BlockEdge pEdge) {
    checkArgument(edges.remove(pEdge), "edge %s is not part of %s", pEdge, functionName);
    boolean removed = pEdge.getPredecessor().leavingEdges.remove(pEdge);
    removed &= pEdge.getSuccessor().enteringEdges.remove(pEdge);
    assert removed : "edge lists of " + pEdge + " were inconsistent";
  }

  private void checkOwnBlock(BasicBlock pBlock) {
    checkArgument(
        pBlock.getGraph() == this, "block %s does not belong to %s", pBlock, functionName);
  }

  public BasicBlock getEntryBlock() {
    checkState(!blocks.isEmpty(), "function %s has no blocks", functionName);
    return blocks.get(0);
  }

  public BasicBlock getBlock(int pBlockNumber) {
    return blocks.get(pBlockNumber);
  }

  public int getNumBlocks() {
    return blocks.size();
  }

  public ImmutableList<BasicBlock> getBlocks() {
    return ImmutableList.copyOf(blocks);
  }

  /** All edges that are currently attached to blocks. */
  public ImmutableList<BlockEdge> getEdges() {
    return ImmutableList.copyOf(edges);
  }

  @Override
  public String toString() {
    return "block graph of " + functionName + " (" + blocks.size() + " blocks)";
  }
}
