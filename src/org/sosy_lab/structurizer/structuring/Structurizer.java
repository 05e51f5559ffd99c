// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.structuring;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import com.google.common.base.VerifyException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.Expression;
import org.sosy_lab.structurizer.ast.LoopStatement.ConditionPosition;
import org.sosy_lab.structurizer.ast.SequenceStatement;
import org.sosy_lab.structurizer.ast.Statement;
import org.sosy_lab.structurizer.cfg.BasicBlock;
import org.sosy_lab.structurizer.cfg.BasicBlock.BlockKind;
import org.sosy_lab.structurizer.cfg.BlockEdge;
import org.sosy_lab.structurizer.cfg.BlockGraph;
import org.sosy_lab.structurizer.cfg.BlockGraphUtils;

/**
 * Builds the structured body of one function from its block graph and region tree.
 *
 * <p>All blocks are kept in one list in reverse postorder. Regions are reduced innermost first:
 * the blocks of a region are gathered into a contiguous range of that list, which is folded into
 * one statement and then replaced by a single new block of kind {@link BlockKind#REGION}. Each
 * block in a range is guarded by its reaching condition, the disjunction over its entering edges
 * of the source's reaching condition and the edge condition. A range with an edge back into itself
 * becomes an endless loop, and every edge from inside the range to the exit of its region becomes
 * a conditional break.
 *
 * <p>The block graph is consumed by this process. One instance structurizes one function once.
 */
public class Structurizer {

  private final BlockGraph graph;
  private final AstContext context;
  private final LogManager logger;

  /** All blocks not yet folded, in reverse postorder. */
  private final List<BasicBlock> blocks;

  /** Region each synthetic block stands for, to decide membership of synthetic blocks. */
  private final Map<BasicBlock, Region> foldedRegions = new HashMap<>();

  /** Block that replaced the entry of each reduced region. */
  private final Map<BasicBlock, BasicBlock> replacedEntries = new HashMap<>();

  private boolean done = false;
  private int reducedRegions = 0;
  private int emittedLoops = 0;
  private int emittedBreaks = 0;

  public Structurizer(BlockGraph pGraph, LogManager pLogger) {
    graph = pGraph;
    context = pGraph.getContext();
    logger = pLogger.withComponentName(Structurizer.class.getSimpleName());
    blocks = new ArrayList<>(BlockGraphUtils.reversePostorder(pGraph));
  }

  /**
   * Fold the whole function into one statement.
   *
   * @param pTopLevelRegion the region tree of the graph, computed after loop normalization
   * @throws VerifyException if a region does not match the block graph
   */
  public Statement structurize(Region pTopLevelRegion) throws VerifyException {
    checkState(!done, "function %s is already structurized", graph.getFunctionName());
    checkArgument(pTopLevelRegion.isTopLevelRegion(), "%s is no top-level region", pTopLevelRegion);
    done = true;

    Statement body = reduceRegion(pTopLevelRegion, 0, blocks.size());
    logger.log(
        Level.FINE,
        "Function",
        graph.getFunctionName(),
        "structurized with",
        reducedRegions,
        "regions and",
        emittedLoops,
        "loops");
    return body;
  }

  /**
   * Reduce all subregions of the region, then fold what is left of the range.
   *
   * @param pBegin index of the region's entry block
   * @param pEnd index after the region's last block
   */
  private Statement reduceRegion(Region pRegion, int pBegin, int pEnd) {
    int regionEnd = pEnd;
    Queue<Region> worklist = new ArrayDeque<>(pRegion.getSubRegions());

    while (!worklist.isEmpty()) {
      Region subRegion = worklist.remove();
      BasicBlock entry = currentBlock(subRegion.getEntry());
      verify(
          subRegion.getExit().isPresent(),
          "Subregion %s of function %s has no exit",
          subRegion,
          graph.getFunctionName());
      // a sibling reduced earlier may start at this exit
      BasicBlock exit = currentBlock(subRegion.getExit().orElseThrow());

      int subBegin = blocks.subList(pBegin, regionEnd).indexOf(entry);
      verify(
          subBegin >= 0,
          "Entry %s of %s not found among blocks %s of function %s",
          entry,
          subRegion,
          blocks.subList(pBegin, regionEnd),
          graph.getFunctionName());
      subBegin += pBegin;
      verify(
          blocks.indexOf(exit) > subBegin,
          "Exit %s of %s is not placed after its entry among blocks %s of function %s",
          exit,
          subRegion,
          blocks.subList(pBegin, regionEnd),
          graph.getFunctionName());
      int subEnd = gatherBlocks(subRegion, subBegin, regionEnd);

      int sizeBefore = blocks.size();
      Statement statement = reduceRegion(subRegion, subBegin, subEnd);
      int removed = sizeBefore - blocks.size();
      subEnd -= removed;
      regionEnd -= removed;

      BasicBlock regionBlock = graph.createSyntheticBlock(BlockKind.REGION, statement);
      List<BasicBlock> range = blocks.subList(subBegin, subEnd);
      regionEnd -= range.size() - 1;
      range.clear();
      blocks.add(subBegin, regionBlock);
      foldedRegions.put(regionBlock, subRegion);

      replaceByBlock(subRegion, regionBlock);
      replacedEntries.put(subRegion.getEntry(), regionBlock);
      reducedRegions++;
    }

    return foldBlocks(
        pBegin, regionEnd, pRegion.getExit().map(this::currentBlock).orElse(null));
  }

  /** The block that currently stands for the given block in the list of unfolded blocks. */
  private BasicBlock currentBlock(BasicBlock pBlock) {
    BasicBlock block = pBlock;
    BasicBlock replacement = replacedEntries.get(block);
    while (replacement != null) {
      block = replacement;
      replacement = replacedEntries.get(block);
    }
    return block;
  }

  /**
   * Move the blocks of the region that lie in the given range to the front of the range, keeping
   * their relative order. Reverse postorder may place blocks that follow a region, e.g. the exit
   * of a loop, between the blocks of the region.
   *
   * @return index after the last block of the region
   */
  private int gatherBlocks(Region pRegion, int pBegin, int pEnd) {
    List<BasicBlock> range = blocks.subList(pBegin, pEnd);
    List<BasicBlock> inside = new ArrayList<>();
    List<BasicBlock> outside = new ArrayList<>();
    for (BasicBlock block : range) {
      if (isInside(pRegion, block)) {
        inside.add(block);
      } else {
        outside.add(block);
      }
    }
    range.clear();
    range.addAll(inside);
    range.addAll(outside);
    return pBegin + inside.size();
  }

  /**
   * Connect the block of a reduced region to the rest of the graph. Edges into the entry from
   * outside now enter the block, edges into entry or exit from inside are dropped, and the block
   * gets a single unconditional edge to the exit.
   */
  private void replaceByBlock(Region pRegion, BasicBlock pRegionBlock) {
    BasicBlock entry = currentBlock(pRegion.getEntry());
    BasicBlock exit = currentBlock(pRegion.getExit().orElseThrow());

    for (BlockEdge edge : entry.getEnteringEdges()) {
      if (isInside(pRegion, edge.getPredecessor())) {
        graph.removeEdge(edge);
      } else {
        graph.retarget(edge, pRegionBlock);
      }
    }
    for (BlockEdge edge : exit.getEnteringEdges()) {
      if (isInside(pRegion, edge.getPredecessor())) {
        graph.removeEdge(edge);
      }
    }
    graph.createEdge(pRegionBlock, exit, context.expressionForTrue());
  }

  private boolean isInside(Region pRegion, BasicBlock pBlock) {
    BasicBlock block = pBlock;
    Region folded = foldedRegions.get(block);
    while (folded != null) {
      block = folded.getEntry();
      folded = foldedRegions.get(block);
    }
    return pRegion.contains(block);
  }

  /**
   * Fold the blocks in the given range of the list into one statement.
   *
   * @param pSuccessor the block control flow continues with after the range, if any
   */
  private Statement foldBlocks(int pBegin, int pEnd, @Nullable BasicBlock pSuccessor) {
    SequenceStatement result = context.sequence();
    Map<BasicBlock, Expression> reachingConditions = new HashMap<>();
    Set<BasicBlock> visited = new HashSet<>();
    boolean isLoop = false;

    for (BasicBlock block : blocks.subList(pBegin, pEnd)) {
      visited.add(block);
      isLoop = isLoop || BlockGraphUtils.successorsOf(block).anyMatch(visited::contains);

      Expression reachingCondition = computeReachingCondition(block, reachingConditions);
      SequenceStatement blockStatement = asSequence(block);
      if (AstContext.isTrue(reachingCondition)) {
        result.pushBack(blockStatement);
      } else {
        result.pushBack(context.ifElse(reachingCondition, blockStatement));
      }

      Expression previous = reachingConditions.put(block, reachingCondition);
      verify(
          previous == null,
          "Reaching condition of block %s in function %s is computed twice",
          block,
          graph.getFunctionName());
    }

    // without a successor the range is the whole function, there is nothing to break to
    if (!isLoop || pSuccessor == null) {
      return result;
    }

    for (BlockEdge edge : pSuccessor.getEnteringEdges()) {
      if (visited.contains(edge.getPredecessor())) {
        asSequence(edge.getPredecessor()).pushBack(context.breakStatement(edge.getCondition()));
        emittedBreaks++;
      }
    }
    logger.log(Level.FINER, "Blocks", blocks.subList(pBegin, pEnd), "form a loop");
    emittedLoops++;
    return context.loop(context.expressionForTrue(), ConditionPosition.PRE_TESTED, result);
  }

  /**
   * Sources without a reaching condition, i.e., sources outside of the range and sources of
   * back-edges, contribute {@code true}.
   */
  private Expression computeReachingCondition(
      BasicBlock pBlock, Map<BasicBlock, Expression> pReachingConditions) {
    Expression result = null;
    for (BlockEdge edge : pBlock.getEnteringEdges()) {
      Expression sourceCondition = pReachingConditions.get(edge.getPredecessor());
      Expression pathCondition;
      if (sourceCondition == null) {
        pathCondition = context.expressionForTrue();
      } else if (edge.isUnconditional()) {
        pathCondition = sourceCondition;
      } else {
        pathCondition = context.and(sourceCondition, edge.getCondition());
      }
      result = result == null ? pathCondition : context.or(result, pathCondition);
    }
    return result == null ? context.expressionForTrue() : result;
  }

  private SequenceStatement asSequence(BasicBlock pBlock) {
    Statement statement = pBlock.getStatement();
    if (statement instanceof SequenceStatement) {
      return (SequenceStatement) statement;
    }
    SequenceStatement sequence = context.sequence(statement);
    pBlock.setStatement(sequence);
    return sequence;
  }

  public int getReducedRegions() {
    return reducedRegions;
  }

  public int getEmittedLoops() {
    return emittedLoops;
  }

  public int getEmittedBreaks() {
    return emittedBreaks;
  }
}
