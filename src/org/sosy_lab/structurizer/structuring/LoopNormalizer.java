// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.structuring;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.Expression;
import org.sosy_lab.structurizer.ast.SequenceStatement;
import org.sosy_lab.structurizer.ast.Statement;
import org.sosy_lab.structurizer.cfg.BasicBlock;
import org.sosy_lab.structurizer.cfg.BasicBlock.BlockKind;
import org.sosy_lab.structurizer.cfg.BlockEdge;
import org.sosy_lab.structurizer.cfg.BlockGraph;
import org.sosy_lab.structurizer.cfg.StronglyConnectedComponents;

/**
 * Turns every cycle of a block graph into a loop with a single entry block and a single exit
 * block. A strongly connected component with several entry blocks gets a redirector block that all
 * entering edges and back-edges are routed through; likewise for several exit blocks. The
 * redirector then dispatches to the block each routed edge pointed to.
 *
 * <p>Only maximal components are normalized, cycles nested inside of them are left as they are.
 *
 * <p>A back-edge is an edge to a block that is still on the stack of the depth-first search from
 * the component's first block. Edges to blocks the search has already finished, such as the
 * second edge into a join inside a loop body, are not back-edges and are never redirected. A loop
 * whose only cycle-closing edges target its header is therefore left unchanged.
 */
@Options(prefix = "structurizer.loops")
public class LoopNormalizer {

  public enum RedirectorDispatch {
    /**
     * Each routed edge stores the index of its original target in a fresh selector variable, the
     * redirector compares the selector with these indices.
     */
    SELECTOR_VARIABLE,
    /** The redirector branches on the disjunction of the routed edges' conditions. */
    EDGE_CONDITION
  }

  @Option(
      secure = true,
      name = "redirectorDispatch",
      description =
          "how a redirector block inserted for a loop with several entries or exits chooses "
              + "the block a redirected edge originally pointed to")
  private RedirectorDispatch dispatch = RedirectorDispatch.SELECTOR_VARIABLE;

  private final LogManager logger;

  public LoopNormalizer(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger.withComponentName(LoopNormalizer.class.getSimpleName());
  }

  /**
   * Normalize all maximal cycles of the graph.
   *
   * @return the number of inserted redirector blocks
   */
  public int normalize(BlockGraph pGraph) {
    int redirectors = 0;
    for (ImmutableList<BasicBlock> component :
        StronglyConnectedComponents.of(pGraph).getCyclicComponents()) {
      redirectors += normalizeComponent(pGraph, component);
    }
    if (redirectors > 0) {
      logger.log(
          Level.FINE,
          "Inserted",
          redirectors,
          "redirector blocks into function",
          pGraph.getFunctionName());
    }
    return redirectors;
  }

  /** The first block of the component is the first one in reverse postorder. */
  private int normalizeComponent(BlockGraph pGraph, List<BasicBlock> pComponent) {
    Set<BasicBlock> members = ImmutableSet.copyOf(pComponent);
    Set<BasicBlock> entryBlocks = new LinkedHashSet<>();
    Set<BasicBlock> exitBlocks = new LinkedHashSet<>();
    Set<BlockEdge> enteringEdges = new LinkedHashSet<>();
    List<BlockEdge> exitingEdges = new ArrayList<>();

    for (BasicBlock block : pComponent) {
      for (BlockEdge edge : block.getEnteringEdges()) {
        if (!members.contains(edge.getPredecessor())) {
          entryBlocks.add(block);
          enteringEdges.add(edge);
        }
      }
      for (BlockEdge edge : block.getLeavingEdges()) {
        if (!members.contains(edge.getSuccessor())) {
          exitBlocks.add(edge.getSuccessor());
          exitingEdges.add(edge);
        }
      }
    }

    // the targets of back-edges are loop headers as well
    for (BlockEdge backEdge : collectBackEdges(pComponent.get(0), members)) {
      entryBlocks.add(backEdge.getSuccessor());
      enteringEdges.add(backEdge);
    }

    int redirectors = 0;
    if (entryBlocks.size() > 1) {
      BasicBlock redirector = createRedirectorBlock(pGraph, enteringEdges);
      logger.log(Level.FINER, "Entries", entryBlocks, "of loop are routed through", redirector);
      redirectors++;
    }
    if (exitBlocks.size() > 1) {
      BasicBlock redirector = createRedirectorBlock(pGraph, exitingEdges);
      logger.log(Level.FINER, "Exits", exitBlocks, "of loop are routed through", redirector);
      redirectors++;
    }
    return redirectors;
  }

  /**
   * Depth-first search inside the component, starting at its first block. An edge is a back-edge
   * if its target is still on the search stack.
   */
  private static List<BlockEdge> collectBackEdges(BasicBlock pRoot, Set<BasicBlock> pMembers) {
    List<BlockEdge> backEdges = new ArrayList<>();
    Set<BasicBlock> visited = new HashSet<>();
    Set<BasicBlock> onStack = new HashSet<>();
    // pairs of block and index of the next leaving edge to look at
    Deque<BasicBlock> blockStack = new ArrayDeque<>();
    Deque<Integer> indexStack = new ArrayDeque<>();

    visited.add(pRoot);
    onStack.add(pRoot);
    blockStack.push(pRoot);
    indexStack.push(0);

    while (!blockStack.isEmpty()) {
      BasicBlock block = blockStack.peek();
      int index = indexStack.pop();
      if (index >= block.getNumLeavingEdges()) {
        blockStack.pop();
        onStack.remove(block);
        continue;
      }
      indexStack.push(index + 1);

      BlockEdge edge = block.getLeavingEdge(index);
      BasicBlock successor = edge.getSuccessor();
      if (!pMembers.contains(successor)) {
        continue;
      }
      if (onStack.contains(successor)) {
        backEdges.add(edge);
      } else if (visited.add(successor)) {
        onStack.add(successor);
        blockStack.push(successor);
        indexStack.push(0);
      }
    }
    return backEdges;
  }

  /**
   * Insert a new block that all given edges are retargeted to. The new block has one leaving edge
   * for each distinct original target, in the order the targets first appear among the edges.
   */
  private BasicBlock createRedirectorBlock(BlockGraph pGraph, Collection<BlockEdge> pEdges) {
    AstContext context = pGraph.getContext();
    BasicBlock redirector = pGraph.createSyntheticBlock(BlockKind.REDIRECTOR, context.sequence());

    ListMultimap<BasicBlock, BlockEdge> edgesByTarget =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (BlockEdge edge : pEdges) {
      edgesByTarget.put(edge.getSuccessor(), edge);
    }

    @Nullable String selector =
        dispatch == RedirectorDispatch.SELECTOR_VARIABLE ? context.newSelector() : null;
    int index = 0;
    for (BasicBlock target : ImmutableList.copyOf(edgesByTarget.keySet())) {
      List<BlockEdge> edges = edgesByTarget.get(target);
      Expression condition;
      switch (dispatch) {
        case SELECTOR_VARIABLE:
          assert selector != null;
          condition = context.selectorEquals(selector, index);
          for (BlockEdge edge : edges) {
            assignSelector(context, edge, selector, index);
          }
          break;
        case EDGE_CONDITION:
          condition = null;
          for (BlockEdge edge : edges) {
            Expression edgeCondition = edge.getCondition();
            condition = condition == null ? edgeCondition : context.or(condition, edgeCondition);
          }
          break;
        default:
          throw new AssertionError("unhandled dispatch " + dispatch);
      }

      for (BlockEdge edge : edges) {
        pGraph.retarget(edge, redirector);
      }
      pGraph.createEdge(redirector, target, condition);
      index++;
    }
    return redirector;
  }

  /** Append the selector assignment for the edge to the statement of its source block. */
  private static void assignSelector(
      AstContext pContext, BlockEdge pEdge, String pSelector, int pValue) {
    BasicBlock source = pEdge.getPredecessor();
    Statement statement = source.getStatement();
    SequenceStatement sequence;
    if (statement instanceof SequenceStatement) {
      sequence = (SequenceStatement) statement;
    } else {
      sequence = pContext.sequence(statement);
      source.setStatement(sequence);
    }

    Statement assignment = pContext.assignSelector(pSelector, pValue);
    if (pEdge.isUnconditional()) {
      sequence.pushBack(assignment);
    } else {
      sequence.pushBack(pContext.ifElse(pEdge.getCondition(), assignment));
    }
  }
}
