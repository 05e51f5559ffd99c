// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maximal strongly connected components of the blocks that are reachable from the entry block.
 *
 * <p>Components are computed like Kosaraju does: blocks are taken in reverse postorder, and each
 * block that is not yet assigned collects all unassigned blocks that reach it. Components are
 * returned in the reverse postorder of their first block, and the blocks of each component are
 * sorted by reverse postorder as well.
 */
public final class StronglyConnectedComponents {

  private final ImmutableList<ImmutableList<BasicBlock>> components;

  private StronglyConnectedComponents(ImmutableList<ImmutableList<BasicBlock>> pComponents) {
    components = pComponents;
  }

  public static StronglyConnectedComponents of(BlockGraph pGraph) {
    ImmutableList<BasicBlock> order = BlockGraphUtils.reversePostorder(pGraph);
    Map<BasicBlock, Integer> position = new HashMap<>();
    for (BasicBlock block : order) {
      position.put(block, position.size());
    }
    Comparator<BasicBlock> byPosition = Comparator.comparing(position::get);

    ImmutableList.Builder<ImmutableList<BasicBlock>> result = ImmutableList.builder();
    Set<BasicBlock> assigned = new HashSet<>();
    Deque<BasicBlock> waitlist = new ArrayDeque<>();

    for (BasicBlock root : order) {
      if (!assigned.add(root)) {
        continue;
      }

      ImmutableList.Builder<BasicBlock> component = ImmutableList.builder();
      waitlist.push(root);
      while (!waitlist.isEmpty()) {
        BasicBlock block = waitlist.pop();
        component.add(block);
        for (BasicBlock predecessor : BlockGraphUtils.predecessorsOf(block)) {
          // unreachable predecessors do not belong to any component
          if (position.containsKey(predecessor) && assigned.add(predecessor)) {
            waitlist.push(predecessor);
          }
        }
      }
      result.add(ImmutableList.sortedCopyOf(byPosition, component.build()));
    }

    return new StronglyConnectedComponents(result.build());
  }

  public ImmutableList<ImmutableList<BasicBlock>> getComponents() {
    return components;
  }

  /** Components that contain a cycle, i.e., loops of the function. */
  public ImmutableList<ImmutableList<BasicBlock>> getCyclicComponents() {
    ImmutableList.Builder<ImmutableList<BasicBlock>> result = ImmutableList.builder();
    for (ImmutableList<BasicBlock> component : components) {
      if (hasCycle(component)) {
        result.add(component);
      }
    }
    return result.build();
  }

  public static boolean hasCycle(List<BasicBlock> pComponent) {
    if (pComponent.size() > 1) {
      return true;
    }
    BasicBlock block = pComponent.get(0);
    return block.hasEdgeTo(block);
  }
}
