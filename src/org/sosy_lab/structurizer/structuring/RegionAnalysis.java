// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.structuring;

import org.sosy_lab.structurizer.cfg.BlockGraph;

/**
 * Computes the region tree of a (normalized) block graph, typically from its dominator tree,
 * postdominator tree, and dominance frontiers.
 */
@FunctionalInterface
public interface RegionAnalysis {

  /** Returns the top-level region of the graph. */
  Region computeRegions(BlockGraph pGraph);
}
