// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.structuring;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.sosy_lab.structurizer.cfg.BasicBlock;

/**
 * Single-entry single-exit part of a block graph, as computed by a {@link RegionAnalysis}. Regions
 * are nested: the top-level region spans the whole function and has no exit, every other region
 * has exactly one entry block inside and one exit block outside of it.
 *
 * <p>The structurizer only reads regions, it never modifies the region tree.
 */
public interface Region {

  BasicBlock getEntry();

  /** The first block after the region; empty only for the top-level region. */
  Optional<BasicBlock> getExit();

  /** Directly nested regions. */
  ImmutableList<Region> getSubRegions();

  /** Whether the block lies inside this region or one of its subregions. */
  boolean contains(BasicBlock pBlock);

  default boolean isTopLevelRegion() {
    return getExit().isEmpty();
  }
}
