// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.structuring;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurizer.cfg.BasicBlock;
import org.sosy_lab.structurizer.cfg.BlockGraph;

/** Immutable {@link Region} that stores its blocks explicitly. */
public final class BlockRegion implements Region {

  private final BlockGraph graph;
  private final BasicBlock entry;
  private final @Nullable BasicBlock exit;
  // all blocks inside, including those of subregions; unused for the top-level region
  private final ImmutableSet<BasicBlock> blocks;
  private final ImmutableList<Region> subRegions;

  private BlockRegion(
      BasicBlock pEntry,
      @Nullable BasicBlock pExit,
      ImmutableSet<BasicBlock> pBlocks,
      ImmutableList<Region> pSubRegions) {
    graph = pEntry.getGraph();
    entry = pEntry;
    exit = pExit;
    blocks = pBlocks;
    subRegions = pSubRegions;
  }

  /** The region spanning the whole function. */
  public static BlockRegion topLevel(BlockGraph pGraph, BlockRegion... pSubRegions) {
    for (BlockRegion sub : pSubRegions) {
      checkArgument(sub.graph == pGraph, "region %s belongs to another function", sub);
      checkArgument(!sub.isTopLevelRegion(), "top-level region %s cannot be nested", sub);
    }
    return new BlockRegion(
        pGraph.getEntryBlock(), null, ImmutableSet.of(), ImmutableList.copyOf(pSubRegions));
  }

  public static Builder builder(BasicBlock pEntry, BasicBlock pExit) {
    return new Builder(pEntry, pExit);
  }

  @Override
  public BasicBlock getEntry() {
    return entry;
  }

  @Override
  public Optional<BasicBlock> getExit() {
    return Optional.ofNullable(exit);
  }

  @Override
  public ImmutableList<Region> getSubRegions() {
    return subRegions;
  }

  @Override
  public boolean contains(BasicBlock pBlock) {
    if (exit == null) {
      return pBlock.getGraph() == graph;
    }
    return blocks.contains(pBlock);
  }

  @Override
  public String toString() {
    if (exit == null) {
      return "top-level region of " + graph.getFunctionName();
    }
    return "region " + entry + " => " + exit;
  }

  public static final class Builder {

    private final BasicBlock entry;
    private final BasicBlock exit;
    private final ImmutableSet.Builder<BasicBlock> blocks = ImmutableSet.builder();
    private final ImmutableList.Builder<Region> subRegions = ImmutableList.builder();

    private Builder(BasicBlock pEntry, BasicBlock pExit) {
      entry = checkNotNull(pEntry);
      exit = checkNotNull(pExit);
      checkArgument(entry.getGraph() == exit.getGraph(), "entry and exit in different functions");
      blocks.add(entry);
    }

    public Builder addBlocks(BasicBlock... pBlocks) {
      blocks.addAll(Arrays.asList(pBlocks));
      return this;
    }

    /** Nests the region and adds all of its blocks to this region. */
    public Builder addSubRegion(BlockRegion pSubRegion) {
      checkArgument(!pSubRegion.isTopLevelRegion(), "top-level region cannot be nested");
      blocks.addAll(pSubRegion.blocks);
      subRegions.add(pSubRegion);
      return this;
    }

    public BlockRegion build() {
      ImmutableSet<BasicBlock> allBlocks = blocks.build();
      checkArgument(!allBlocks.contains(exit), "exit %s must not be inside the region", exit);
      for (BasicBlock block : allBlocks) {
        checkArgument(
            block.getGraph() == entry.getGraph(), "block %s from another function", block);
      }
      return new BlockRegion(entry, exit, allBlocks, subRegions.build());
    }
  }
}
