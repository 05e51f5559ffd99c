// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0


package org.sosy_lab.structurizer.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.cfg.BasicBlock;
import org.sosy_lab.structurizer.cfg.BlockGraph;

public class BlockRegionTest {

  private AstContext context;
  private BlockGraph graph;
  private BasicBlock e;
  private BasicBlock h;
  private BasicBlock a;
  private BasicBlock x;

  @Before
  public void setUp() {
    context = new AstContext();
    graph = new BlockGraph("f", context);
    e = graph.createBlock("e", context.raw("e"));
    h = graph.createBlock("h", context.raw("h"));
    a = graph.createBlock("a", context.raw("a"));
    x = graph.createBlock("x", context.raw("x"));
  }

  @Test
  public void nestedRegionsContainTheirBlocks() {
    BlockRegion inner = BlockRegion.builder(a, h).build();
    BlockRegion outer = BlockRegion.builder(h, x).addSubRegion(inner).build();
    BlockRegion top = BlockRegion.topLevel(graph, outer);

    assertThat(inner.contains(a)).isTrue();
    assertThat(inner.contains(h)).isFalse();
    assertThat(outer.contains(a)).isTrue();
    assertThat(outer.contains(h)).isTrue();
    assertThat(outer.contains(x)).isFalse();
    assertThat(outer.getSubRegions()).containsExactly(inner);
    assertThat(outer.getExit().orElseThrow()).isSameInstanceAs(x);

    assertThat(top.isTopLevelRegion()).isTrue();
    assertThat(top.getEntry()).isSameInstanceAs(e);
    assertThat(top.getExit().isPresent()).isFalse();
    assertThat(top.contains(x)).isTrue();
  }

  @Test
  public void exitMustBeOutside() {
    assertThrows(
        IllegalArgumentException.class, () -> BlockRegion.builder(h, x).addBlocks(x).build());
    assertThrows(IllegalArgumentException.class, () -> BlockRegion.builder(h, h).build());
  }

  @Test
  public void blocksMustBelongToOneFunction() {
    BlockGraph other = new BlockGraph("g", context);
    BasicBlock foreign = other.createBlock("foreign", context.raw(""));
    BasicBlock foreignExit = other.createBlock("foreignExit", context.raw(""));

    assertThrows(IllegalArgumentException.class, () -> BlockRegion.builder(h, foreign));
    assertThrows(
        IllegalArgumentException.class, () -> BlockRegion.builder(h, x).addBlocks(foreign).build());
    BlockRegion foreignRegion = BlockRegion.builder(foreign, foreignExit).build();
    assertThrows(IllegalArgumentException.class, () -> BlockRegion.topLevel(graph, foreignRegion));
  }

  @Test
  public void topLevelRegionCannotBeNested() {
    BlockRegion top = BlockRegion.topLevel(graph);
    assertThrows(
        IllegalArgumentException.class, () -> BlockRegion.builder(h, x).addSubRegion(top));
  }
}
