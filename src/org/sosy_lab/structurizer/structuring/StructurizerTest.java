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

import com.google.common.base.VerifyException;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.BreakStatement;
import org.sosy_lab.structurizer.ast.Expression;
import org.sosy_lab.structurizer.ast.IfElseStatement;
import org.sosy_lab.structurizer.ast.LoopStatement;
import org.sosy_lab.structurizer.ast.RawStatement;
import org.sosy_lab.structurizer.ast.SelectorAssignmentStatement;
import org.sosy_lab.structurizer.ast.SequenceStatement;
import org.sosy_lab.structurizer.ast.Statement;
import org.sosy_lab.structurizer.ast.StatementVisitor;
import org.sosy_lab.structurizer.cfg.BasicBlock;
import org.sosy_lab.structurizer.cfg.BlockGraph;
import org.sosy_lab.structurizer.cfg.BlockGraphCheck;

public class StructurizerTest {

  private final LogManager logger = LogManager.createTestLogManager();

  private AstContext context;
  private BlockGraph graph;

  @Before
  public void setUp() {
    context = new AstContext();
    graph = new BlockGraph("f", context);
  }

  private BasicBlock block(String pName) {
    return graph.createBlock(pName, context.raw(pName));
  }

  private void edge(BasicBlock pFrom, BasicBlock pTo, Expression pCondition) {
    graph.createEdge(pFrom, pTo, pCondition);
  }

  private void edge(BasicBlock pFrom, BasicBlock pTo) {
    edge(pFrom, pTo, context.expressionForTrue());
  }

  /** Counts all break statements of a statement. */
  private static final class BreakCounter implements StatementVisitor<Integer, RuntimeException> {

    @Override
    public Integer visit(SequenceStatement pStatement) {
      int breaks = 0;
      for (Statement statement : pStatement.getStatements()) {
        breaks += statement.accept(this);
      }
      return breaks;
    }

    @Override
    public Integer visit(IfElseStatement pStatement) {
      int breaks = pStatement.getIfBody().accept(this);
      if (pStatement.getElseBody().isPresent()) {
        breaks += pStatement.getElseBody().orElseThrow().accept(this);
      }
      return breaks;
    }

    @Override
    public Integer visit(LoopStatement pStatement) {
      return pStatement.getBody().accept(this);
    }

    @Override
    public Integer visit(BreakStatement pStatement) {
      return 1;
    }

    @Override
    public Integer visit(RawStatement pStatement) {
      return 0;
    }

    @Override
    public Integer visit(SelectorAssignmentStatement pStatement) {
      return 0;
    }
  }

  @Test
  public void diamondJoinIsUnguarded() {
    BasicBlock e = block("e");
    BasicBlock x = block("x");
    BasicBlock y = block("y");
    BasicBlock j = block("j");
    Expression c = context.condition("c");
    edge(e, x, c);
    edge(e, y, context.not(c));
    edge(x, j);
    edge(y, j);

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph));

    assertThat(body.toASTString()).isEqualTo("e; if (!c) { y; } if (c) { x; } j;");
    assertThat(structurizer.getEmittedLoops()).isEqualTo(0);
    assertThat(structurizer.getReducedRegions()).isEqualTo(0);
  }

  @Test
  public void selfLoopBecomesEndlessLoopWithBreak() {
    BasicBlock e = block("e");
    BasicBlock l = block("l");
    BasicBlock x = block("x");
    edge(e, l);
    edge(l, x, context.condition("D"));
    edge(l, l);
    BlockRegion loop = BlockRegion.builder(l, x).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, loop));

    assertThat(body.toASTString()).isEqualTo("e; while (true) { l; if (D) break; } x;");
    SequenceStatement sequence = (SequenceStatement) body;
    Statement loopBlock = ((SequenceStatement) sequence.getStatements().get(1)).getLast();
    assertThat(loopBlock).isInstanceOf(LoopStatement.class);
    assertThat(((LoopStatement) loopBlock).isPreTested()).isTrue();
    assertThat(structurizer.getEmittedLoops()).isEqualTo(1);
    assertThat(structurizer.getEmittedBreaks()).isEqualTo(1);
    assertThat(BlockGraphCheck.check(graph)).isTrue();
  }

  @Test
  public void loopInsideBranchIsGuarded() {
    BasicBlock e = block("e");
    BasicBlock l = block("l");
    BasicBlock x = block("x");
    Expression c = context.condition("c");
    Expression d = context.condition("d");
    edge(e, l, c);
    edge(e, x, context.not(c));
    edge(l, l, d);
    edge(l, x, context.not(d));
    BlockRegion loop = BlockRegion.builder(l, x).build();

    Statement body = new Structurizer(graph, logger).structurize(BlockRegion.topLevel(graph, loop));

    assertThat(body.toASTString()).isEqualTo("e; if (c) { while (true) { l; if (!d) break; } } x;");
  }

  @Test
  public void loopBodyIsGatheredBeforeExit() {
    BasicBlock e = block("e");
    BasicBlock h = block("h");
    BasicBlock a = block("a");
    BasicBlock b = block("b");
    BasicBlock s = block("s");
    BasicBlock d = block("d");
    BasicBlock x = block("x");
    Expression c = context.condition("c");
    Expression p = context.condition("p");
    edge(e, h);
    edge(h, a, c);
    edge(h, x, context.not(c));
    edge(a, b, p);
    edge(a, s, context.not(p));
    edge(b, d);
    edge(s, d);
    edge(d, h);
    BlockRegion branch = BlockRegion.builder(a, d).addBlocks(b, s).build();
    BlockRegion loop = BlockRegion.builder(h, x).addSubRegion(branch).addBlocks(d).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, loop));

    assertThat(body.toASTString())
        .isEqualTo(
            "e; while (true) { h; if (!c) break; "
                + "if (c) { a; if (!p) { s; } if (p) { b; } } if (c) { d; } } x;");
    assertThat(structurizer.getReducedRegions()).isEqualTo(2);
    assertThat(structurizer.getEmittedLoops()).isEqualTo(1);
    assertThat(body.accept(new BreakCounter())).isEqualTo(structurizer.getEmittedBreaks());
  }

  @Test
  public void regionMayShareExitWithParent() {
    BasicBlock e = block("e");
    BasicBlock h = block("h");
    BasicBlock a = block("a");
    BasicBlock b = block("b");
    BasicBlock j = block("j");
    Expression c = context.condition("c");
    edge(e, h);
    edge(h, a, c);
    edge(h, b, context.not(c));
    edge(a, j);
    edge(b, j);
    BlockRegion inner = BlockRegion.builder(a, j).build();
    BlockRegion outer = BlockRegion.builder(h, j).addSubRegion(inner).addBlocks(b).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, outer));

    assertThat(body.toASTString()).isEqualTo("e; h; if (!c) { b; } if (c) { a; } j;");
    assertThat(structurizer.getReducedRegions()).isEqualTo(2);
  }

  /**
   * Two diamonds in sequence, each its own region; the exit of the first is the entry of the
   * second.
   */
  private BlockRegion[] buildTwoDiamonds() {
    BasicBlock e = block("e");
    BasicBlock a1 = block("a1");
    BasicBlock b1 = block("b1");
    BasicBlock j1 = block("j1");
    BasicBlock a2 = block("a2");
    BasicBlock b2 = block("b2");
    BasicBlock j2 = block("j2");
    Expression c = context.condition("c");
    Expression d = context.condition("d");
    edge(e, a1, c);
    edge(e, b1, context.not(c));
    edge(a1, j1);
    edge(b1, j1);
    edge(j1, a2, d);
    edge(j1, b2, context.not(d));
    edge(a2, j2);
    edge(b2, j2);
    return new BlockRegion[] {
      BlockRegion.builder(e, j1).addBlocks(a1, b1).build(),
      BlockRegion.builder(j1, j2).addBlocks(a2, b2).build()
    };
  }

  private static final String TWO_DIAMONDS =
      "e; if (!c) { b1; } if (c) { a1; } j1; if (!d) { b2; } if (d) { a2; } j2;";

  @Test
  public void siblingRegionsInFlowOrder() {
    BlockRegion[] regions = buildTwoDiamonds();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, regions[0], regions[1]));

    assertThat(body.toASTString()).isEqualTo(TWO_DIAMONDS);
    assertThat(structurizer.getReducedRegions()).isEqualTo(2);
  }

  @Test
  public void siblingRegionsInReverseFlowOrder() {
    BlockRegion[] regions = buildTwoDiamonds();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, regions[1], regions[0]));

    assertThat(body.toASTString()).isEqualTo(TWO_DIAMONDS);
    assertThat(structurizer.getReducedRegions()).isEqualTo(2);
  }

  @Test
  public void subregionSharingEntryKeepsGuard() {
    BasicBlock e = block("e");
    BasicBlock h = block("h");
    BasicBlock a = block("a");
    BasicBlock b = block("b");
    BasicBlock j = block("j");
    BasicBlock x = block("x");
    Expression c = context.condition("c");
    Expression d = context.condition("d");
    edge(e, h, c);
    edge(e, x, context.not(c));
    edge(h, a, d);
    edge(h, b, context.not(d));
    edge(a, j);
    edge(b, j);
    edge(j, x);
    BlockRegion branch = BlockRegion.builder(h, j).addBlocks(a, b).build();
    BlockRegion outer = BlockRegion.builder(h, x).addSubRegion(branch).addBlocks(j).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph, outer));

    assertThat(body.toASTString())
        .isEqualTo("e; if (c) { h; if (!d) { b; } if (d) { a; } j; } x;");
    assertThat(structurizer.getReducedRegions()).isEqualTo(2);
  }

  @Test
  public void irreducibleLoopAfterNormalization() throws InvalidConfigurationException {
    BasicBlock e = block("e");
    BasicBlock a = block("a");
    BasicBlock b = block("b");
    BasicBlock x = block("x");
    Expression c = context.condition("c");
    Expression p = context.condition("p");
    Expression q = context.condition("q");
    edge(e, a, c);
    edge(e, b, context.not(c));
    edge(a, b, p);
    edge(a, x, context.not(p));
    edge(b, a, q);
    edge(b, x, context.not(q));

    new LoopNormalizer(Configuration.defaultConfiguration(), logger).normalize(graph);
    BasicBlock redirector = graph.getBlock(4);
    BlockRegion loop = BlockRegion.builder(redirector, x).addBlocks(a, b).build();
    Statement body = new Structurizer(graph, logger).structurize(BlockRegion.topLevel(graph, loop));

    assertThat(body.toASTString())
        .isEqualTo(
            "e; if (c) { redirect0 = 0; } if (!c) { redirect0 = 1; } "
                + "while (true) { "
                + "if ((redirect0 == 0)) { a; if (!p) break; } "
                + "if ((((redirect0 == 0) && p) || (redirect0 == 1))) "
                + "{ b; if (q) { redirect0 = 0; } if (!q) break; } "
                + "} x;");
  }

  @Test
  public void loopSpanningWholeFunctionIsNotWrapped() {
    BasicBlock e = block("e");
    BasicBlock a = block("a");
    edge(e, a);
    edge(a, e);

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body = structurizer.structurize(BlockRegion.topLevel(graph));

    assertThat(body.toASTString()).isEqualTo("e; a;");
    assertThat(structurizer.getEmittedLoops()).isEqualTo(0);
  }

  @Test
  public void exitBeforeEntryIsMalformed() {
    BasicBlock e = block("e");
    BasicBlock x = block("x");
    BasicBlock j = block("j");
    edge(e, x);
    edge(x, j);
    BlockRegion reversed = BlockRegion.builder(x, e).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    VerifyException thrown =
        assertThrows(
            VerifyException.class,
            () -> structurizer.structurize(BlockRegion.topLevel(graph, reversed)));
    assertThat(thrown).hasMessageThat().contains("function f");
  }

  @Test
  public void unreachableEntryIsMalformed() {
    BasicBlock e = block("e");
    BasicBlock x = block("x");
    BasicBlock dead = block("dead");
    edge(e, x);
    edge(dead, x);
    BlockRegion unreachable = BlockRegion.builder(dead, x).build();

    Structurizer structurizer = new Structurizer(graph, logger);
    assertThrows(
        VerifyException.class,
        () -> structurizer.structurize(BlockRegion.topLevel(graph, unreachable)));
  }

  @Test
  public void functionIsStructurizedOnlyOnce() {
    block("e");
    Structurizer structurizer = new Structurizer(graph, logger);
    BlockRegion top = BlockRegion.topLevel(graph);

    assertThat(structurizer.structurize(top).toASTString()).isEqualTo("e;");
    assertThrows(IllegalStateException.class, () -> structurizer.structurize(top));
  }

  @Test
  public void nestedRegionIsRejectedAsRoot() {
    BasicBlock e = block("e");
    BasicBlock x = block("x");
    edge(e, x);

    Structurizer structurizer = new Structurizer(graph, logger);
    assertThrows(
        IllegalArgumentException.class,
        () -> structurizer.structurize(BlockRegion.builder(e, x).build()));
  }
}
