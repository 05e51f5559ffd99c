// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.structurizer.ast.LoopStatement.ConditionPosition;

public class AstContextTest {

  private AstContext context;
  private Expression c;
  private Expression d;

  @Before
  public void setUp() {
    context = new AstContext();
    c = context.condition("c");
    d = context.condition("d");
  }

  @Test
  public void conjunctionWithTrueIsOtherOperand() {
    assertThat(context.and(context.expressionForTrue(), c)).isSameInstanceAs(c);
    assertThat(context.and(c, context.expressionForTrue())).isSameInstanceAs(c);
    assertThat(context.and(c, context.condition("c"))).isEqualTo(c);
  }

  @Test
  public void conjunctionIsNotSimplifiedFurther() {
    Expression conjunction = context.and(c, context.not(c));
    assertThat(conjunction).isInstanceOf(ShortCircuitExpression.class);
    assertThat(conjunction.toASTString()).isEqualTo("(c && !c)");
  }

  @Test
  public void disjunctionWithTrueIsTrue() {
    assertThat(AstContext.isTrue(context.or(context.expressionForTrue(), c))).isTrue();
    assertThat(AstContext.isTrue(context.or(c, context.expressionForTrue()))).isTrue();
  }

  @Test
  public void disjunctionOfComplementsIsTrue() {
    assertThat(AstContext.isTrue(context.or(c, context.not(c)))).isTrue();
    assertThat(AstContext.isTrue(context.or(context.not(c), c))).isTrue();
    assertThat(AstContext.isTrue(context.or(c, context.not(d)))).isFalse();
  }

  @Test
  public void disjunctionOfEqualOperands() {
    Expression conjunction = context.and(c, d);
    assertThat(context.or(conjunction, context.and(c, d))).isEqualTo(conjunction);
    assertThat(context.or(c, d).toASTString()).isEqualTo("(c || d)");
  }

  @Test
  public void doubleNegation() {
    assertThat(context.not(context.not(c))).isSameInstanceAs(c);
    assertThat(context.not(c).toASTString()).isEqualTo("!c");
  }

  /** Collects the branch conditions an expression depends on. */
  private static final class ConditionCollector
      implements ExpressionVisitor<ImmutableSet<String>, RuntimeException> {

    @Override
    public ImmutableSet<String> visit(TrueExpression pExpression) {
      return ImmutableSet.of();
    }

    @Override
    public ImmutableSet<String> visit(BranchConditionExpression pExpression) {
      return ImmutableSet.of(pExpression.getCondition());
    }

    @Override
    public ImmutableSet<String> visit(NotExpression pExpression) {
      return pExpression.getOperand().accept(this);
    }

    @Override
    public ImmutableSet<String> visit(ShortCircuitExpression pExpression) {
      return ImmutableSet.<String>builder()
          .addAll(pExpression.getOperand1().accept(this))
          .addAll(pExpression.getOperand2().accept(this))
          .build();
    }

    @Override
    public ImmutableSet<String> visit(SelectorComparisonExpression pExpression) {
      return ImmutableSet.of(pExpression.getSelector());
    }
  }

  @Test
  public void visitorReachesAllOperands() {
    Expression condition =
        context.or(
            context.and(context.selectorEquals("redirect0", 1), context.not(c)),
            context.and(d, context.expressionForTrue()));

    assertThat(condition.accept(new ConditionCollector()))
        .containsExactly("redirect0", "c", "d")
        .inOrder();
  }

  @Test
  public void selectorNamesAreFresh() {
    String first = context.newSelector();
    String second = context.newSelector();
    assertThat(first).isNotEqualTo(second);
    assertThat(context.selectorEquals(first, 1).toASTString()).isEqualTo("(" + first + " == 1)");
    assertThat(context.assignSelector(second, 0).toASTString()).isEqualTo(second + " = 0;");
  }

  @Test
  public void sequenceSkipsEmptyStatements() {
    SequenceStatement sequence =
        context.sequence(context.raw("a"), context.sequence(), context.raw(""), context.raw("b"));
    assertThat(sequence.size()).isEqualTo(4);
    assertThat(sequence.toASTString()).isEqualTo("a; b;");
  }

  @Test
  public void statementsPrint() {
    Statement ifElse = context.ifElse(c, context.raw("a"), context.sequence(context.raw("b")));
    assertThat(ifElse.toASTString()).isEqualTo("if (c) { a; } else { b; }");

    Statement preTested =
        context.loop(context.expressionForTrue(), ConditionPosition.PRE_TESTED, context.sequence());
    assertThat(preTested.toASTString()).isEqualTo("while (true) {}");

    Statement postTested = context.loop(d, ConditionPosition.POST_TESTED, context.raw("a"));
    assertThat(postTested.toASTString()).isEqualTo("do { a; } while (d);");

    assertThat(context.breakStatement(context.expressionForTrue()).toASTString())
        .isEqualTo("break;");
    assertThat(context.breakStatement(c).toASTString()).isEqualTo("if (c) break;");
  }

  @Test
  public void countsCreatedNodes() {
    int statements = context.getStatementCount();
    int expressions = context.getExpressionCount();

    context.ifElse(context.or(c, d), context.sequence(context.raw("a")));
    context.and(context.expressionForTrue(), c);

    assertThat(context.getStatementCount()).isEqualTo(statements + 3);
    assertThat(context.getExpressionCount()).isEqualTo(expressions + 1);
  }
}
