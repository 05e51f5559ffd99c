// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class LoopStatement implements Statement {

  /** Whether the loop condition is checked before or after each iteration. */
  public enum ConditionPosition {
    PRE_TESTED,
    POST_TESTED
  }

  private final Expression condition;
  private final ConditionPosition position;
  private final Statement body;

  LoopStatement(Expression pCondition, ConditionPosition pPosition, Statement pBody) {
    condition = checkNotNull(pCondition);
    position = checkNotNull(pPosition);
    body = checkNotNull(pBody);
  }

  public Expression getCondition() {
    return condition;
  }

  public ConditionPosition getPosition() {
    return position;
  }

  public boolean isPreTested() {
    return position == ConditionPosition.PRE_TESTED;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    switch (position) {
      case PRE_TESTED:
        return "while (" + condition.toASTString() + ") " + SequenceStatement.braced(body);
      case POST_TESTED:
        return "do " + SequenceStatement.braced(body) + " while (" + condition.toASTString() + ");";
      default:
        throw new AssertionError();
    }
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
