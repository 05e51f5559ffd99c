// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Leaves the innermost enclosing loop if the guard holds. */
public final class BreakStatement implements Statement {

  private final Expression condition;

  BreakStatement(Expression pCondition) {
    condition = checkNotNull(pCondition);
  }

  public Expression getCondition() {
    return condition;
  }

  public boolean isUnconditional() {
    return condition instanceof TrueExpression;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    if (isUnconditional()) {
      return "break;";
    }
    return "if (" + condition.toASTString() + ") break;";
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
