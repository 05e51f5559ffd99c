// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Logical negation, the condition of the false side of a branch. */
public final class NotExpression implements Expression {

  private final Expression operand;

  NotExpression(Expression pOperand) {
    operand = checkNotNull(pOperand);
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    // binary operands print their own parentheses
    return "!" + operand.toASTString();
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof NotExpression && operand.equals(((NotExpression) pObj).operand);
  }

  @Override
  public int hashCode() {
    return 31 * operand.hashCode() + 1;
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
