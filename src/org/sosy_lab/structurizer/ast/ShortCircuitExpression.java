// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** Short-circuit conjunction or disjunction of two operands. */
public final class ShortCircuitExpression implements Expression {

  public enum Operator {
    AND("&&"),
    OR("||");

    private final String op;

    Operator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }
  }

  private final Operator operator;
  private final Expression operand1;
  private final Expression operand2;

  ShortCircuitExpression(Operator pOperator, Expression pOperand1, Expression pOperand2) {
    operator = checkNotNull(pOperator);
    operand1 = checkNotNull(pOperand1);
    operand2 = checkNotNull(pOperand2);
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getOperand1() {
    return operand1;
  }

  public Expression getOperand2() {
    return operand2;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return "("
        + operand1.toASTString()
        + " "
        + operator.getOperator()
        + " "
        + operand2.toASTString()
        + ")";
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ShortCircuitExpression)) {
      return false;
    }
    ShortCircuitExpression other = (ShortCircuitExpression) pObj;
    return operator == other.operator
        && operand1.equals(other.operand1)
        && operand2.equals(other.operand2);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, operand1, operand2);
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
