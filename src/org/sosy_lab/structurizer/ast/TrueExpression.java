// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

/** The literal {@code true}. Marks unconditional edges and unguarded blocks. */
public final class TrueExpression implements Expression {

  static final TrueExpression INSTANCE = new TrueExpression();

  private TrueExpression() {}

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return "true";
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
