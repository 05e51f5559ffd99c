// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores which of several targets a redirected edge originally pointed to.
 *
 * @see SelectorComparisonExpression
 */
public final class SelectorAssignmentStatement implements Statement {

  private final String selector;
  private final int value;

  SelectorAssignmentStatement(String pSelector, int pValue) {
    checkArgument(pValue >= 0);
    selector = checkNotNull(pSelector);
    value = pValue;
  }

  public String getSelector() {
    return selector;
  }

  public int getValue() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return selector + " = " + value + ";";
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
