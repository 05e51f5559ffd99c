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

import java.util.Objects;

/**
 * Tests whether a selector variable holds a given value. Redirector blocks use it to dispatch to
 * the block that an incoming edge originally pointed to.
 *
 * @see SelectorAssignmentStatement
 */
public final class SelectorComparisonExpression implements Expression {

  private final String selector;
  private final int value;

  SelectorComparisonExpression(String pSelector, int pValue) {
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
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return "(" + selector + " == " + value + ")";
  }

  @Override
  public boolean equals(Object pObj) {
    if (!(pObj instanceof SelectorComparisonExpression)) {
      return false;
    }
    SelectorComparisonExpression other = (SelectorComparisonExpression) pObj;
    return value == other.value && selector.equals(other.selector);
  }

  @Override
  public int hashCode() {
    return Objects.hash(selector, value);
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
