// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

/**
 * Condition of a conditional branch as delivered by the block-graph factory. The structurizer does
 * not look inside it, two conditions are the same iff their source text is the same.
 */
public final class BranchConditionExpression implements Expression {

  private final String condition;

  BranchConditionExpression(String pCondition) {
    checkArgument(!Strings.isNullOrEmpty(pCondition), "branch condition must not be empty");
    condition = pCondition;
  }

  public String getCondition() {
    return condition;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return condition;
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof BranchConditionExpression
        && condition.equals(((BranchConditionExpression) pObj).condition);
  }

  @Override
  public int hashCode() {
    return condition.hashCode();
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
