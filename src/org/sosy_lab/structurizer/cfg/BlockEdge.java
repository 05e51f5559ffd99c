// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.Expression;

/**
 * Directed edge between two blocks of the same graph, taken if its condition holds. The target of
 * an edge can change (see {@link BlockGraph#retarget}), its source and condition never do.
 */
public final class BlockEdge {

  private final BasicBlock predecessor;
  private BasicBlock successor;
  private final Expression condition;

  BlockEdge(BasicBlock pPredecessor, BasicBlock pSuccessor, Expression pCondition) {
    predecessor = checkNotNull(pPredecessor);
    successor = checkNotNull(pSuccessor);
    condition = checkNotNull(pCondition);
  }

  public BasicBlock getPredecessor() {
    return predecessor;
  }

  public BasicBlock getSuccessor() {
    return successor;
  }

  void setSuccessor(BasicBlock pSuccessor) {
    successor = checkNotNull(pSuccessor);
  }

  public Expression getCondition() {
    return condition;
  }

  public boolean isUnconditional() {
    return AstContext.isTrue(condition);
  }

  @Override
  public String toString() {
    return predecessor + " -> " + successor + " [" + condition.toASTString() + "]";
  }
}
