// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

public final class IfElseStatement implements Statement {

  private final Expression condition;
  private final Statement ifBody;
  private final @Nullable Statement elseBody;

  IfElseStatement(Expression pCondition, Statement pIfBody, @Nullable Statement pElseBody) {
    condition = checkNotNull(pCondition);
    ifBody = checkNotNull(pIfBody);
    elseBody = pElseBody;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getIfBody() {
    return ifBody;
  }

  public Optional<Statement> getElseBody() {
    return Optional.ofNullable(elseBody);
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    String result =
        "if (" + condition.toASTString() + ") " + SequenceStatement.braced(ifBody);
    if (elseBody != null) {
      result += " else " + SequenceStatement.braced(elseBody);
    }
    return result;
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
