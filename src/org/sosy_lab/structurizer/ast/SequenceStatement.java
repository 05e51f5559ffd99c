// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Ordered list of statements. Statements can be appended after creation. */
public final class SequenceStatement implements Statement {

  private final List<Statement> statements = new ArrayList<>();

  SequenceStatement() {}

  public void pushBack(Statement pStatement) {
    statements.add(checkNotNull(pStatement));
  }

  public ImmutableList<Statement> getStatements() {
    return ImmutableList.copyOf(statements);
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public Statement getLast() {
    return statements.get(statements.size() - 1);
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return Joiner.on(' ')
        .join(
            FluentIterable.from(statements)
                .transform(Statement::toASTString)
                .filter(s -> !s.isEmpty()));
  }

  @Override
  public String toString() {
    return toASTString();
  }

  /** Body of a compound statement, wrapped in braces. */
  static String braced(Statement pBody) {
    String body = pBody.toASTString();
    return body.isEmpty() ? "{}" : "{ " + body + " }";
  }
}
