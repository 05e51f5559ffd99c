// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Instructions of one basic block as delivered by the block-graph factory. The structurizer only
 * moves it around.
 */
public final class RawStatement implements Statement {

  private final String code;

  RawStatement(String pCode) {
    code = checkNotNull(pCode);
  }

  public String getCode() {
    return code;
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toASTString() {
    return code.isEmpty() ? "" : code + ";";
  }

  @Override
  public String toString() {
    return toASTString();
  }
}
