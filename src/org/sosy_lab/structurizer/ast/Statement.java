// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

/**
 * Node of the structured AST. The set of statement kinds is closed, use {@link StatementVisitor}
 * to dispatch over them.
 *
 * <p>Statements are created by an {@link AstContext} and are never deleted once created, they are
 * only linked into larger statements. Unlike expressions, statements are compared by identity:
 * {@link SequenceStatement} is mutable.
 */
public interface Statement {

  <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X;

  /** Compact C-like representation on a single line, intended for logging and debugging. */
  String toASTString();
}
