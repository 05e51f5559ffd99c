// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

/**
 * Boolean expression used as edge condition, reaching condition, or guard of structured
 * statements. Expressions are immutable values: they are compared structurally and can be shared
 * by any number of statements and edges.
 *
 * <p>The set of implementations is closed, use {@link ExpressionVisitor} to dispatch over them.
 */
public interface Expression {

  <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X;

  /** Compact C-like representation, intended for logging and debugging. */
  String toASTString();
}
