// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

public interface ExpressionVisitor<R, X extends Exception> {

  R visit(TrueExpression pExpression) throws X;

  R visit(BranchConditionExpression pExpression) throws X;

  R visit(NotExpression pExpression) throws X;

  R visit(ShortCircuitExpression pExpression) throws X;

  R visit(SelectorComparisonExpression pExpression) throws X;
}
