// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

public interface StatementVisitor<R, X extends Exception> {

  R visit(SequenceStatement pStatement) throws X;

  R visit(IfElseStatement pStatement) throws X;

  R visit(LoopStatement pStatement) throws X;

  R visit(BreakStatement pStatement) throws X;

  R visit(RawStatement pStatement) throws X;

  R visit(SelectorAssignmentStatement pStatement) throws X;
}
