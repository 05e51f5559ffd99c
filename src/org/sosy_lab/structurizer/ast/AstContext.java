// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.ast;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.structurizer.ast.LoopStatement.ConditionPosition;
import org.sosy_lab.structurizer.ast.ShortCircuitExpression.Operator;

/**
 * Creates all statements and expressions of one module. Everything created here lives as long as
 * the module's function bodies, i.e., longer than the block graphs of single functions.
 *
 * <p>The expression factories fold only what can be decided syntactically: {@code true} operands
 * of conjunctions and disjunctions, duplicate operands, an operand next to its own negation, and
 * double negation. No other simplification is done.
 */
public final class AstContext {

  private int statementCount = 0;
  private int expressionCount = 0;
  private int selectorCount = 0;

  public TrueExpression expressionForTrue() {
    return TrueExpression.INSTANCE;
  }

  public static boolean isTrue(Expression pExpression) {
    return pExpression instanceof TrueExpression;
  }

  public BranchConditionExpression condition(String pCondition) {
    expressionCount++;
    return new BranchConditionExpression(pCondition);
  }

  public Expression not(Expression pOperand) {
    if (pOperand instanceof NotExpression) {
      return ((NotExpression) pOperand).getOperand();
    }
    expressionCount++;
    return new NotExpression(pOperand);
  }

  public Expression and(Expression pOperand1, Expression pOperand2) {
    if (isTrue(pOperand1)) {
      return pOperand2;
    } else if (isTrue(pOperand2) || pOperand1.equals(pOperand2)) {
      return pOperand1;
    }
    expressionCount++;
    return new ShortCircuitExpression(Operator.AND, pOperand1, pOperand2);
  }

  public Expression or(Expression pOperand1, Expression pOperand2) {
    if (isTrue(pOperand1) || isTrue(pOperand2) || areComplementary(pOperand1, pOperand2)) {
      return expressionForTrue();
    } else if (pOperand1.equals(pOperand2)) {
      return pOperand1;
    }
    expressionCount++;
    return new ShortCircuitExpression(Operator.OR, pOperand1, pOperand2);
  }

  private static boolean areComplementary(Expression pOperand1, Expression pOperand2) {
    return (pOperand1 instanceof NotExpression
            && ((NotExpression) pOperand1).getOperand().equals(pOperand2))
        || (pOperand2 instanceof NotExpression
            && ((NotExpression) pOperand2).getOperand().equals(pOperand1));
  }

  public SelectorComparisonExpression selectorEquals(String pSelector, int pValue) {
    expressionCount++;
    return new SelectorComparisonExpression(pSelector, pValue);
  }

  /** Returns a fresh name for a selector variable, unique within this context. */
  public String newSelector() {
    return "redirect" + selectorCount++;
  }

  public SequenceStatement sequence(Statement... pStatements) {
    statementCount++;
    SequenceStatement result = new SequenceStatement();
    for (Statement s : pStatements) {
      result.pushBack(s);
    }
    return result;
  }

  public IfElseStatement ifElse(Expression pCondition, Statement pIfBody) {
    return ifElse(pCondition, pIfBody, null);
  }

  public IfElseStatement ifElse(
      Expression pCondition, Statement pIfBody, @Nullable Statement pElseBody) {
    statementCount++;
    return new IfElseStatement(pCondition, pIfBody, pElseBody);
  }

  public LoopStatement loop(Expression pCondition, ConditionPosition pPosition, Statement pBody) {
    statementCount++;
    return new LoopStatement(pCondition, pPosition, pBody);
  }

  public BreakStatement breakStatement(Expression pCondition) {
    statementCount++;
    return new BreakStatement(pCondition);
  }

  public RawStatement raw(String pCode) {
    statementCount++;
    return new RawStatement(pCode);
  }

  public SelectorAssignmentStatement assignSelector(String pSelector, int pValue) {
    statementCount++;
    return new SelectorAssignmentStatement(pSelector, pValue);
  }

  public int getStatementCount() {
    return statementCount;
  }

  public int getExpressionCount() {
    return expressionCount;
  }
}
