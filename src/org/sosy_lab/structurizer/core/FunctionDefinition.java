// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.core;

import java.util.OptionalLong;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.cfg.BlockGraph;

/** A function of the module to structurize, as provided by the front end. */
public interface FunctionDefinition {

  String getName();

  OptionalLong getVirtualAddress();

  /** Prototypes have no body and are not structurized. */
  boolean isPrototype();

  /**
   * Create a new block graph for the function: one block per basic block, with the statement of
   * its instructions, {@code true} on unconditional edges, and a condition and its negation on the
   * two edges of a branch. Called at most once per run.
   */
  BlockGraph buildBlockGraph(AstContext pContext);
}
