// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.core;

import java.util.List;

/**
 * A pass over all functions of a module, run after every function has been structurized and the
 * functions have been sorted. Passes may modify function bodies and the list itself.
 */
@FunctionalInterface
public interface ModulePass {

  void run(List<FunctionNode> pFunctions);
}
