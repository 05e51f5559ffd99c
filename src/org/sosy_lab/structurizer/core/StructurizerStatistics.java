// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.core;

import com.google.common.base.Strings;
import java.io.PrintStream;
import org.sosy_lab.common.time.Timer;

/** Counters and timers of one {@link ModuleStructurizer}. */
public class StructurizerStatistics {

  private static final int TITLE_WIDTH = 50;

  final Timer totalTimer = new Timer();
  final Timer graphTimer = new Timer();
  final Timer normalizationTimer = new Timer();
  final Timer regionTimer = new Timer();
  final Timer structurizeTimer = new Timer();
  final Timer passesTimer = new Timer();

  int functions = 0;
  int prototypes = 0;
  int blocks = 0;
  int redirectorBlocks = 0;
  int reducedRegions = 0;
  int loops = 0;
  int breaks = 0;
  int passes = 0;

  public int getStructurizedFunctions() {
    return functions;
  }

  public int getPrototypes() {
    return prototypes;
  }

  public int getRedirectorBlocks() {
    return redirectorBlocks;
  }

  public int getReducedRegions() {
    return reducedRegions;
  }

  public int getLoops() {
    return loops;
  }

  public int getBreaks() {
    return breaks;
  }

  public void printStatistics(PrintStream pOut) {
    put(pOut, 0, "Number of structurized functions", functions);
    put(pOut, 1, "Number of prototypes", prototypes);
    put(pOut, 1, "Number of original blocks", blocks);
    put(pOut, 1, "Number of redirector blocks", redirectorBlocks);
    put(pOut, 1, "Number of reduced regions", reducedRegions);
    put(pOut, 1, "Number of loops", loops);
    put(pOut, 1, "Number of breaks", breaks);
    put(pOut, 0, "Number of module passes", passes);
    pOut.println();

    put(pOut, 0, "Total time for structurizing", totalTimer);
    put(pOut, 1, "Time for building block graphs", graphTimer);
    put(pOut, 1, "Time for loop normalization", normalizationTimer);
    put(pOut, 1, "Time for region analysis", regionTimer);
    put(pOut, 1, "Time for folding regions", structurizeTimer);
    put(pOut, 1, "Time for module passes", passesTimer);
  }

  private static void put(PrintStream pOut, int pIndent, String pTitle, Object pValue) {
    String indent = Strings.repeat("  ", pIndent);
    pOut.println(Strings.padEnd(indent + pTitle + ":", TITLE_WIDTH, ' ') + pValue);
  }
}
