// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurizer.ast.AstContext;
import org.sosy_lab.structurizer.ast.Statement;
import org.sosy_lab.structurizer.cfg.BlockGraph;
import org.sosy_lab.structurizer.cfg.BlockGraphCheck;
import org.sosy_lab.structurizer.cfg.BlockGraphToDotWriter;
import org.sosy_lab.structurizer.structuring.LoopNormalizer;
import org.sosy_lab.structurizer.structuring.Region;
import org.sosy_lab.structurizer.structuring.RegionAnalysis;
import org.sosy_lab.structurizer.structuring.Structurizer;

/**
 * Structurizes all functions of a module.
 *
 * <p>For every function with a body the block graph is built, its loops are normalized, the region
 * tree is computed on the normalized graph and folded into the function body. Afterwards the
 * function nodes are sorted and the registered module passes run in the order they were added.
 * Internal inconsistencies abort the whole run with a {@link VerifyException}.
 */
@Options(prefix = "structurizer")
public class ModuleStructurizer {

  @Option(
      secure = true,
      name = "checkBlockGraphs",
      description =
          "verify the edge bookkeeping of every block graph before and after normalization")
  private boolean checkBlockGraphs = true;

  @Option(
      secure = true,
      name = "exportDirectory",
      description = "directory to dump normalized block graphs of all functions as dot files")
  private @Nullable String exportDirectory = null;

  private final LogManager logger;
  private final LoopNormalizer normalizer;
  private final RegionAnalysis regionAnalysis;
  private final Comparator<FunctionNode> functionOrder;
  private final List<ModulePass> passes = new ArrayList<>();
  private final StructurizerStatistics stats = new StructurizerStatistics();
  private final AstContext context = new AstContext();

  public ModuleStructurizer(
      Configuration pConfig, LogManager pLogger, RegionAnalysis pRegionAnalysis)
      throws InvalidConfigurationException {
    this(pConfig, pLogger, pRegionAnalysis, FunctionNode.BY_ADDRESS_THEN_NAME);
  }

  public ModuleStructurizer(
      Configuration pConfig,
      LogManager pLogger,
      RegionAnalysis pRegionAnalysis,
      Comparator<FunctionNode> pFunctionOrder)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger.withComponentName(ModuleStructurizer.class.getSimpleName());
    normalizer = new LoopNormalizer(pConfig, pLogger);
    regionAnalysis = checkNotNull(pRegionAnalysis);
    functionOrder = checkNotNull(pFunctionOrder);
  }

  /** Register a pass to run over all functions after they are sorted. */
  public ModuleStructurizer addPass(ModulePass pPass) {
    passes.add(checkNotNull(pPass));
    return this;
  }

  /** The context that owns all statements of the function bodies. */
  public AstContext getContext() {
    return context;
  }

  public StructurizerStatistics getStatistics() {
    return stats;
  }

  public ImmutableList<FunctionNode> run(List<? extends FunctionDefinition> pFunctions)
      throws VerifyException {
    stats.totalTimer.start();
    try {
      List<FunctionNode> functions = new ArrayList<>(pFunctions.size());
      for (FunctionDefinition function : pFunctions) {
        functions.add(structurize(function));
      }
      functions.sort(functionOrder);

      stats.passesTimer.start();
      try {
        for (ModulePass pass : passes) {
          logger.log(Level.FINE, "Running module pass", pass);
          pass.run(functions);
          stats.passes++;
        }
      } finally {
        stats.passesTimer.stop();
      }
      return ImmutableList.copyOf(functions);
    } finally {
      stats.totalTimer.stop();
    }
  }

  private FunctionNode structurize(FunctionDefinition pFunction) {
    if (pFunction.isPrototype()) {
      logger.log(Level.FINER, "Skipping prototype", pFunction.getName());
      stats.prototypes++;
      return FunctionNode.prototype(pFunction.getName(), pFunction.getVirtualAddress());
    }

    BlockGraph graph;
    stats.graphTimer.start();
    try {
      graph = pFunction.buildBlockGraph(context);
    } finally {
      stats.graphTimer.stop();
    }
    stats.blocks += graph.getNumBlocks();
    if (checkBlockGraphs) {
      BlockGraphCheck.check(graph);
    }

    stats.normalizationTimer.start();
    try {
      stats.redirectorBlocks += normalizer.normalize(graph);
    } finally {
      stats.normalizationTimer.stop();
    }
    if (checkBlockGraphs) {
      BlockGraphCheck.check(graph);
    }
    if (exportDirectory != null) {
      new BlockGraphToDotWriter(graph).dump(Path.of(exportDirectory), logger);
    }

    Region topLevelRegion;
    stats.regionTimer.start();
    try {
      topLevelRegion = regionAnalysis.computeRegions(graph);
    } finally {
      stats.regionTimer.stop();
    }

    Structurizer structurizer = new Structurizer(graph, logger);
    Statement body;
    stats.structurizeTimer.start();
    try {
      body = structurizer.structurize(topLevelRegion);
    } finally {
      stats.structurizeTimer.stop();
    }
    stats.functions++;
    stats.reducedRegions += structurizer.getReducedRegions();
    stats.loops += structurizer.getEmittedLoops();
    stats.breaks += structurizer.getEmittedBreaks();

    return FunctionNode.withBody(pFunction.getName(), pFunction.getVirtualAddress(), body);
  }
}
