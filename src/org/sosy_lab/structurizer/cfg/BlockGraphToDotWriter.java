// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.cfg;

import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.structurizer.cfg.BasicBlock.BlockKind;

/** This Writer can dump the block graph of a function into a dot file. */
public class BlockGraphToDotWriter {

  private final BlockGraph graph;

  public BlockGraphToDotWriter(BlockGraph pGraph) {
    graph = Preconditions.checkNotNull(pGraph);
  }

  /** dump the graph to {@code blocks__<function>.dot} in the given directory. */
  public void dump(final Path pDir, LogManager pLogger) {
    Path blocksFile = pDir.resolve("blocks__" + graph.getFunctionName() + ".dot");

    try {
      MoreFiles.createParentDirectories(blocksFile);
    } catch (IOException e) {
      pLogger.logUserException(
          Level.WARNING, e, "Could not create parent directories to write blocks to dot file");
      return;
    }

    try (Writer w = Files.newBufferedWriter(blocksFile, StandardCharsets.UTF_8)) {
      dump(w);
    } catch (IOException e) {
      pLogger.logUserException(Level.WARNING, e, "Could not write blocks to dot file");
      // ignore exception and continue structurizing
    }
  }

  /** dump the reachable part of the graph. */
  public void dump(final Appendable app) throws IOException {
    app.append("digraph blocks_of_" + graph.getFunctionName() + "_function {\n");

    for (BasicBlock block : BlockGraphUtils.reversePostorder(graph)) {
      app.append(formatBlock(block));
    }

    // edges after all nodes, otherwise dot places nodes of back-edges strangely
    for (BasicBlock block : BlockGraphUtils.reversePostorder(graph)) {
      for (BlockEdge edge : block.getLeavingEdges()) {
        app.append(formatEdge(edge));
      }
    }

    app.append("}\n");
  }

  private static String formatBlock(BasicBlock pBlock) {
    String shape = "";
    if (pBlock.getKind() == BlockKind.REDIRECTOR) {
      shape = "shape=diamond ";
    } else if (pBlock.getKind() == BlockKind.REGION) {
      shape = "shape=box3d ";
    }

    String label =
        "label=\"" + escape(pBlock.getLabel()) + "\\n#" + pBlock.getBlockNumber() + "\" ";
    return pBlock.getBlockNumber() + " [" + shape + label + "]\n";
  }

  private static String formatEdge(BlockEdge pEdge) {
    StringBuilder sb = new StringBuilder();
    sb.append(pEdge.getPredecessor().getBlockNumber());
    sb.append(" -> ");
    sb.append(pEdge.getSuccessor().getBlockNumber());
    if (!pEdge.isUnconditional()) {
      sb.append(" [label=\"");
      sb.append(escape(pEdge.getCondition().toASTString()));
      sb.append("\"]");
    }
    sb.append("\n");
    return sb.toString();
  }

  private static String escape(String pText) {
    return pText.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
