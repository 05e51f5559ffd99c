// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.structurizer.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;
import com.google.common.primitives.UnsignedLongs;
import java.util.Comparator;
import java.util.Optional;
import java.util.OptionalLong;
import org.sosy_lab.structurizer.ast.Statement;

/** A structurized function: its name, its address if known, and its body unless a prototype. */
public final class FunctionNode {

  /**
   * Orders by virtual address as an unsigned number (missing addresses count as 0), then by name.
   */
  public static final Comparator<FunctionNode> BY_ADDRESS_THEN_NAME =
      (pNode1, pNode2) ->
          ComparisonChain.start()
              .compare(
                  pNode1.getAddressOrZero(), pNode2.getAddressOrZero(), UnsignedLongs::compare)
              .compare(pNode1.getName(), pNode2.getName())
              .result();

  private final String name;
  private final OptionalLong virtualAddress;
  private final Optional<Statement> body;

  private FunctionNode(String pName, OptionalLong pVirtualAddress, Optional<Statement> pBody) {
    name = checkNotNull(pName);
    virtualAddress = checkNotNull(pVirtualAddress);
    body = checkNotNull(pBody);
  }

  public static FunctionNode prototype(String pName, OptionalLong pVirtualAddress) {
    return new FunctionNode(pName, pVirtualAddress, Optional.empty());
  }

  public static FunctionNode withBody(String pName, OptionalLong pVirtualAddress, Statement pBody) {
    return new FunctionNode(pName, pVirtualAddress, Optional.of(pBody));
  }

  public String getName() {
    return name;
  }

  public OptionalLong getVirtualAddress() {
    return virtualAddress;
  }

  private long getAddressOrZero() {
    return virtualAddress.orElse(0);
  }

  public boolean isPrototype() {
    return body.isEmpty();
  }

  public Optional<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    String address =
        virtualAddress.isPresent() ? "0x" + Long.toHexString(virtualAddress.getAsLong()) : "?";
    return name + "@" + address + (isPrototype() ? " (prototype)" : "");
  }
}
