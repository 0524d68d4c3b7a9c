/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.treegen.alphabet;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Utilities for {@link PrimitiveSet}. */
public abstract class PrimitiveSets {
  private PrimitiveSets() {}

  /** Default opcode width, in bits. */
  public static final int DEFAULT_OPCODE_WIDTH = 8;

  /**
   * Creates the primitive set for a function set.
   *
   * <p>The numbers of variables and constants are chosen so that every symbol
   * can be encoded in an opcode of {@code opcodeWidth} bits: with {@code n}
   * functions there are {@code n - 1} variables, and the remaining {@code
   * 2^opcodeWidth - (n + 1) - (n - 1)} codes are constants.
   *
   * <p>The constant pool is drawn from {@code random}, so a given seed always
   * yields the same pool.
   */
  public static PrimitiveSet create(
      FunctionSet functionSet, int opcodeWidth, Random random) {
    checkArgument(
        opcodeWidth > 0 && opcodeWidth < 31,
        "opcode width out of range: %s",
        opcodeWidth);
    final int functionCount = functionSet.functions.size();
    final int variableCount = variableCount(functionSet);
    final int constantCount =
        (1 << opcodeWidth) - (functionCount + 1) - variableCount;
    checkArgument(
        constantCount > 0,
        "opcode width %s is too narrow for function set %s",
        opcodeWidth,
        functionSet.name);
    return PrimitiveSet.builder(functionSet.name)
        .addAll(functionSet.functions)
        .variables(variableCount)
        .ephemeral("erc_" + functionSet.name, constantCount, random)
        .build();
  }

  /** Returns the number of variables for a function set. */
  public static int variableCount(FunctionSet functionSet) {
    return functionSet.functions.size() - 1;
  }
}

// End PrimitiveSets.java
