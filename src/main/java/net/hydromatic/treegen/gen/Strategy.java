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
package net.hydromatic.treegen.gen;

import java.util.Random;

/** Strategy for growing a tree. */
public enum Strategy {
  /**
   * Nodes may be terminals at any depth. Once the minimum bounds are met,
   * each node is a terminal with probability {@link
   * net.hydromatic.treegen.alphabet.PrimitiveSet#terminalRatio()}.
   */
  GROW,

  /**
   * Every branch reaches the desired depth, unless the size ceiling forces a
   * terminal first. Always targets depth.
   */
  FULL,

  /** Each tree is grown by {@link #GROW} or {@link #FULL}, equally likely. */
  HALF_AND_HALF;

  /**
   * Returns the strategy to use for one tree. Consumes one random draw if this
   * is {@link #HALF_AND_HALF}.
   */
  Strategy resolve(Random random) {
    if (this == HALF_AND_HALF) {
      return random.nextBoolean() ? GROW : FULL;
    }
    return this;
  }
}

// End Strategy.java
