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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.math.LongMath;
import java.math.RoundingMode;

/** Arithmetic on the sizes and depths of trees. */
public abstract class Sizes {
  private Sizes() {}

  /**
   * Returns the maximum number of nodes in a tree whose nodes have at most
   * {@code arity} children and whose depth is at most {@code depth}; that is,
   * the number of nodes in a complete {@code arity}-ary tree of that depth.
   *
   * <p>For example, {@code maxSize(1, 4) = 5}, {@code maxSize(2, 3) = 15},
   * {@code maxSize(3, 2) = 13}.
   *
   * <p>The result is exact. If it does not fit in a {@code long}, returns
   * {@link Long#MAX_VALUE}.
   */
  public static long maxSize(int arity, int depth) {
    checkArgument(arity >= 1, "arity must be at least 1: %s", arity);
    checkArgument(depth >= 0, "depth must be non-negative: %s", depth);
    if (arity == 1) {
      return depth + 1L;
    }
    // Geometric series 1 + m + m^2 + ... + m^d = (m^(d+1) - 1) / (m - 1)
    final long power = LongMath.saturatedPow(arity, depth + 1);
    if (power == Long.MAX_VALUE) {
      return Long.MAX_VALUE;
    }
    return (power - 1) / (arity - 1);
  }

  /**
   * Returns the maximum number of nodes that pending obligations could add to
   * a tree, if each became the root of a complete {@code arity}-ary subtree
   * reaching {@code maxDepth}. The obligations' own nodes are not counted.
   *
   * <p>Returns 0 if there are no obligations.
   */
  public static long remainingBudget(
      Iterable<Obligation> obligations, int arity, int maxDepth) {
    long sum = 0;
    for (Obligation obligation : obligations) {
      sum =
          LongMath.saturatedAdd(
              sum, maxSize(arity, maxDepth - obligation.depth) - 1);
    }
    return sum;
  }

  /**
   * Returns the number of bins of width {@code binSize} needed to cover sizes 1
   * through {@code maxPossibleSize}.
   */
  public static int binCount(long maxPossibleSize, int binSize) {
    checkArgument(maxPossibleSize >= 1, "size must be positive");
    checkArgument(binSize >= 1, "bin size must be positive");
    return Math.toIntExact(
        LongMath.divide(maxPossibleSize, binSize, RoundingMode.CEILING));
  }
}

// End Sizes.java
