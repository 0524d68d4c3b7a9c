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
package net.hydromatic.treegen.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.ImmutableIntArray;
import java.util.Objects;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;

/**
 * Number of occurrences of each function, variable and constant of an
 * alphabet, in one tree or summed over several trees.
 *
 * <p>Functions are indexed by their position in {@link
 * PrimitiveSet#primitives()}, variables and constants by their ordinal.
 */
public class UsageCounts {
  public final ImmutableIntArray functionCounts;
  public final ImmutableIntArray variableCounts;
  public final ImmutableIntArray constantCounts;

  private UsageCounts(
      ImmutableIntArray functionCounts,
      ImmutableIntArray variableCounts,
      ImmutableIntArray constantCounts) {
    this.functionCounts = functionCounts;
    this.variableCounts = variableCounts;
    this.constantCounts = constantCounts;
  }

  /** Returns a zero count for every symbol of an alphabet. */
  public static UsageCounts zero(PrimitiveSet primitiveSet) {
    return new UsageCounts(
        ImmutableIntArray.copyOf(new int[primitiveSet.primitives().size()]),
        ImmutableIntArray.copyOf(new int[primitiveSet.variables().size()]),
        ImmutableIntArray.copyOf(new int[primitiveSet.constants().size()]));
  }

  /** Counts the symbols in a tree. */
  static UsageCounts of(PrimitiveSet primitiveSet, Tree tree) {
    final int[] functions = new int[primitiveSet.primitives().size()];
    final int[] variables = new int[primitiveSet.variables().size()];
    final int[] constants = new int[primitiveSet.constants().size()];
    for (Symbol node : tree.nodes) {
      switch (node.kind) {
        case FUNCTION:
          final int i = primitiveSet.primitives().indexOf(node);
          checkArgument(i >= 0, "function %s not in %s", node, primitiveSet);
          ++functions[i];
          break;
        case VARIABLE:
          ++variables[((Symbol.Variable) node).ordinal];
          break;
        case CONSTANT:
          ++constants[((Symbol.Constant) node).ordinal];
          break;
        default:
          throw new AssertionError(node.kind);
      }
    }
    return new UsageCounts(
        ImmutableIntArray.copyOf(functions),
        ImmutableIntArray.copyOf(variables),
        ImmutableIntArray.copyOf(constants));
  }

  /** Returns the element-wise sum of this and another count. */
  public UsageCounts plus(UsageCounts o) {
    return new UsageCounts(
        plus(functionCounts, o.functionCounts),
        plus(variableCounts, o.variableCounts),
        plus(constantCounts, o.constantCounts));
  }

  private static ImmutableIntArray plus(
      ImmutableIntArray a0, ImmutableIntArray a1) {
    checkArgument(a0.length() == a1.length(), "length mismatch");
    final int[] sum = a0.toArray();
    for (int i = 0; i < sum.length; i++) {
      sum[i] += a1.get(i);
    }
    return ImmutableIntArray.copyOf(sum);
  }

  /** Returns the total number of nodes counted. */
  public int total() {
    return sum(functionCounts) + sum(variableCounts) + sum(constantCounts);
  }

  private static int sum(ImmutableIntArray a) {
    return a.stream().sum();
  }

  @Override
  public int hashCode() {
    return Objects.hash(functionCounts, variableCounts, constantCounts);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof UsageCounts
            && functionCounts.equals(((UsageCounts) o).functionCounts)
            && variableCounts.equals(((UsageCounts) o).variableCounts)
            && constantCounts.equals(((UsageCounts) o).constantCounts);
  }

  @Override
  public String toString() {
    return "functions " + functionCounts
        + ", variables " + variableCounts
        + ", constants " + constantCounts;
  }
}

// End UsageCounts.java
