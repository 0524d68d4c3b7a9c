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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;

/**
 * Expression tree, stored as a list of symbols in prefix order.
 *
 * <p>Each function symbol is followed by exactly {@link Symbol#arity()}
 * subtrees. Terminals are materialized: a tree contains variables and
 * constants, never an ephemeral generator.
 *
 * <p>The canonical form, returned by {@link #toString()}, is deterministic;
 * two trees are syntactically equal if and only if their canonical forms are
 * equal.
 */
public class Tree {
  public final ImmutableList<Symbol> nodes;
  private final int depth;

  /** Creates a tree. Throws if the nodes do not form exactly one tree. */
  public Tree(List<? extends Symbol> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.depth = computeDepth(this.nodes);
  }

  /**
   * Computes the depth of a tree, and checks that the list of nodes holds
   * exactly one complete tree.
   */
  private static int computeDepth(List<Symbol> nodes) {
    checkArgument(!nodes.isEmpty(), "empty tree");
    // Depths of the slots that are yet to be filled; "pending" is the
    // number of them.
    final int[] stack = new int[nodes.size() + 1];
    int pending = 0;
    stack[pending++] = 0;
    int maxDepth = 0;
    for (int i = 0; i < nodes.size(); i++) {
      final Symbol node = nodes.get(i);
      checkArgument(
          pending > 0, "node %s (%s) follows a complete tree", i, node);
      checkArgument(
          node.kind != Symbol.Kind.EPHEMERAL,
          "tree contains unmaterialized ephemeral %s",
          node);
      final int d = stack[--pending];
      maxDepth = Math.max(maxDepth, d);
      for (int j = 0; j < node.arity(); j++) {
        stack[pending++] = d + 1;
      }
    }
    checkArgument(pending == 0, "incomplete tree; %s missing nodes", pending);
    return maxDepth;
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  /** Returns the length of the longest path from the root to a leaf. */
  public int depth() {
    return depth;
  }

  /** Returns the root symbol. */
  public Symbol root() {
    return nodes.get(0);
  }

  /** Counts how often each symbol of an alphabet occurs in this tree. */
  public UsageCounts usage(PrimitiveSet primitiveSet) {
    return UsageCounts.of(primitiveSet, this);
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tree && toString().equals(o.toString());
  }

  /**
   * Returns the canonical form of this tree, for example {@code add(v0,
   * sin(0.25))}.
   */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    unparse(buf, 0);
    return buf.toString();
  }

  /**
   * Writes the subtree that starts at node {@code i}, and returns the index
   * of the node after it.
   */
  private int unparse(StringBuilder buf, int i) {
    final Symbol node = nodes.get(i++);
    buf.append(node.name);
    if (node.arity() == 0) {
      return i;
    }
    buf.append('(');
    for (int j = 0; j < node.arity(); j++) {
      if (j > 0) {
        buf.append(", ");
      }
      i = unparse(buf, i);
    }
    buf.append(')');
    return i;
  }
}

// End Tree.java
