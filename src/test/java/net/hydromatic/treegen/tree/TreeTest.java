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

import net.hydromatic.treegen.alphabet.BuiltInFunction;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Tree} and {@link UsageCounts}. */
public class TreeTest {
  private final PrimitiveSet primitiveSet =
      PrimitiveSet.builder("test")
          .add(BuiltInFunction.ADD)
          .add(BuiltInFunction.MUL)
          .add(BuiltInFunction.SIN)
          .variables(2)
          .ephemeral("erc", ImmutableList.of(0.5, -0.75))
          .build();
  private final Symbol add = primitiveSet.primitives().get(0);
  private final Symbol mul = primitiveSet.primitives().get(1);
  private final Symbol sin = primitiveSet.primitives().get(2);
  private final Symbol v0 = primitiveSet.variables().get(0);
  private final Symbol v1 = primitiveSet.variables().get(1);
  private final Symbol c0 = primitiveSet.constants().get(0);
  private final Symbol c1 = primitiveSet.constants().get(1);

  private static Tree tree(Symbol... nodes) {
    return new Tree(ImmutableList.copyOf(nodes));
  }

  @Test void testCanonicalForm() {
    final Tree tree = tree(add, v0, mul, v1, c0);
    assertThat(tree, hasToString("add(v0, mul(v1, 0.5))"));
    assertThat(tree.size(), is(5));
    assertThat(tree.depth(), is(2));
    assertThat(tree.root(), is(add));

    assertThat(tree(v1), hasToString("v1"));
    assertThat(tree(c1).depth(), is(0));
    assertThat(tree(sin, sin, c1), hasToString("sin(sin(-0.75))"));
    assertThat(tree(sin, sin, c1).depth(), is(2));
  }

  /** Depth is the longest path, wherever it is. */
  @Test void testDepth() {
    assertThat(tree(add, v0, sin, sin, v1).depth(), is(3));
    assertThat(tree(add, sin, sin, v1, v0).depth(), is(3));
    assertThat(tree(add, add, v0, v1, add, v0, v1).depth(), is(2));
  }

  /** Trees with the same canonical form are equal. */
  @Test void testEquals() {
    final Tree tree0 = tree(mul, v0, c0);
    final Tree tree1 = tree(mul, v0, c0);
    final Tree tree2 = tree(mul, c0, v0);
    assertThat(tree0.equals(tree1), is(true));
    assertThat(tree0.hashCode(), is(tree1.hashCode()));
    assertThat(tree0.equals(tree2), is(false));
  }

  @Test void testMalformed() {
    assertThrows(IllegalArgumentException.class, () -> tree());
    // Missing an argument
    assertThrows(IllegalArgumentException.class, () -> tree(add, v0));
    // Trailing node after a complete tree
    assertThrows(IllegalArgumentException.class, () -> tree(sin, v0, v1));
    // Ephemerals must be materialized
    final List<Symbol.Terminal> terminals =
        primitiveSet.terminals(PrimitiveSet.DEFAULT_TYPE);
    final Symbol ephemeral = terminals.get(terminals.size() - 1);
    assertThat(ephemeral.kind, is(Symbol.Kind.EPHEMERAL));
    assertThrows(IllegalArgumentException.class,
        () -> tree(sin, ephemeral));
  }

  @Test void testUsage() {
    final UsageCounts usage = tree(add, v0, mul, v0, c1).usage(primitiveSet);
    assertThat(usage.functionCounts, hasToString("[1, 1, 0]"));
    assertThat(usage.variableCounts, hasToString("[2, 0]"));
    assertThat(usage.constantCounts, hasToString("[0, 1]"));
    assertThat(usage.total(), is(5));
    assertThat(usage,
        hasToString("functions [1, 1, 0], variables [2, 0], "
            + "constants [0, 1]"));

    final UsageCounts usage2 = tree(sin, v1).usage(primitiveSet);
    final UsageCounts sum = usage.plus(usage2);
    assertThat(sum.functionCounts, hasToString("[1, 1, 1]"));
    assertThat(sum.variableCounts, hasToString("[2, 1]"));
    assertThat(sum.total(), is(7));
    assertThat(UsageCounts.zero(primitiveSet).plus(usage), is(usage));
  }
}

// End TreeTest.java
