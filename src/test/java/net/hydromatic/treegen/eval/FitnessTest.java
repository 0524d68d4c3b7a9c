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
package net.hydromatic.treegen.eval;

import net.hydromatic.treegen.alphabet.BuiltInFunction;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;
import net.hydromatic.treegen.sample.BinResult;
import net.hydromatic.treegen.sample.BinSampler;
import net.hydromatic.treegen.tree.Tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Table;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.SortedMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Compiler}, {@link Fitness} and {@link Profiler}. */
public class FitnessTest {
  private final PrimitiveSet primitiveSet =
      PrimitiveSet.builder("test")
          .add(BuiltInFunction.ADD)
          .add(BuiltInFunction.MUL)
          .add(BuiltInFunction.LOG)
          .variables(2)
          .ephemeral("erc", ImmutableList.of(0.5))
          .build();
  private final Symbol add = primitiveSet.primitives().get(0);
  private final Symbol mul = primitiveSet.primitives().get(1);
  private final Symbol log = primitiveSet.primitives().get(2);
  private final Symbol v0 = primitiveSet.variables().get(0);
  private final Symbol v1 = primitiveSet.variables().get(1);
  private final Symbol half = primitiveSet.constants().get(0);

  private static Tree tree(Symbol... nodes) {
    return new Tree(ImmutableList.copyOf(nodes));
  }

  @Test void testCompile() {
    // add(v0, mul(v1, 0.5))
    final Code code = Compiler.compile(tree(add, v0, mul, v1, half));
    assertThat(code.eval(new double[] {1, 2}), is(2d));
    assertThat(code.eval(new double[] {-3, 10}), is(2d));

    // log(0) is protected
    final Code code2 = Compiler.compile(tree(log, mul, v0, v1));
    assertThat(code2.eval(new double[] {0, 5}), is(0d));

    assertThat(Compiler.compile(tree(half)).eval(new double[0]), is(0.5d));
  }

  @Test void testR2() {
    final double[] target = {1, 2, 3};
    assertThat(Fitness.r2(target, new double[] {1, 2, 3}), is(1d));
    // Residual 1, total 2
    assertThat(Fitness.r2(target, new double[] {1, 2, 4}), is(0.5d));
    // Predicting the mean scores 0; worse than that is negative
    assertThat(Fitness.r2(target, new double[] {2, 2, 2}), is(0d));
    assertThat(Fitness.r2(target, new double[] {3, 2, 1}), is(-3d));

    // Constant target
    final double[] constant = {4, 4};
    assertThat(Fitness.r2(constant, new double[] {4, 4}), is(1d));
    assertThat(Fitness.r2(constant, new double[] {4, 5}), is(0d));

    assertThrows(IllegalArgumentException.class,
        () -> Fitness.r2(target, new double[] {1, 2}));
  }

  @Test void testEvaluate() {
    final double[][] cases = {{1, 0}, {2, 0}, {3, 0}};
    final double[] target = {1, 2, 3};
    final double[] scores =
        Fitness.evaluate(
            ImmutableList.of(tree(v0), tree(add, v0, v1), tree(v1)),
            cases, target);
    assertThat(scores.length, is(3));
    assertThat(scores[0], is(1d));
    assertThat(scores[1], is(1d));
    // Always 0, versus mean 2: residual 14, total 2
    assertThat(scores[2], closeTo(-6d, 1e-12));
  }

  @Test void testProfile() {
    final SortedMap<Integer, BinResult> results =
        new BinSampler(BinSampler.Config.DEFAULT.withMaxAttempts(3))
            .sampleBins(primitiveSet, 2, 3, 2);
    final Profiler profiler =
        new Profiler(2, ImmutableList.of(10, 100), 2, new Random(0));
    final Table<Integer, Integer, Double> table = profiler.profile(results);
    assertThat(table.rowKeySet(), is(results.keySet()));
    assertThat(table.columnKeySet().equals(ImmutableSet.of(10, 100)),
        is(true));
    for (Double seconds : table.values()) {
      assertThat(seconds, greaterThanOrEqualTo(0d));
    }
  }
}

// End FitnessTest.java
