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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import net.hydromatic.treegen.sample.BinResult;
import net.hydromatic.treegen.tree.Tree;

/**
 * Measures how long it takes to evaluate the trees in each bin.
 *
 * <p>For each bin and each number of fitness cases, evaluates all of the bin's
 * trees {@code repeat} times and records the minimum time per evaluation.
 */
public class Profiler {
  private final double[][] cases;
  private final double[] target;
  private final List<Integer> fitnessCaseCounts;
  private final int repeat;

  /**
   * Creates a Profiler.
   *
   * <p>Draws fitness cases and targets uniformly from [0, 1) using {@code
   * random}, enough for the largest number of fitness cases.
   *
   * @param variableCount Number of variables in each fitness case
   * @param fitnessCaseCounts Numbers of fitness cases to profile
   * @param repeat Number of timed runs for each measurement
   * @param random Random stream
   */
  public Profiler(int variableCount, List<Integer> fitnessCaseCounts,
      int repeat, Random random) {
    checkArgument(!fitnessCaseCounts.isEmpty(), "no fitness case counts");
    checkArgument(repeat > 0, "repeat must be positive");
    this.fitnessCaseCounts = ImmutableList.copyOf(fitnessCaseCounts);
    this.repeat = repeat;
    final int maxCount =
        this.fitnessCaseCounts.stream().mapToInt(i -> i).max().getAsInt();
    checkArgument(maxCount > 0, "fitness case count must be positive");
    this.cases = new double[maxCount][variableCount];
    for (double[] fitnessCase : cases) {
      for (int j = 0; j < variableCount; j++) {
        fitnessCase[j] = random.nextDouble();
      }
    }
    this.target = new double[maxCount];
    for (int i = 0; i < maxCount; i++) {
      target[i] = random.nextDouble();
    }
  }

  /**
   * Profiles every bin.
   *
   * @return Table whose rows are bin indexes, columns are numbers of fitness
   *     cases, and values are minimum runtimes in seconds
   */
  public Table<Integer, Integer, Double> profile(
      Map<Integer, BinResult> results) {
    final ImmutableTable.Builder<Integer, Integer, Double> table =
        ImmutableTable.builder();
    for (int count : fitnessCaseCounts) {
      final double[][] someCases = Arrays.copyOf(cases, count);
      final double[] someTarget = Arrays.copyOf(target, count);
      for (BinResult result : results.values()) {
        final List<Tree> trees =
            result.samples.stream()
                .map(sample -> sample.tree)
                .collect(ImmutableList.toImmutableList());
        table.put(result.index, count, time(trees, someCases, someTarget));
      }
    }
    return table.build();
  }

  /** Returns the minimum time, in seconds, to evaluate some trees. */
  double time(List<Tree> trees, double[][] someCases, double[] someTarget) {
    requireNonNull(trees, "trees");
    long min = Long.MAX_VALUE;
    for (int i = 0; i < repeat; i++) {
      final Stopwatch stopwatch = Stopwatch.createStarted();
      Fitness.evaluate(trees, someCases, someTarget);
      min = Math.min(min, stopwatch.elapsed(TimeUnit.NANOSECONDS));
    }
    return min / 1e9;
  }
}

// End Profiler.java
