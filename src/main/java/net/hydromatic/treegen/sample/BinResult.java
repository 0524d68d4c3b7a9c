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
package net.hydromatic.treegen.sample;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Collection;
import java.util.List;
import net.hydromatic.treegen.tree.Tree;
import net.hydromatic.treegen.tree.UsageCounts;

/**
 * Trees collected for one size bin, and statistics about them.
 *
 * <p>Immutable; created by {@link BinSampler}.
 */
public class BinResult {
  public final int index;
  /** Sizes that trees in this bin may have. */
  public final Range<Integer> sizeRange;
  /** Number of trees requested. */
  public final int target;
  /** Distinct trees, in the order they were accepted. */
  public final ImmutableList<Sample> samples;
  /** Sum of the symbol counts of all accepted trees. */
  public final UsageCounts usage;
  /** Number of times the builder was called. */
  public final int attempts;
  /** Number of times the builder found no tree within bounds. */
  public final int infeasible;

  BinResult(
      int index,
      Range<Integer> sizeRange,
      int target,
      List<Sample> samples,
      UsageCounts usage,
      int attempts,
      int infeasible) {
    this.index = index;
    this.sizeRange = requireNonNull(sizeRange, "sizeRange");
    this.target = target;
    this.samples = ImmutableList.copyOf(samples);
    this.usage = requireNonNull(usage, "usage");
    this.attempts = attempts;
    this.infeasible = infeasible;
  }

  /** Returns whether the bin holds as many trees as were requested. */
  public boolean filled() {
    return samples.size() == target;
  }

  /** Returns the canonical strings of the trees, in acceptance order. */
  public List<String> programs() {
    return samples.stream()
        .map(sample -> sample.program)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return "bin " + index + " " + sizeRange + ": " + samples.size() + "/"
        + target + (filled() ? "" : " (not filled)");
  }

  /** Returns whether every bin in a collection is filled. */
  public static boolean allFilled(Collection<BinResult> results) {
    return results.stream().allMatch(BinResult::filled);
  }

  /** Tree that was accepted into a bin. */
  public static class Sample {
    public final Tree tree;
    /** Canonical form of {@link #tree}. */
    public final String program;
    public final int depth;
    public final int size;
    public final UsageCounts usage;

    Sample(Tree tree, UsageCounts usage) {
      this.tree = requireNonNull(tree, "tree");
      this.program = tree.toString();
      this.depth = tree.depth();
      this.size = tree.size();
      this.usage = requireNonNull(usage, "usage");
    }

    @Override
    public String toString() {
      return program;
    }
  }
}

// End BinResult.java
