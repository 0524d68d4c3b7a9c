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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.tree.Tree;
import net.hydromatic.treegen.tree.UsageCounts;

/**
 * Mutable collection of trees for one size bin.
 *
 * <p>Accepts a tree only if it is not full and does not already contain a
 * tree with the same canonical form. Once full, never changes.
 */
class Bin {
  final int index;
  final Range<Integer> sizeRange;
  final int target;
  private final PrimitiveSet primitiveSet;
  private final Map<String, BinResult.Sample> samples = new LinkedHashMap<>();
  private UsageCounts usage;
  int attempts;
  int infeasible;

  Bin(
      int index,
      Range<Integer> sizeRange,
      int target,
      PrimitiveSet primitiveSet) {
    checkArgument(target >= 0, "negative target");
    this.index = index;
    this.sizeRange = requireNonNull(sizeRange, "sizeRange");
    this.target = target;
    this.primitiveSet = requireNonNull(primitiveSet, "primitiveSet");
    this.usage = UsageCounts.zero(primitiveSet);
  }

  boolean isFull() {
    return samples.size() >= target;
  }

  int count() {
    return samples.size();
  }

  /**
   * Adds a tree if the bin is not full and the tree is new. Returns whether
   * the tree was added.
   */
  boolean add(Tree tree) {
    checkArgument(
        sizeRange.contains(tree.size()),
        "tree of size %s does not belong in bin %s",
        tree.size(),
        sizeRange);
    if (isFull()) {
      return false;
    }
    final String program = tree.toString();
    if (samples.containsKey(program)) {
      return false;
    }
    final UsageCounts treeUsage = tree.usage(primitiveSet);
    samples.put(program, new BinResult.Sample(tree, treeUsage));
    usage = usage.plus(treeUsage);
    return true;
  }

  BinResult toResult() {
    return new BinResult(
        index,
        sizeRange,
        target,
        ImmutableList.copyOf(samples.values()),
        usage,
        attempts,
        infeasible);
  }
}

// End Bin.java
