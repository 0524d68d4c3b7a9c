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

import net.hydromatic.treegen.tree.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while building and sampling trees. */
public interface Tracer {
  /**
   * Called when the builder pops an obligation, with the number of nodes
   * placed so far and the number of obligations still on the stack.
   */
  void onResolve(Obligation obligation, int placed, int pending);

  /** Called when the builder completes a tree that satisfies its bounds. */
  void onTree(Tree tree);

  /**
   * Called when the builder gives up. The obligation is the node for which no
   * function was feasible, or null if the tree was completed but fell short
   * of its minimum size or depth.
   */
  void onInfeasible(@Nullable Obligation obligation);

  /**
   * Called when the sampler has tried to add a tree to a bin. The tree is null
   * if the builder failed; {@code accepted} is false if the tree was a
   * duplicate or the bin was full.
   */
  void onSample(int bin, @Nullable Tree tree, boolean accepted);

  /** Called when the sampler has finished with a bin. */
  void onBin(int bin, int attempts, int count, boolean filled);
}

// End Tracer.java
