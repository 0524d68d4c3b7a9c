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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.treegen.util.Static.filterEager;

import com.google.common.math.LongMath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;
import net.hydromatic.treegen.alphabet.Symbol.Primitive;
import net.hydromatic.treegen.alphabet.Symbol.Terminal;
import net.hydromatic.treegen.tree.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds random trees whose depth and size lie within given bounds.
 *
 * <p>The builder keeps a stack of {@link Obligation}s, one per node that is
 * yet to be placed, and resolves them in prefix order. Before it places a
 * function, it checks that the function cannot push the tree over its maximum
 * size, and (when aiming for a size) that the desired size is still reachable
 * if every pending node grew into a complete subtree.
 *
 * <p>All randomness comes from the {@link Random} given to the constructor,
 * in a fixed order, so a builder created with the same seed builds the same
 * sequence of trees. A builder is not thread-safe.
 */
public class TreeBuilder {
  private final PrimitiveSet primitiveSet;
  private final Random random;
  private final Tracer tracer;

  /** Creates a TreeBuilder. */
  public TreeBuilder(PrimitiveSet primitiveSet, Random random, Tracer tracer) {
    this.primitiveSet = requireNonNull(primitiveSet, "primitiveSet");
    this.random = requireNonNull(random, "random");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a TreeBuilder that does not trace. */
  public TreeBuilder(PrimitiveSet primitiveSet, Random random) {
    this(primitiveSet, random, Tracers.empty());
  }

  /**
   * Builds a tree using the {@link Strategy#GROW grow} strategy, returning the
   * primitive set's return type.
   *
   * @see #build(Strategy, int, int, int, int, TargetMode, String)
   */
  public @Nullable Tree build(
      int minDepth, int maxDepth, int minSize, int maxSize, TargetMode mode) {
    return build(Strategy.GROW, minDepth, maxDepth, minSize, maxSize, mode,
        null);
  }

  /**
   * Builds a tree, or returns null if the builder reached a state from which
   * no tree within bounds could be completed.
   *
   * <p>Null is a common outcome when the bounds are tight; the caller may
   * simply try again, since the next attempt makes fresh random choices.
   *
   * @param strategy Strategy
   * @param minDepth Minimum depth, at least 0
   * @param maxDepth Maximum depth, at least {@code minDepth}
   * @param minSize Minimum size, at least 1
   * @param maxSize Maximum size, at least {@code minSize}
   * @param mode Whether to aim for a random depth or a random size; {@link
   *     Strategy#FULL} always aims for a depth
   * @param retType Return type, or null for the primitive set's return type
   * @return Tree, or null
   * @throws IllegalArgumentException if the bounds are invalid or there are no
   *     terminals of the return type; no random draws have been made
   * @throws TreeInvariantException if the builder produced a tree that
   *     exceeds its maximum bounds
   */
  public @Nullable Tree build(
      Strategy strategy,
      int minDepth,
      int maxDepth,
      int minSize,
      int maxSize,
      TargetMode mode,
      @Nullable String retType) {
    checkArgument(
        0 <= minDepth && minDepth <= maxDepth,
        "invalid depth bounds [%s, %s]",
        minDepth,
        maxDepth);
    checkArgument(
        1 <= minSize && minSize <= maxSize,
        "invalid size bounds [%s, %s]",
        minSize,
        maxSize);
    final String type = retType != null ? retType : primitiveSet.retType();
    final List<Terminal> terminals = primitiveSet.terminals(type);
    checkArgument(
        !terminals.isEmpty(),
        "primitive set %s has no terminals of type %s",
        primitiveSet.name,
        type);

    final Strategy resolved = strategy.resolve(random);
    final TargetMode targetMode =
        resolved == Strategy.FULL ? TargetMode.BY_DEPTH : mode;
    final int desired =
        targetMode == TargetMode.BY_DEPTH
            ? randInt(minDepth, maxDepth)
            : randInt(minSize, maxSize);
    final Generation g =
        new Generation(
            resolved,
            terminals,
            primitiveSet.functions(type),
            minDepth,
            maxDepth,
            minSize,
            maxSize,
            targetMode,
            desired);
    return g.run();
  }

  /** Returns a random integer in the range [lo, hi], inclusive. */
  private int randInt(int lo, int hi) {
    return lo + random.nextInt(hi - lo + 1);
  }

  /** State of the construction of one tree. */
  private class Generation {
    final Strategy strategy;
    final List<Terminal> terminals;
    final List<Primitive> functions;
    final int minDepth;
    final int maxDepth;
    final int minSize;
    final int maxSize;
    final TargetMode mode;
    final int desired;

    final Deque<Obligation> stack = new ArrayDeque<>();
    final List<Symbol> nodes = new ArrayList<>();

    Generation(
        Strategy strategy,
        List<Terminal> terminals,
        List<Primitive> functions,
        int minDepth,
        int maxDepth,
        int minSize,
        int maxSize,
        TargetMode mode,
        int desired) {
      this.strategy = strategy;
      this.terminals = terminals;
      this.functions = functions;
      this.minDepth = minDepth;
      this.maxDepth = maxDepth;
      this.minSize = minSize;
      this.maxSize = maxSize;
      this.mode = mode;
      this.desired = desired;
    }

    @Nullable Tree run() {
      stack.push(new Obligation(0, 1));
      int size = 0;
      while (!stack.isEmpty()) {
        final Obligation obligation = stack.pop();
        tracer.onResolve(obligation, nodes.size(), stack.size());
        size = obligation.size;
        if (isTerminal(obligation)) {
          placeTerminal(obligation);
        } else if (!placeFunction(obligation)) {
          tracer.onInfeasible(obligation);
          return null;
        }
      }
      return finish(size);
    }

    /**
     * Places a terminal, then copies this obligation's size into the next
     * obligation on the stack.
     *
     * <p>The next obligation was pushed when its parent was placed, and its
     * size does not count nodes that were placed since then in the subtrees of
     * its earlier siblings. This obligation's size does, so the next
     * obligation takes it over.
     */
    void placeTerminal(Obligation obligation) {
      final Terminal terminal =
          terminals.get(random.nextInt(terminals.size()));
      nodes.add(terminal.materialize(random));
      if (!stack.isEmpty()) {
        final Obligation next = stack.pop();
        stack.push(next.withSize(obligation.size));
      }
    }

    /**
     * Places a random feasible function and pushes one obligation per
     * argument. Returns false if no function is feasible.
     */
    boolean placeFunction(Obligation obligation) {
      final int depth = obligation.depth;
      final int size = obligation.size;
      List<Primitive> candidates = arityFeasible(size);
      if (!candidates.isEmpty() && mode == TargetMode.BY_SIZE) {
        // Keep functions after which the desired size is still reachable,
        // assuming that the new node's arguments and every pending obligation
        // grow into complete subtrees.
        final int maxArity = maxArity(candidates);
        final long subtree = Sizes.maxSize(maxArity, maxDepth - (depth + 1));
        final long rest = Sizes.remainingBudget(stack, maxArity, maxDepth);
        candidates =
            filterEager(
                candidates,
                f ->
                    plus(size, LongMath.saturatedMultiply(f.arity(), subtree),
                        rest) >= desired);
      }
      if (candidates.isEmpty()) {
        return false;
      }
      final Primitive function =
          candidates.get(random.nextInt(candidates.size()));
      nodes.add(function);
      final Obligation argument =
          new Obligation(depth + 1, size + function.arity());
      for (int i = 0; i < function.arity(); i++) {
        stack.push(argument);
      }
      return true;
    }

    /** Decides whether the node for an obligation is a terminal. */
    boolean isTerminal(Obligation obligation) {
      final int depth = obligation.depth;
      final int size = obligation.size;
      final List<Primitive> validFunctions = arityFeasible(size);
      if (validFunctions.isEmpty() || depth == maxDepth || size == maxSize) {
        return true;
      }
      switch (strategy) {
        case FULL:
          return depth >= desired;

        case GROW:
          if (mode == TargetMode.BY_DEPTH
              ? depth == desired
              : size >= desired) {
            return true;
          }
          if (depth < minDepth || size < minSize) {
            return false;
          }
          if (mode == TargetMode.BY_SIZE) {
            final long possibleSize =
                LongMath.saturatedAdd(
                    size,
                    Sizes.remainingBudget(
                        stack, maxArity(validFunctions), maxDepth));
            if (possibleSize < desired) {
              return false;
            }
          }
          return random.nextDouble() < primitiveSet.terminalRatio();

        default:
          throw new AssertionError(strategy);
      }
    }

    /** Returns the functions that keep the tree within its maximum size. */
    List<Primitive> arityFeasible(int size) {
      return filterEager(functions, f -> size + f.arity() <= maxSize);
    }

    /**
     * Converts the nodes to a tree and checks it against the bounds.
     *
     * @param size Size recorded by the last obligation
     */
    @Nullable Tree finish(int size) {
      final Tree tree = new Tree(nodes);
      if (tree.size() != size) {
        throw new TreeInvariantException(
            "builder counted " + size + " nodes but tree has " + tree.size()
                + ": " + tree);
      }
      if (tree.depth() > maxDepth || tree.size() > maxSize) {
        throw new TreeInvariantException(
            "tree " + tree + " has depth " + tree.depth() + " and size "
                + tree.size() + ", exceeding maximum depth " + maxDepth
                + " and size " + maxSize);
      }
      if (tree.depth() < minDepth || tree.size() < minSize) {
        // The desired value was not reachable from the choices made; for
        // example, a tree of binary functions always has an odd size.
        tracer.onInfeasible(null);
        return null;
      }
      tracer.onTree(tree);
      return tree;
    }
  }

  /** Returns the sum of three sizes, saturating at {@link Long#MAX_VALUE}. */
  private static long plus(long size0, long size1, long size2) {
    return LongMath.saturatedAdd(LongMath.saturatedAdd(size0, size1), size2);
  }

  /** Returns the largest arity of a list of functions, or 1 if it is empty. */
  private static int maxArity(List<Primitive> functions) {
    int maxArity = 1;
    for (Primitive function : functions) {
      maxArity = Math.max(maxArity, function.arity());
    }
    return maxArity;
  }
}

// End TreeBuilder.java
