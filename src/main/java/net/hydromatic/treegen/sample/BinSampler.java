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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Range;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.gen.Sizes;
import net.hydromatic.treegen.gen.Strategy;
import net.hydromatic.treegen.gen.TargetMode;
import net.hydromatic.treegen.gen.Tracer;
import net.hydromatic.treegen.gen.Tracers;
import net.hydromatic.treegen.gen.TreeBuilder;
import net.hydromatic.treegen.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects a sample of distinct trees for each of a series of size bins.
 *
 * <p>Sizes from 1 to the largest size that the alphabet allows at the given
 * depth are divided into bins of {@code binSize} consecutive sizes. For each
 * bin, the sampler asks a {@link TreeBuilder} for trees in that size range
 * until the bin holds the requested number of distinct trees, or the attempts
 * run out.
 *
 * <p>Each bin has its own random stream, seeded from the configured seed and
 * the bin index, so the result does not depend on the order in which bins are
 * sampled nor on the number of threads.
 */
public class BinSampler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(BinSampler.class);

  private final ConfigImpl config;

  /** Creates a BinSampler. */
  public BinSampler(Config config) {
    this.config = (ConfigImpl) requireNonNull(config, "config");
  }

  /** Returns the size ranges of the bins. */
  public static List<Range<Integer>> binRanges(
      PrimitiveSet primitiveSet, int maxDepth, int binSize) {
    checkArgument(
        primitiveSet.maxArity() > 0,
        "primitive set %s has no functions",
        primitiveSet.name);
    final long maxPossibleSize =
        Sizes.maxSize(primitiveSet.maxArity(), maxDepth);
    checkArgument(
        maxPossibleSize <= Integer.MAX_VALUE,
        "trees of depth %s over %s are too large to sample",
        maxDepth,
        primitiveSet.name);
    final int binCount = Sizes.binCount(maxPossibleSize, binSize);
    final ImmutableList.Builder<Range<Integer>> ranges =
        ImmutableList.builder();
    for (int i = 0; i < binCount; i++) {
      final int minSize = i * binSize + 1;
      final int maxSize = (int) Math.min((i + 1L) * binSize, maxPossibleSize);
      ranges.add(Range.closed(minSize, maxSize));
    }
    return ranges.build();
  }

  /**
   * Returns the random stream for a bin. Depends only on the seed and the bin
   * index.
   */
  public static Random binRandom(long seed, int bin) {
    final long binSeed =
        Hashing.murmur3_128().newHasher().putLong(seed).putInt(bin).hash()
            .asLong();
    return new Random(binSeed);
  }

  /**
   * Samples every bin.
   *
   * @param primitiveSet Alphabet
   * @param maxDepth Maximum depth of a tree
   * @param binSize Number of consecutive sizes in a bin
   * @param targetPerBin Number of distinct trees wanted in each bin
   * @return Result for each bin, keyed and sorted by bin index
   */
  public SortedMap<Integer, BinResult> sampleBins(
      PrimitiveSet primitiveSet, int maxDepth, int binSize, int targetPerBin) {
    checkArgument(targetPerBin >= 0, "negative target per bin");
    final List<Range<Integer>> ranges =
        binRanges(primitiveSet, maxDepth, binSize);
    final ImmutableSortedMap.Builder<Integer, BinResult> results =
        ImmutableSortedMap.naturalOrder();
    if (config.threads <= 1) {
      for (int i = 0; i < ranges.size(); i++) {
        results.put(i,
            sampleBin(primitiveSet, maxDepth, i, ranges.get(i), targetPerBin));
      }
    } else {
      final ExecutorService executor =
          Executors.newFixedThreadPool(
              config.threads,
              new ThreadFactoryBuilder()
                  .setNameFormat("treegen-bin-%d")
                  .setDaemon(true)
                  .build());
      try {
        final List<Future<BinResult>> futures = new ArrayList<>();
        for (int i = 0; i < ranges.size(); i++) {
          final int bin = i;
          futures.add(
              executor.submit(
                  () ->
                      sampleBin(primitiveSet, maxDepth, bin, ranges.get(bin),
                          targetPerBin)));
        }
        for (int i = 0; i < futures.size(); i++) {
          results.put(i, getUnchecked(futures.get(i)));
        }
      } finally {
        executor.shutdownNow();
      }
    }
    return results.build();
  }

  private static <T> T getUnchecked(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("interrupted while sampling", e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    }
  }

  /** Samples one bin. */
  public BinResult sampleBin(
      PrimitiveSet primitiveSet,
      int maxDepth,
      int index,
      Range<Integer> sizeRange,
      int targetPerBin) {
    final Tracer tracer = config.tracer;
    final Bin bin = new Bin(index, sizeRange, targetPerBin, primitiveSet);
    final TreeBuilder builder =
        new TreeBuilder(primitiveSet, binRandom(config.seed, index), tracer);
    final int minSize = sizeRange.lowerEndpoint();
    final int maxSize = sizeRange.upperEndpoint();
    // A tree of one node has depth 0; any larger tree has depth at least 1.
    final int minDepth = minSize == 1 ? 0 : Math.min(1, maxDepth);
    for (int j = 0; j < targetPerBin && !bin.isFull(); j++) {
      for (int attempt = 0; attempt < config.maxAttempts; attempt++) {
        ++bin.attempts;
        final Tree tree =
            builder.build(config.strategy, minDepth, maxDepth, minSize,
                maxSize, config.targetMode, null);
        if (tree == null) {
          ++bin.infeasible;
          tracer.onSample(index, null, false);
          continue;
        }
        final boolean accepted = bin.add(tree);
        tracer.onSample(index, tree, accepted);
        if (accepted) {
          break;
        }
      }
    }
    final BinResult result = bin.toResult();
    tracer.onBin(index, result.attempts, result.samples.size(),
        result.filled());
    if (result.filled()) {
      LOGGER.debug("{} filled after {} attempts", result, result.attempts);
    } else {
      LOGGER.info("{} after {} attempts, {} infeasible", result,
          result.attempts, result.infeasible);
    }
    return result;
  }

  /** Sampler configuration. */
  public interface Config {
    Config DEFAULT =
        new ConfigImpl(37L, 1, Strategy.GROW, TargetMode.BY_SIZE, 1,
            Tracers.empty());

    /** Sets the seed from which each bin's random stream is derived. */
    Config withSeed(long seed);

    /**
     * Sets the number of times to call the builder for each requested tree.
     * The default, 1, gives up on a tree as soon as the builder fails or
     * returns a duplicate.
     */
    Config withMaxAttempts(int maxAttempts);

    Config withStrategy(Strategy strategy);

    Config withTargetMode(TargetMode targetMode);

    /**
     * Sets the number of threads. Bins are sampled in parallel if there is
     * more than one, and the tracer must then be thread-safe.
     */
    Config withThreads(int threads);

    Config withTracer(Tracer tracer);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final long seed;
    private final int maxAttempts;
    private final Strategy strategy;
    private final TargetMode targetMode;
    private final int threads;
    private final Tracer tracer;

    private ConfigImpl(long seed, int maxAttempts, Strategy strategy,
        TargetMode targetMode, int threads, Tracer tracer) {
      checkArgument(maxAttempts >= 1, "max attempts must be positive");
      checkArgument(threads >= 1, "threads must be positive");
      this.seed = seed;
      this.maxAttempts = maxAttempts;
      this.strategy = requireNonNull(strategy, "strategy");
      this.targetMode = requireNonNull(targetMode, "targetMode");
      this.threads = threads;
      this.tracer = requireNonNull(tracer, "tracer");
    }

    @Override public ConfigImpl withSeed(long seed) {
      if (this.seed == seed) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }

    @Override public ConfigImpl withMaxAttempts(int maxAttempts) {
      if (this.maxAttempts == maxAttempts) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }

    @Override public ConfigImpl withStrategy(Strategy strategy) {
      if (this.strategy == strategy) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }

    @Override public ConfigImpl withTargetMode(TargetMode targetMode) {
      if (this.targetMode == targetMode) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }

    @Override public ConfigImpl withThreads(int threads) {
      if (this.threads == threads) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }

    @Override public ConfigImpl withTracer(Tracer tracer) {
      if (this.tracer == tracer) {
        return this;
      }
      return new ConfigImpl(seed, maxAttempts, strategy, targetMode, threads,
          tracer);
    }
  }
}

// End BinSampler.java
